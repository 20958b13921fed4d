package leadflow.workflow.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import leadflow.workflow.api.Controller;
import leadflow.workflow.api.v1.dto.HealthResponse;
import leadflow.workflow.model.JobStatus;
import leadflow.workflow.service.WorkflowService;
import leadflow.workflow.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";
    private static final int STATUS_COUNT_LIMIT = 1000;

    private final Database database;
    private final WorkflowService workflowService;

    public HealthController(Database database, WorkflowService workflowService) {
        this.database = database;
        this.workflowService = workflowService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) throws Exception {
        HealthResponse response;
        if (!database.isHealthy()) {
            response = HealthResponse.unhealthy("connection failed");
        } else {
            try {
                response = HealthResponse.healthy(formatUptime(), VERSION,
                        workflowService.countRecords(),
                        countJobs(JobStatus.RUNNING),
                        countJobs(JobStatus.PAUSED));
            } catch (RuntimeException e) {
                log.error("Health check failed", e);
                response = HealthResponse.unhealthy(e.getMessage());
            }
        }
        HttpResponseStatus status = "healthy".equals(response.status())
                ? HttpResponseStatus.OK
                : HttpResponseStatus.SERVICE_UNAVAILABLE;
        return ControllerResponse.of(status, response);
    }

    private int countJobs(JobStatus status) {
        return workflowService.listJobs(status, STATUS_COUNT_LIMIT).size();
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
