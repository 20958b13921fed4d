package leadflow.workflow.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import leadflow.workflow.api.Controller;
import leadflow.workflow.api.v1.dto.IngestRecordsRequest;
import leadflow.workflow.api.v1.dto.OperationResponse;
import leadflow.workflow.api.v1.dto.RecordVerificationResponse;
import leadflow.workflow.server.RouterHandler;
import leadflow.workflow.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the lead collection.
 *
 * POST /api/v1/records - Add leads
 * GET /api/v1/records/count - Collection size
 * POST /api/v1/records/{id}/verify - Check one lead now
 */
public class RecordController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(RecordController.class);

    private static final String RECORDS_PATH = "/api/v1/records";
    private static final String COUNT_PATH = "/api/v1/records/count";
    private static final Pattern VERIFY_PATH = Pattern.compile("^/api/v1/records/([^/]+)/verify$");

    private final WorkflowService workflowService;

    public RecordController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return RECORDS_PATH.equals(path) || VERIFY_PATH.matcher(path).matches();
        }
        return method.equals(HttpMethod.GET) && COUNT_PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) throws Exception {
        if (!req.method().equals(HttpMethod.POST)) {
            return ControllerResponse.ok(OperationResponse.count(workflowService.countRecords()));
        }

        Matcher verify = VERIFY_PATH.matcher(path);
        if (verify.matches()) {
            return ControllerResponse.ok(RecordVerificationResponse.from(workflowService.verifyRecord(verify.group(1))));
        }

        String body = Controller.body(req);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        IngestRecordsRequest request = RouterHandler.mapper().readValue(body, IngestRecordsRequest.class);
        request.validate();

        int stored = workflowService.ingestRecords(request.toModels());
        log.info("Ingested {} records", stored);
        return ControllerResponse.created(OperationResponse.count(stored));
    }
}
