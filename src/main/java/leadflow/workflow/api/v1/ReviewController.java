package leadflow.workflow.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import leadflow.workflow.api.Controller;
import leadflow.workflow.api.v1.dto.RecordResponse;
import leadflow.workflow.model.SourceRecord;
import leadflow.workflow.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the pending review set of a job.
 *
 * GET /api/v1/jobs/{jobId}/reviews - Records awaiting review
 * POST /api/v1/jobs/{jobId}/reviews/{recordId}/accept - Mark viable
 * POST /api/v1/jobs/{jobId}/reviews/{recordId}/reject - Mark not viable
 */
public class ReviewController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(ReviewController.class);

    private static final Pattern REVIEWS_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/reviews$");
    private static final Pattern DECISION_PATTERN = Pattern
            .compile("^/api/v1/jobs/([^/]+)/reviews/([^/]+)/(accept|reject)$");

    private final WorkflowService workflowService;

    public ReviewController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return REVIEWS_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.POST)) {
            return DECISION_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) throws Exception {
        Matcher listMatcher = REVIEWS_PATTERN.matcher(path);
        if (listMatcher.matches()) {
            return handleList(listMatcher.group(1));
        }

        Matcher decisionMatcher = DECISION_PATTERN.matcher(path);
        if (!decisionMatcher.matches()) {
            return ControllerResponse.notFound("unknown review endpoint");
        }
        String jobId = decisionMatcher.group(1);
        String recordId = decisionMatcher.group(2);
        boolean accept = "accept".equals(decisionMatcher.group(3));
        return handleDecision(jobId, recordId, accept);
    }

    private ControllerResponse handleList(String jobId) throws Exception {
        List<RecordResponse> pending = workflowService.listPendingReviews(jobId).stream()
                .map(RecordResponse::from)
                .toList();

        return ControllerResponse.ok(Map.of(
                "jobId", jobId,
                "total", pending.size(),
                "records", pending));
    }

    private ControllerResponse handleDecision(String jobId, String recordId, boolean accept) throws Exception {
        SourceRecord record = accept
                ? workflowService.acceptReview(jobId, recordId)
                : workflowService.rejectReview(jobId, recordId);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("ok", true);
        response.put("jobId", jobId);
        response.put("recordId", recordId);
        if (record != null) {
            response.put("record", RecordResponse.from(record));
        }
        log.info("Review of {} in job {}: {}", recordId, jobId, accept ? "accepted" : "rejected");
        return ControllerResponse.ok(response);
    }
}
