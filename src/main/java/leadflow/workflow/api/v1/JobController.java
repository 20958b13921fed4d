package leadflow.workflow.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import leadflow.workflow.api.Controller;
import leadflow.workflow.api.v1.dto.JobResponse;
import leadflow.workflow.api.v1.dto.JobStatsResponse;
import leadflow.workflow.api.v1.dto.OperationResponse;
import leadflow.workflow.api.v1.dto.ResumeRunRequest;
import leadflow.workflow.api.v1.dto.StartRunRequest;
import leadflow.workflow.api.v1.dto.VerificationResultResponse;
import leadflow.workflow.model.Job;
import leadflow.workflow.model.JobStatus;
import leadflow.workflow.model.Outcome;
import leadflow.workflow.server.RouterHandler;
import leadflow.workflow.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for workflow jobs (public API).
 *
 * POST /api/v1/jobs - Start a run
 * GET /api/v1/jobs - List jobs (?status=&limit=)
 * GET /api/v1/jobs/{jobId} - Get job status
 * DELETE /api/v1/jobs/{jobId} - Delete a finished job
 * POST /api/v1/jobs/{jobId}/resume - Resume from the stored cursor
 * POST /api/v1/jobs/{jobId}/cancel - Request cancellation
 * POST /api/v1/jobs/{jobId}/signal - Deliver the resume signal to a paused run
 * GET /api/v1/jobs/{jobId}/results - Verification results (?outcome=&limit=)
 * GET /api/v1/jobs/{jobId}/stats - Result counts per outcome
 * GET /api/v1/jobs/{jobId}/errors - Recent record errors
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_ACTION_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/(resume|cancel|signal)$");
    private static final Pattern JOB_QUERY_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/(results|stats|errors)$");

    private final WorkflowService workflowService;

    public JobController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return JOBS_PATTERN.matcher(path).matches() || JOB_ACTION_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return JOBS_PATTERN.matcher(path).matches()
                    || JOB_BY_ID_PATTERN.matcher(path).matches()
                    || JOB_QUERY_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return JOB_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) throws Exception {
        HttpMethod method = req.method();

        if (JOBS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) ? handleStartRun(req) : handleListJobs(req);
        }

        Matcher actionMatcher = JOB_ACTION_PATTERN.matcher(path);
        if (actionMatcher.matches()) {
            String jobId = actionMatcher.group(1);
            return switch (actionMatcher.group(2)) {
                case "resume" -> handleResume(jobId, req);
                case "cancel" -> ControllerResponse.ok(JobResponse.from(workflowService.cancelRun(jobId)));
                default -> ControllerResponse.ok(OperationResponse.signal(workflowService.deliverResumeSignal(jobId)));
            };
        }

        Matcher queryMatcher = JOB_QUERY_PATTERN.matcher(path);
        if (queryMatcher.matches()) {
            String jobId = queryMatcher.group(1);
            return switch (queryMatcher.group(2)) {
                case "results" -> handleGetResults(jobId, req);
                case "stats" -> ControllerResponse.ok(JobStatsResponse.from(workflowService.getJobStats(jobId)));
                default -> handleGetErrors(jobId);
            };
        }

        Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
        if (jobMatcher.matches()) {
            String jobId = jobMatcher.group(1);
            if (method.equals(HttpMethod.DELETE)) {
                workflowService.deleteJob(jobId);
                log.info("Job {} deleted via API", jobId);
                return ControllerResponse.ok(OperationResponse.success());
            }
            return ControllerResponse.ok(JobResponse.from(workflowService.getJobStatus(jobId)));
        }

        return ControllerResponse.notFound("unknown job endpoint");
    }

    /**
     * POST /api/v1/jobs - Start a run
     */
    private ControllerResponse handleStartRun(FullHttpRequest req) throws Exception {
        String body = Controller.body(req);
        StartRunRequest request = body.isBlank()
                ? StartRunRequest.defaults()
                : RouterHandler.mapper().readValue(body, StartRunRequest.class);

        request.validate();

        Job job = workflowService.startRun(
                request.batchSize(),
                request.processingOrder(),
                request.maxBatches(),
                request.isReviewRequired(),
                request.startedBy());

        log.info("Job {} started via API by {}", job.id(), job.startedBy());
        return ControllerResponse.created(Map.of(
                "success", true,
                "jobId", job.id(),
                "totalRecords", job.totalRecords()));
    }

    /**
     * GET /api/v1/jobs - List jobs
     */
    private ControllerResponse handleListJobs(FullHttpRequest req) throws Exception {
        String status = Controller.queryParam(req, "status");
        Integer limit = Controller.intParam(req, "limit");

        List<JobResponse> jobs = workflowService
                .listJobs(status != null && !status.isBlank() ? JobStatus.parse(status) : null, limit)
                .stream()
                .map(job -> JobResponse.from(job).compact())
                .toList();

        return ControllerResponse.ok(Map.of(
                "total", jobs.size(),
                "jobs", jobs));
    }

    /**
     * POST /api/v1/jobs/{jobId}/resume
     */
    private ControllerResponse handleResume(String jobId, FullHttpRequest req) throws Exception {
        String body = Controller.body(req);
        ResumeRunRequest request = body.isBlank()
                ? new ResumeRunRequest(null)
                : RouterHandler.mapper().readValue(body, ResumeRunRequest.class);
        request.validate();

        Job job = workflowService.resumeRun(jobId, request.maxBatches());
        return ControllerResponse.accepted(JobResponse.from(job));
    }

    /**
     * GET /api/v1/jobs/{jobId}/results
     */
    private ControllerResponse handleGetResults(String jobId, FullHttpRequest req) throws Exception {
        Outcome outcome = Outcome.fromWire(Controller.queryParam(req, "outcome"));
        Integer limit = Controller.intParam(req, "limit");

        List<VerificationResultResponse> results = workflowService.listResults(jobId, outcome, limit).stream()
                .map(VerificationResultResponse::from)
                .toList();

        return ControllerResponse.ok(Map.of(
                "jobId", jobId,
                "total", results.size(),
                "results", results));
    }

    /**
     * GET /api/v1/jobs/{jobId}/errors
     */
    private ControllerResponse handleGetErrors(String jobId) throws Exception {
        List<JobResponse.ErrorEntry> errors = workflowService.getJobErrors(jobId).stream()
                .map(JobResponse.ErrorEntry::from)
                .toList();

        return ControllerResponse.ok(Map.of(
                "jobId", jobId,
                "total", errors.size(),
                "errors", errors));
    }
}
