package leadflow.workflow.enrichment;

import leadflow.workflow.model.EnrichmentResult;
import leadflow.workflow.model.Job;
import leadflow.workflow.model.Outcome;
import leadflow.workflow.model.SourceRecord;
import leadflow.workflow.model.VerificationResult;
import leadflow.workflow.repository.RecordRepository;
import leadflow.workflow.repository.VerificationResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

/**
 * Verifies a lead's source link.
 *
 * <ul>
 * <li>no link: FAILED</li>
 * <li>checked within the recheck window: SKIPPED</li>
 * <li>redirected to a different final URL: UPDATED, the record keeps the new URL</li>
 * <li>reachable at the same URL: NO_CHANGE</li>
 * <li>HTTP error status or I/O failure: FAILED</li>
 * </ul>
 * One verification result is written per record.
 */
public class LinkCheckCapability implements EnrichmentCapability {

    private static final Logger log = LoggerFactory.getLogger(LinkCheckCapability.class);

    private final HttpClient httpClient;
    private final RecordRepository recordRepository;
    private final VerificationResultRepository resultRepository;
    private final Duration timeout;
    private final Duration recheckAfter;

    public LinkCheckCapability(RecordRepository recordRepository,
            VerificationResultRepository resultRepository,
            Duration timeout,
            Duration recheckAfter) {
        this(HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), recordRepository, resultRepository, timeout, recheckAfter);
    }

    public LinkCheckCapability(HttpClient httpClient,
            RecordRepository recordRepository,
            VerificationResultRepository resultRepository,
            Duration timeout,
            Duration recheckAfter) {
        this.httpClient = httpClient;
        this.recordRepository = recordRepository;
        this.resultRepository = resultRepository;
        this.timeout = timeout;
        this.recheckAfter = recheckAfter;
    }

    @Override
    public EnrichmentResult enrich(Job job, SourceRecord record) throws InterruptedException {
        long startNanos = System.nanoTime();
        Instant now = Instant.now();

        EnrichmentResult result;
        String newUrl = null;

        if (!record.hasSourceUrl()) {
            result = EnrichmentResult.failed("Lead has no source URL");
        } else if (record.lastCheckedAt() != null && record.lastCheckedAt().isAfter(now.minus(recheckAfter))) {
            result = EnrichmentResult.skipped("Checked recently at " + record.lastCheckedAt());
        } else {
            try {
                HttpRequest request = HttpRequest.newBuilder(URI.create(record.sourceUrl().trim()))
                        .timeout(timeout)
                        .GET()
                        .build();
                HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());

                int status = response.statusCode();
                String finalUrl = response.uri().toString();
                if (status >= 400) {
                    recordRepository.markChecked(record.id(), now);
                    result = EnrichmentResult.failed("HTTP " + status + " from " + finalUrl);
                } else if (!finalUrl.equals(record.sourceUrl())) {
                    recordRepository.updateSourceUrl(record.id(), finalUrl, now);
                    newUrl = finalUrl;
                    result = EnrichmentResult.updated("Link moved to " + finalUrl);
                } else {
                    recordRepository.markChecked(record.id(), now);
                    result = EnrichmentResult.noChange("HTTP " + status);
                }
            } catch (IllegalArgumentException e) {
                result = EnrichmentResult.failed("Invalid URL: " + record.sourceUrl());
            } catch (IOException e) {
                result = EnrichmentResult.failed("Request failed: "
                        + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            }
        }

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        resultRepository.save(VerificationResult.builder()
                .jobId(job.id())
                .recordId(record.id())
                .outcome(result.outcome())
                .beforeValue(record.sourceUrl())
                .afterValue(newUrl)
                .detail(result.detail())
                .durationMs(durationMs)
                .error(result.outcome() == Outcome.FAILED ? result.detail() : null)
                .verifiedAt(Instant.now())
                .build());

        log.debug("Job {}: record {} -> {} ({} ms)", job.id(), record.id(), result.outcome(), durationMs);
        return result;
    }
}
