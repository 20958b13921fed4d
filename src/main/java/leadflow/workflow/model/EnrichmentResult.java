package leadflow.workflow.model;

import java.util.Objects;

/**
 * Tagged result of the enrichment capability for a single record.
 *
 * @param outcome closed outcome tag
 * @param detail  human-readable reasoning or error text, may be null
 */
public record EnrichmentResult(Outcome outcome, String detail) {

    public EnrichmentResult {
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public static EnrichmentResult updated(String detail) {
        return new EnrichmentResult(Outcome.UPDATED, detail);
    }

    public static EnrichmentResult skipped(String detail) {
        return new EnrichmentResult(Outcome.SKIPPED, detail);
    }

    public static EnrichmentResult noChange(String detail) {
        return new EnrichmentResult(Outcome.NO_CHANGE, detail);
    }

    public static EnrichmentResult failed(String detail) {
        return new EnrichmentResult(Outcome.FAILED, detail);
    }
}
