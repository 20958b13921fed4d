package leadflow.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for command endpoints.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("error") String error,
        @JsonProperty("delivered") Boolean delivered,
        @JsonProperty("count") Integer count) {
    /** Success response */
    public static OperationResponse success() {
        return new OperationResponse(true, null, null, null);
    }

    /** Signal delivery outcome; an unmatched signal is not an error */
    public static OperationResponse signal(boolean delivered) {
        return new OperationResponse(true, null, delivered, null);
    }

    /** Success with a count (ingested records, total records) */
    public static OperationResponse count(int count) {
        return new OperationResponse(true, null, null, count);
    }

    /** Error response */
    public static OperationResponse error(String error) {
        return new OperationResponse(false, error, null, null);
    }
}
