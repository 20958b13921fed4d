package leadflow.workflow.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import leadflow.workflow.server.RouterHandler;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * An HTTP endpoint group. The router asks each registered controller in turn whether
 * it {@link #matches} a request and hands the first match the request.
 *
 * <p>
 * Controllers may throw; the router turns {@code JobNotFoundException} and
 * {@code RecordNotFoundException}, {@link IllegalArgumentException}, {@link IllegalStateException} and malformed JSON into
 * 404, 400, 409 and 400 responses.
 */
public interface Controller {

    /**
     * @param method HTTP method
     * @param path   request path without the query string
     */
    boolean matches(HttpMethod method, String path);

    ControllerResponse handle(FullHttpRequest req, String path) throws Exception;

    /** Request body as UTF-8, empty string when there is none. */
    static String body(FullHttpRequest req) {
        return req.content().toString(StandardCharsets.UTF_8);
    }

    /** First value of a query parameter, or null. */
    static String queryParam(FullHttpRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * Integer query parameter, or null when absent.
     *
     * @throws IllegalArgumentException if present but not a number
     */
    static Integer intParam(FullHttpRequest req, String name) {
        String value = queryParam(req, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number");
        }
    }

    /**
     * JSON response: status plus serialized body.
     */
    record ControllerResponse(HttpResponseStatus status, String body) {

        public static ControllerResponse of(HttpResponseStatus status, Object payload)
                throws JsonProcessingException {
            return new ControllerResponse(status, RouterHandler.mapper().writeValueAsString(payload));
        }

        public static ControllerResponse ok(Object payload) throws JsonProcessingException {
            return of(HttpResponseStatus.OK, payload);
        }

        public static ControllerResponse created(Object payload) throws JsonProcessingException {
            return of(HttpResponseStatus.CREATED, payload);
        }

        public static ControllerResponse accepted(Object payload) throws JsonProcessingException {
            return of(HttpResponseStatus.ACCEPTED, payload);
        }

        /** {"error": message} with the given status */
        public static ControllerResponse failure(HttpResponseStatus status, String message) {
            String body = RouterHandler.mapper().createObjectNode()
                    .put("error", message != null ? message : status.reasonPhrase())
                    .toString();
            return new ControllerResponse(status, body);
        }

        public static ControllerResponse notFound(String message) {
            return failure(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return failure(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse conflict(String message) {
            return failure(HttpResponseStatus.CONFLICT, message);
        }

        public static ControllerResponse forbidden(String message) {
            return failure(HttpResponseStatus.FORBIDDEN, message);
        }

        public static ControllerResponse error(String message) {
            return failure(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }
    }
}
