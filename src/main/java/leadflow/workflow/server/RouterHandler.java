package leadflow.workflow.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import leadflow.workflow.api.Controller;
import leadflow.workflow.api.Controller.ControllerResponse;
import leadflow.workflow.config.WorkflowConfig;
import leadflow.workflow.service.JobNotFoundException;
import leadflow.workflow.service.RecordNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches HTTP requests to registered controllers and maps their exceptions to
 * status codes. Requests no controller claims get 404.
 *
 * When an API key is configured, non-GET requests under /api/ must carry it in
 * {@value #API_KEY_HEADER}.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    public static final String API_KEY_HEADER = "X-Leadflow-Key";

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();
    private final WorkflowConfig config;

    public RouterHandler(WorkflowConfig config) {
        this.config = config;
    }

    /**
     * Add a controller. Earlier registrations win when several match.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String path = new QueryStringDecoder(req.uri()).path();
        HttpMethod method = req.method();

        ControllerResponse response;
        if (!isAuthorized(req, path)) {
            log.warn("Rejected {} {}: missing or wrong API key", method, path);
            response = ControllerResponse.forbidden("forbidden");
        } else {
            response = dispatch(req, method, path);
        }
        send(ctx, req, response);
    }

    private ControllerResponse dispatch(FullHttpRequest req, HttpMethod method, String path) {
        Controller controller = controllers.stream()
                .filter(c -> c.matches(method, path))
                .findFirst()
                .orElse(null);
        if (controller == null) {
            log.debug("No handler for: {} {}", method, path);
            return ControllerResponse.notFound("not found");
        }

        try {
            return controller.handle(req, path);
        } catch (JobNotFoundException | RecordNotFoundException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            log.debug("Bad request {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (IllegalStateException e) {
            log.info("Conflict on {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.conflict(e.getMessage());
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            return ControllerResponse.error(causeChain(e));
        }
    }

    private boolean isAuthorized(FullHttpRequest req, String path) {
        if (!config.hasApiKey() || !path.startsWith("/api/")) {
            return true;
        }
        HttpMethod method = req.method();
        if (HttpMethod.GET.equals(method) || HttpMethod.HEAD.equals(method)) {
            return true;
        }
        return config.apiKey().equals(req.headers().get(API_KEY_HEADER));
    }

    private void send(ChannelHandlerContext ctx, FullHttpRequest req, ControllerResponse response) {
        byte[] bytes = response.body() != null ? response.body().getBytes(StandardCharsets.UTF_8) : new byte[0];
        FullHttpResponse out = new DefaultFullHttpResponse(HTTP_1_1, response.status(), Unpooled.wrappedBuffer(bytes));
        out.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=utf-8")
                .setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);

        boolean keepAlive = HttpUtil.isKeepAlive(req);
        HttpUtil.setKeepAlive(out, keepAlive);
        if (keepAlive) {
            ctx.writeAndFlush(out).addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
        } else {
            ctx.writeAndFlush(out).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Channel error, closing connection", cause);
        ctx.close();
    }

    private static String causeChain(Throwable e) {
        StringBuilder chain = new StringBuilder(e.toString());
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            chain.append(" <- ").append(cause);
        }
        return chain.toString();
    }

    /**
     * Shared mapper: ISO-8601 dates, JSR-310 types registered.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
