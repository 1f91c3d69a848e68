package fleetportal.core.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fleetportal.core.api.Controller;
import fleetportal.core.api.Controller.ControllerResponse;
import fleetportal.core.api.v1.dto.ErrorResponse;
import fleetportal.core.error.DeploymentFailureException;
import fleetportal.core.error.InsufficientCapacityException;
import fleetportal.core.error.InvalidStateException;
import fleetportal.core.error.NotFoundException;
import fleetportal.core.error.PersistenceException;
import fleetportal.core.error.PortExhaustedException;
import fleetportal.core.error.QuotaExceededException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers
 * and maps failures to status codes:
 *
 * <pre>
 * NotFoundException               404
 * IllegalArgumentException        400
 * QuotaExceededException          400
 * InvalidStateException           409
 * DeploymentFailureException      502
 * InsufficientCapacityException   503 (with requested/max figures)
 * PortExhaustedException          503
 * PersistenceException            503 + Retry-After
 * anything else                   500
 * </pre>
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    static final String RETRY_AFTER_SECONDS = "5";

    private final List<Controller> controllers = new ArrayList<>();

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
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
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body(), null);
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeError(ctx, NOT_FOUND, ErrorResponse.of("not found"), null);

        } catch (NotFoundException e) {
            writeError(ctx, NOT_FOUND, ErrorResponse.of(e.getMessage()), null);
        } catch (IllegalArgumentException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            writeError(ctx, BAD_REQUEST, ErrorResponse.of(e.getMessage()), null);
        } catch (QuotaExceededException e) {
            writeError(ctx, BAD_REQUEST, ErrorResponse.of(e.getMessage(), e.detail()), null);
        } catch (InvalidStateException e) {
            writeError(ctx, CONFLICT, ErrorResponse.of(e.getMessage()), null);
        } catch (InsufficientCapacityException e) {
            writeError(ctx, SERVICE_UNAVAILABLE, new ErrorResponse(
                    e.getMessage(),
                    e.detail(),
                    e.requestedCpu(),
                    e.requestedMemory(),
                    (int) e.maxAvailableCpu(),
                    (int) e.maxAvailableMemory()), null);
        } catch (DeploymentFailureException e) {
            writeError(ctx, BAD_GATEWAY, ErrorResponse.of(e.getMessage(), e.detail()), null);
        } catch (PortExhaustedException e) {
            log.warn("Port range exhausted on node {}", e.nodeId());
            writeError(ctx, SERVICE_UNAVAILABLE, ErrorResponse.of(e.getMessage()), null);
        } catch (PersistenceException e) {
            log.error("Store failure on {} {}", method, path, e);
            writeError(ctx, SERVICE_UNAVAILABLE, ErrorResponse.of("storage unavailable", e.getMessage()),
                    RETRY_AFTER_SECONDS);
        } catch (Throwable t) {
            String requestBody = req.content().toString(StandardCharsets.UTF_8);
            log.error("Handler error: {} {} - Body: [{}]", method, path, requestBody, t);

            // Build full error chain for debugging
            StringBuilder errorChain = new StringBuilder(t.toString());
            Throwable cause = t.getCause();
            while (cause != null) {
                errorChain.append(" <- ").append(cause);
                cause = cause.getCause();
            }

            writeError(ctx, INTERNAL_SERVER_ERROR, ErrorResponse.of("internal error", errorChain.toString()), null);
        }
    }

    private void writeError(ChannelHandlerContext ctx, HttpResponseStatus status, ErrorResponse error,
            String retryAfter) {
        String body;
        try {
            body = MAPPER.writeValueAsString(error);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize error response", e);
            body = "{\"error\":\"" + escapeJson(error.error()) + "\"}";
        }
        writeSafe(ctx, status, "application/json", body, retryAfter);
    }

    /**
     * Safe write that catches any exceptions during response writing.
     * Ensures we never silently close the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body,
            String retryAfter) {
        try {
            if (body == null) {
                body = "";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            if (retryAfter != null) {
                response.headers().set(HttpHeaderNames.RETRY_AFTER, retryAfter);
            }
            ctx.writeAndFlush(response);
        } catch (Throwable t) {
            log.error("Failed to write response: {}", t.getMessage(), t);
            try {
                byte[] errorBytes = "{\"error\":\"failed to write response\"}".getBytes(StandardCharsets.UTF_8);
                FullHttpResponse errorResponse = new DefaultFullHttpResponse(HTTP_1_1, INTERNAL_SERVER_ERROR,
                        Unpooled.wrappedBuffer(errorBytes));
                errorResponse.headers().set(CONTENT_TYPE, "application/json; charset=utf-8");
                errorResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, errorBytes.length);
                ctx.writeAndFlush(errorResponse);
            } catch (Throwable t2) {
                log.error("Complete failure writing error response", t2);
                ctx.close();
            }
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json",
                    "{\"error\":\"channel error: " + escapeJson(cause.getMessage()) + "\"}", null);
        } finally {
            ctx.close();
        }
    }

    private static String escapeJson(String s) {
        if (s == null)
            return "";
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
