package fleetportal.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import fleetportal.core.error.PlacementException;
import fleetportal.core.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 * Failures propagate to RouterHandler, which turns them into error responses.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     * @throws PlacementException for expected launch outcomes the client should see
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path)
            throws PlacementException;

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        /**
         * Serialize a DTO with the shared mapper.
         */
        public static ControllerResponse json(HttpResponseStatus status, Object body) {
            try {
                return json(status, RouterHandler.mapper().writeValueAsString(body));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize " + body.getClass().getSimpleName(), e);
            }
        }

        public static ControllerResponse ok(Object body) {
            return json(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse created(Object body) {
            return json(HttpResponseStatus.CREATED, body);
        }

        public static ControllerResponse noContent() {
            return new ControllerResponse(HttpResponseStatus.NO_CONTENT, "application/json", "");
        }
    }
}
