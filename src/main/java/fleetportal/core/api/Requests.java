package fleetportal.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import fleetportal.core.server.RouterHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Request helpers shared by the v1 controllers.
 */
public final class Requests {

    /** Header carrying the caller's user id */
    public static final String USER_HEADER = "X-User-ID";

    private Requests() {
    }

    /**
     * Caller identity from the user header, or the configured default user.
     */
    public static String callerId(FullHttpRequest req, String defaultUserId) {
        String header = req.headers().get(USER_HEADER);
        return header != null && !header.isBlank() ? header.trim() : defaultUserId;
    }

    /**
     * First value of a query parameter, null if absent or blank.
     */
    public static String queryParam(FullHttpRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }

    /**
     * Parse the JSON body.
     *
     * @throws IllegalArgumentException if the body is missing or malformed
     */
    public static <T> T body(FullHttpRequest req, Class<T> type) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        try {
            return RouterHandler.mapper().readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid request body: " + e.getOriginalMessage());
        }
    }
}
