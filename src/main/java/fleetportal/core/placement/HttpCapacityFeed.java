package fleetportal.core.placement;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fleetportal.core.error.CapacityFeedException;
import fleetportal.core.model.NodeCapacity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Reads capacity from an HTTP endpoint returning a JSON array of
 * {@code {"address": ..., "availableCpu": ..., "availableMemory": ...}}.
 */
public class HttpCapacityFeed implements CapacityFeed {

    private static final Logger log = LoggerFactory.getLogger(HttpCapacityFeed.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<List<NodeCapacity>> LIST_TYPE = new TypeReference<>() {
    };

    private final HttpClient client;
    private final URI uri;
    private final Duration timeout;

    public HttpCapacityFeed(String url, Duration timeout) {
        this.uri = URI.create(url);
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public List<NodeCapacity> listAvailable() throws CapacityFeedException {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CapacityFeedException("capacity feed unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapacityFeedException("interrupted while reading capacity feed", e);
        }

        if (response.statusCode() != 200) {
            throw new CapacityFeedException("capacity feed returned HTTP " + response.statusCode());
        }

        JsonNode body;
        try {
            body = MAPPER.readTree(response.body());
        } catch (IOException e) {
            throw new CapacityFeedException("malformed capacity feed response", e);
        }
        if (body == null || !body.isArray()) {
            throw new CapacityFeedException("capacity feed response is not a JSON array");
        }

        try {
            List<NodeCapacity> entries = MAPPER.convertValue(body, LIST_TYPE);
            log.debug("Capacity feed returned {} entries", entries.size());
            return entries;
        } catch (IllegalArgumentException e) {
            throw new CapacityFeedException("malformed capacity feed entry: " + e.getMessage(), e);
        }
    }
}
