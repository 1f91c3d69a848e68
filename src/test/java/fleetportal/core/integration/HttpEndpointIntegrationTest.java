package fleetportal.core.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fleetportal.core.config.Dependencies;
import fleetportal.core.config.PortalConfig;
import fleetportal.core.deploy.FlakyDeploymentClient;
import fleetportal.core.model.NodeCapacity;
import fleetportal.core.server.PortalServer;
import org.junit.jupiter.api.*;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full HTTP round trips against a server on an ephemeral port.
 * Probing, capacity and deployment are faked; everything else is real.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    private Dependencies deps;
    private PortalServer server;
    private FlakyDeploymentClient deployer;
    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
    private HttpClient client;
    private String baseUrl;

    @BeforeEach
    void startServer() {
        PortalConfig config = PortalConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:it-" + UUID.randomUUID()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withProbeTimeout(Duration.ofMillis(200))
                .withDefaultUserId("demo");

        deployer = new FlakyDeploymentClient();
        deps = Dependencies.create(config,
                (host, port, timeout) -> unreachable.contains(host)
                        ? CompletableFuture.failedFuture(new NoRouteToHostException("No route to host"))
                        : CompletableFuture.failedFuture(new ConnectException("Connection refused")),
                () -> List.of(
                        new NodeCapacity("10.0.0.1", 4, 8),
                        new NodeCapacity("10.0.0.2", 8, 16)),
                deployer);

        server = new PortalServer(deps);
        server.start("127.0.0.1", 0);

        client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5)).build();
        baseUrl = "http://127.0.0.1:" + server.port();
    }

    @AfterEach
    void stopServer() {
        if (server != null)
            server.close();
        if (deps != null)
            deps.close();
    }

    @Test
    void healthEndpoint() throws Exception {
        HttpResponse<String> response = get("/api/v1/health", null);

        assertEquals(200, response.statusCode());
        JsonNode body = mapper.readTree(response.body());
        assertEquals("healthy", body.get("status").asText());
        assertEquals("ok", body.get("database").asText());
        assertEquals("simulated", body.get("deployer").asText());
    }

    @Test
    void unknownRouteIs404() throws Exception {
        HttpResponse<String> response = get("/api/v1/nope", null);

        assertEquals(404, response.statusCode());
        assertEquals("not found", mapper.readTree(response.body()).get("error").asText());
    }

    @Test
    void nodeCrud() throws Exception {
        HttpResponse<String> created = send("POST", "/api/v1/nodes", null,
                "{\"id\":\"w1\",\"address\":\"10.0.0.1\",\"role\":\"worker\",\"cpuCores\":8,\"memoryGb\":16}");
        assertEquals(201, created.statusCode());

        HttpResponse<String> duplicate = send("POST", "/api/v1/nodes", null,
                "{\"id\":\"w1\",\"address\":\"10.0.0.9\"}");
        assertEquals(400, duplicate.statusCode());

        HttpResponse<String> missingAddress = send("POST", "/api/v1/nodes", null, "{\"id\":\"w2\"}");
        assertEquals(400, missingAddress.statusCode());

        HttpResponse<String> updated = send("PUT", "/api/v1/nodes/w1", null,
                "{\"address\":\"10.0.0.11\",\"role\":\"storage\"}");
        assertEquals(200, updated.statusCode());

        JsonNode node = mapper.readTree(get("/api/v1/nodes/w1", null).body());
        assertEquals("10.0.0.11", node.get("address").asText());
        assertEquals("storage", node.get("role").asText());
        assertEquals(0, node.get("ports").get("allocated").asInt());

        JsonNode workers = mapper.readTree(get("/api/v1/nodes?role=worker", null).body());
        assertEquals(0, workers.size());

        assertEquals(204, send("DELETE", "/api/v1/nodes/w1", null, null).statusCode());
        assertEquals(404, get("/api/v1/nodes/w1", null).statusCode());
        assertEquals(404, send("DELETE", "/api/v1/nodes/w1", null, null).statusCode());
    }

    @Test
    void instanceLifecycleOverHttp() throws Exception {
        registerWorkers();

        HttpResponse<String> created = send("POST", "/api/v1/instances", "alice",
                "{\"name\":\"dev\",\"cpu\":2,\"memory\":4}");
        assertEquals(201, created.statusCode());
        JsonNode instance = mapper.readTree(created.body());
        String id = instance.get("id").asText();
        assertEquals("running", instance.get("status").asText());
        assertEquals("w2", instance.get("nodeId").asText());
        assertEquals("10.0.0.2:8000", instance.get("accessUrl").asText());

        // other users cannot see it
        assertEquals(404, get("/api/v1/instances/" + id, "bob").statusCode());

        HttpResponse<String> stopped = send("POST", "/api/v1/instances/" + id + "/stop", "alice", null);
        assertEquals(200, stopped.statusCode());
        assertEquals("stopped", mapper.readTree(stopped.body()).get("status").asText());

        HttpResponse<String> stopAgain = send("POST", "/api/v1/instances/" + id + "/stop", "alice", null);
        assertEquals(409, stopAgain.statusCode());

        assertEquals(200, send("POST", "/api/v1/instances/" + id + "/start", "alice", null).statusCode());

        JsonNode list = mapper.readTree(get("/api/v1/instances", "alice").body());
        assertEquals(1, list.get("count").asInt());

        JsonNode summary = mapper.readTree(get("/api/v1/instances/summary", "alice").body());
        assertEquals(1, summary.get("running").asInt());

        assertEquals(204, send("DELETE", "/api/v1/instances/" + id, "alice", null).statusCode());
        assertEquals(204, send("DELETE", "/api/v1/instances/" + id, "alice", null).statusCode());

        JsonNode afterDelete = mapper.readTree(get("/api/v1/instances", "alice").body());
        assertEquals(0, afterDelete.get("count").asInt());
        JsonNode terminated = mapper.readTree(get("/api/v1/instances?status=terminated", "alice").body());
        assertEquals(1, terminated.get("count").asInt());
    }

    @Test
    void defaultUserAppliesWithoutHeader() throws Exception {
        registerWorkers();

        assertEquals(201, send("POST", "/api/v1/instances", null, "{\"name\":\"dev\"}").statusCode());

        JsonNode quota = mapper.readTree(get("/api/v1/quota", null).body());
        assertEquals("demo", quota.get("userId").asText());
        assertEquals(1, quota.get("instances").get("used").asInt());
        assertEquals(1, quota.get("cpu").get("used").asInt());
        assertEquals(2, quota.get("memoryGb").get("used").asInt());
    }

    @Test
    void deployFailureIs502AndLeavesNothingHeld() throws Exception {
        registerWorkers();
        deployer.failDeploy(true);

        HttpResponse<String> response = send("POST", "/api/v1/instances", null, "{\"name\":\"dev\",\"cpu\":2}");

        assertEquals(502, response.statusCode());
        assertTrue(mapper.readTree(response.body()).get("detail").asText().contains("image not found"));

        JsonNode quota = mapper.readTree(get("/api/v1/quota", null).body());
        assertEquals(0, quota.get("instances").get("used").asInt());
        assertEquals(0, quota.get("cpu").get("used").asInt());

        JsonNode node = mapper.readTree(get("/api/v1/nodes/w2", null).body());
        assertEquals(0, node.get("ports").get("allocated").asInt());

        JsonNode errors = mapper.readTree(get("/api/v1/instances?status=error", null).body());
        assertEquals(1, errors.get("count").asInt());
    }

    @Test
    void insufficientCapacityIs503WithFigures() throws Exception {
        registerWorkers();

        HttpResponse<String> response = send("POST", "/api/v1/instances", null,
                "{\"name\":\"big\",\"cpu\":8,\"memory\":32}");

        assertEquals(503, response.statusCode());
        JsonNode body = mapper.readTree(response.body());
        assertEquals("Insufficient Capacity", body.get("error").asText());
        assertEquals(8, body.get("requestedCpu").asInt());
        assertEquals(32, body.get("requestedMemoryGb").asInt());
        assertEquals(8, body.get("maxAvailableCpu").asInt());
        assertEquals(16, body.get("maxAvailableMemoryGb").asInt());
    }

    @Test
    void malformedRequestsAre400() throws Exception {
        registerWorkers();

        assertEquals(400, send("POST", "/api/v1/instances", null, "{not json").statusCode());
        assertEquals(400, send("POST", "/api/v1/instances", null, "").statusCode());
        assertEquals(400, send("POST", "/api/v1/instances", null, "{\"name\":\"x\",\"cpu\":99}").statusCode());
        assertEquals(400, get("/api/v1/instances?status=bogus", null).statusCode());
    }

    @Test
    void clusterStatusReflectsProbes() throws Exception {
        registerWorkers();
        for (int i = 3; i <= 5; i++) {
            send("POST", "/api/v1/nodes", null, "{\"id\":\"w" + i + "\",\"address\":\"10.0.0." + i + "\"}");
        }
        unreachable.add("10.0.0.5");

        JsonNode status = mapper.readTree(get("/api/v1/cluster/status", null).body());
        assertEquals("degraded", status.get("health").asText());
        assertEquals(5, status.get("summary").get("totalNodes").asInt());
        assertEquals(4, status.get("summary").get("onlineNodes").asInt());
        assertEquals(80.0, status.get("summary").get("availabilityPercent").asDouble());
        assertNull(status.get("nodes"));

        JsonNode detailed = mapper.readTree(get("/api/v1/cluster/status?include_nodes=true", null).body());
        assertEquals(5, detailed.get("nodes").size());

        JsonNode nodeHealth = mapper.readTree(get("/api/v1/cluster/nodes/w5/health", null).body());
        assertFalse(nodeHealth.get("online").asBoolean());
        assertEquals("unhealthy", nodeHealth.get("health").asText());

        assertEquals(404, get("/api/v1/cluster/nodes/missing/health", null).statusCode());

        JsonNode capacity = mapper.readTree(get("/api/v1/cluster/capacity", null).body());
        assertEquals(8, capacity.get("maxCpu").asInt());
        assertEquals(16, capacity.get("maxMemoryGb").asInt());
        assertTrue(capacity.get("live").asBoolean());
    }

    @Test
    void dashboardSummary() throws Exception {
        registerWorkers();
        send("POST", "/api/v1/instances", null, "{\"name\":\"a\"}");

        JsonNode dashboard = mapper.readTree(get("/api/v1/dashboard/summary", null).body());
        assertEquals(1, dashboard.get("instances").get("total").asInt());
        assertEquals(1, dashboard.get("instances").get("running").asInt());
        assertEquals(2, dashboard.get("nodes").get("total").asInt());
        assertEquals(2, dashboard.get("nodes").get("workers").asInt());
        assertEquals("demo", dashboard.get("quota").get("userId").asText());

        // users without a quota row still get a dashboard
        JsonNode stranger = mapper.readTree(get("/api/v1/dashboard/summary", "nobody").body());
        assertEquals(0, stranger.get("instances").get("total").asInt());
        assertNull(stranger.get("quota"));

        assertEquals(404, get("/api/v1/quota", "nobody").statusCode());
    }

    private void registerWorkers() throws Exception {
        assertEquals(201, send("POST", "/api/v1/nodes", null,
                "{\"id\":\"w1\",\"address\":\"10.0.0.1\",\"cpuCores\":4,\"memoryGb\":8}").statusCode());
        assertEquals(201, send("POST", "/api/v1/nodes", null,
                "{\"id\":\"w2\",\"address\":\"10.0.0.2\",\"cpuCores\":8,\"memoryGb\":16}").statusCode());
    }

    private HttpResponse<String> get(String path, String user) throws Exception {
        return send("GET", path, user, null);
    }

    private HttpResponse<String> send(String method, String path, String user, String body) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(10))
                .method(method, body != null
                        ? HttpRequest.BodyPublishers.ofString(body)
                        : HttpRequest.BodyPublishers.noBody());
        if (body != null) {
            builder.header("Content-Type", "application/json");
        }
        if (user != null) {
            builder.header("X-User-ID", user);
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }
}
