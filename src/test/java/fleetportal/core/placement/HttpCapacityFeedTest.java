package fleetportal.core.placement;

import com.sun.net.httpserver.HttpServer;
import fleetportal.core.error.CapacityFeedException;
import fleetportal.core.model.Node;
import fleetportal.core.model.NodeCapacity;
import fleetportal.core.model.NodeRole;
import fleetportal.core.model.PlacementMode;
import fleetportal.core.service.NodeRegistry;
import fleetportal.core.store.Database;
import fleetportal.core.store.JdbcNodeRepository;
import org.junit.jupiter.api.*;

import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class HttpCapacityFeedTest {

    private static Database db;
    private HttpServer server;
    private volatile int status;
    private volatile String body;

    @BeforeAll
    static void setupDb() {
        db = new Database("jdbc:h2:mem:test-http-feed;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 5);
    }

    @AfterAll
    static void teardownDb() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void startServer() throws Exception {
        status = 200;
        body = "[]";
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/capacity", exchange -> {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private HttpCapacityFeed feed() {
        return new HttpCapacityFeed("http://127.0.0.1:" + server.getAddress().getPort() + "/capacity",
                Duration.ofSeconds(2));
    }

    @Test
    void readsEntriesIgnoringUnknownFields() throws Exception {
        body = "[{\"address\":\"10.0.0.1\",\"availableCpu\":6,\"availableMemory\":12.5,\"gpu\":0},"
                + "{\"address\":\"10.0.0.2\",\"availableCpu\":2,\"availableMemory\":4}]";

        List<NodeCapacity> entries = feed().listAvailable();

        assertEquals(List.of(new NodeCapacity("10.0.0.1", 6, 12.5), new NodeCapacity("10.0.0.2", 2, 4)), entries);
    }

    @Test
    void errorStatusIsAFeedFailure() {
        status = 503;
        body = "{\"error\":\"busy\"}";

        CapacityFeedException e = assertThrows(CapacityFeedException.class, () -> feed().listAvailable());
        assertTrue(e.getMessage().contains("503"));
    }

    @Test
    void malformedBodyIsAFeedFailure() {
        body = "[{\"address\":";
        assertThrows(CapacityFeedException.class, () -> feed().listAvailable());
    }

    @Test
    void nullOrNonArrayBodyIsAFeedFailure() {
        body = "null";
        assertThrows(CapacityFeedException.class, () -> feed().listAvailable());

        body = "{\"address\":\"10.0.0.1\"}";
        assertThrows(CapacityFeedException.class, () -> feed().listAvailable());

        body = "";
        assertThrows(CapacityFeedException.class, () -> feed().listAvailable());
    }

    @Test
    void wrongFieldTypeIsAFeedFailure() {
        body = "[{\"address\":\"10.0.0.1\",\"availableCpu\":\"lots\",\"availableMemory\":4}]";
        assertThrows(CapacityFeedException.class, () -> feed().listAvailable());
    }

    @Test
    void unreachableFeedIsAFeedFailure() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }

        HttpCapacityFeed closed = new HttpCapacityFeed("http://127.0.0.1:" + port + "/capacity", Duration.ofSeconds(1));
        assertThrows(CapacityFeedException.class, closed::listAvailable);
    }

    @Test
    void schedulerFallsBackOnEveryBadResponse() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM nodes");
            conn.commit();
        }
        NodeRegistry registry = new NodeRegistry(new JdbcNodeRepository(db));
        registry.add(Node.builder().id("w1").address("10.0.0.1").role(NodeRole.WORKER).build());
        CapacityScheduler scheduler = new CapacityScheduler(registry, feed(), new Random(7));

        for (String bad : List.of("null", "{}", "not json")) {
            body = bad;
            assertEquals(PlacementMode.RANDOM_FALLBACK, scheduler.selectNode(1, 1).mode(), bad);
            assertFalse(scheduler.maxAvailableCapacity().live(), bad);
        }

        status = 500;
        body = "[]";
        assertEquals(PlacementMode.RANDOM_FALLBACK, scheduler.selectNode(1, 1).mode());

        status = 200;
        body = "[{\"address\":\"10.0.0.1\",\"availableCpu\":4,\"availableMemory\":8}]";
        assertEquals(PlacementMode.CAPACITY_VALIDATED, scheduler.selectNode(1, 1).mode());
    }
}
