package fleetportal.core.placement;

import fleetportal.core.error.CapacityFeedException;
import fleetportal.core.error.InsufficientCapacityException;
import fleetportal.core.model.Node;
import fleetportal.core.model.NodeCapacity;
import fleetportal.core.model.NodeRole;
import fleetportal.core.model.Placement;
import fleetportal.core.model.PlacementMode;
import fleetportal.core.service.NodeRegistry;
import fleetportal.core.store.Database;
import fleetportal.core.store.JdbcNodeRepository;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CapacitySchedulerTest {

    private static Database db;
    private NodeRegistry registry;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-scheduler;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 5);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM nodes");
            conn.commit();
        }
        registry = new NodeRegistry(new JdbcNodeRepository(db));
        registry.add(worker("w1", "10.0.0.1"));
        registry.add(worker("w2", "10.0.0.2"));
    }

    @Test
    void picksWorkerWithMostFreeCpu() throws Exception {
        CapacityScheduler scheduler = new CapacityScheduler(registry, () -> List.of(
                new NodeCapacity("10.0.0.1", 4, 8),
                new NodeCapacity("10.0.0.2", 8, 16)));

        Placement placement = scheduler.selectNode(2, 4);

        assertEquals("w2", placement.nodeId());
        assertEquals("10.0.0.2", placement.address());
        assertEquals(PlacementMode.CAPACITY_VALIDATED, placement.mode());
        assertFalse(placement.isDegraded());
    }

    @Test
    void nodeMustFitBothCpuAndMemory() throws Exception {
        CapacityScheduler scheduler = new CapacityScheduler(registry, () -> List.of(
                new NodeCapacity("10.0.0.1", 4, 32),
                new NodeCapacity("10.0.0.2", 8, 2)));

        assertEquals("w1", scheduler.selectNode(2, 16).nodeId());
    }

    @Test
    void tieGoesToLowestNodeId() throws Exception {
        CapacityScheduler scheduler = new CapacityScheduler(registry, () -> List.of(
                new NodeCapacity("10.0.0.2", 8, 16),
                new NodeCapacity("10.0.0.1", 8, 16)));

        assertEquals("w1", scheduler.selectNode(1, 1).nodeId());
    }

    @Test
    void nothingFitsReportsLargestHeadroom() {
        CapacityScheduler scheduler = new CapacityScheduler(registry, () -> List.of(
                new NodeCapacity("10.0.0.1", 4, 24),
                new NodeCapacity("10.0.0.2", 8, 16)));

        InsufficientCapacityException e = assertThrows(InsufficientCapacityException.class,
                () -> scheduler.selectNode(16, 64));

        assertEquals(16, e.requestedCpu());
        assertEquals(64, e.requestedMemory());
        assertEquals(8.0, e.maxAvailableCpu());
        assertEquals(24.0, e.maxAvailableMemory());
        assertTrue(e.detail().contains("max available is 8 vCPU and 24 GB RAM"));
    }

    @Test
    void feedEntriesForUnknownAddressesAreIgnored() {
        CapacityScheduler scheduler = new CapacityScheduler(registry, () -> List.of(
                new NodeCapacity("10.9.9.9", 64, 256),
                new NodeCapacity("10.0.0.1", 1, 1)));

        InsufficientCapacityException e = assertThrows(InsufficientCapacityException.class,
                () -> scheduler.selectNode(4, 8));
        assertEquals(1.0, e.maxAvailableCpu());
    }

    @Test
    void nonWorkersAreNeverChosen() throws Exception {
        registry.add(Node.builder().id("m1").address("10.0.0.10").role(NodeRole.MASTER).build());
        CapacityScheduler scheduler = new CapacityScheduler(registry, () -> List.of(
                new NodeCapacity("10.0.0.10", 64, 256),
                new NodeCapacity("10.0.0.1", 2, 4)));

        assertEquals("w1", scheduler.selectNode(2, 4).nodeId());
    }

    @Test
    void feedFailureFallsBackToRandomWorker() throws Exception {
        CapacityScheduler scheduler = new CapacityScheduler(registry, () -> {
            throw new CapacityFeedException("connection refused");
        }, new Random(42));

        Placement placement = scheduler.selectNode(64, 512);

        assertEquals(PlacementMode.RANDOM_FALLBACK, placement.mode());
        assertTrue(placement.isDegraded());
        assertTrue(Set.of("w1", "w2").contains(placement.nodeId()));
    }

    @Test
    void brokenFeedClientAlsoFallsBack() throws Exception {
        CapacityScheduler scheduler = new CapacityScheduler(registry, () -> {
            throw new IllegalStateException("feed client crashed");
        }, new Random(42));

        assertEquals(PlacementMode.RANDOM_FALLBACK, scheduler.selectNode(1, 1).mode());
        assertFalse(scheduler.maxAvailableCapacity().live());
    }

    @Test
    void noWorkersIsInsufficientCapacity() throws Exception {
        registry.delete("w1");
        registry.delete("w2");
        CapacityScheduler scheduler = new CapacityScheduler(registry, CapacityFeed.unavailable());

        InsufficientCapacityException e = assertThrows(InsufficientCapacityException.class,
                () -> scheduler.selectNode(1, 2));
        assertEquals(0.0, e.maxAvailableCpu());
        assertEquals(0.0, e.maxAvailableMemory());
    }

    @Test
    void headroomTakesMaximaIndependently() {
        CapacityScheduler scheduler = new CapacityScheduler(registry, () -> List.of(
                new NodeCapacity("10.0.0.1", 4, 24),
                new NodeCapacity("10.0.0.2", 8, 16)));

        CapacityHeadroom headroom = scheduler.maxAvailableCapacity();

        assertEquals(8.0, headroom.maxCpu());
        assertEquals(24.0, headroom.maxMemory());
        assertEquals(2, headroom.workerCount());
        assertTrue(headroom.live());
    }

    @Test
    void headroomWithoutFeedIsNotLive() {
        CapacityHeadroom headroom = new CapacityScheduler(registry, CapacityFeed.unavailable()).maxAvailableCapacity();

        assertFalse(headroom.live());
        assertEquals(0.0, headroom.maxCpu());
        assertEquals(2, headroom.workerCount());
    }

    private static Node worker(String id, String address) {
        return Node.builder().id(id).address(address).role(NodeRole.WORKER).cpuCores(8).memoryGb(16.0).build();
    }
}
