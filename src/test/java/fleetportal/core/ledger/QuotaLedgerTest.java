package fleetportal.core.ledger;

import fleetportal.core.error.NotFoundException;
import fleetportal.core.model.UserQuota;
import fleetportal.core.store.Database;
import fleetportal.core.store.JdbcQuotaRepository;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class QuotaLedgerTest {

    private static Database db;
    private QuotaLedger ledger;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-quota;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 10);
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
            st.execute("DELETE FROM user_quotas");
            conn.commit();
        }
        ledger = new QuotaLedger(new JdbcQuotaRepository(db), new UsageBasedQuotaPolicy());
        ledger.ensureUser("alice", "Alice");
    }

    @Test
    void ensureUserCreatesDefaultsOnce() {
        assertFalse(ledger.ensureUser("alice", "Alice"));

        UserQuota quota = ledger.summary("alice");
        assertEquals(UserQuota.DEFAULT_MAX_INSTANCES, quota.maxInstances());
        assertEquals(UserQuota.DEFAULT_MAX_CPU, quota.maxCpu());
        assertEquals(UserQuota.DEFAULT_MAX_MEMORY, quota.maxMemory());
        assertEquals(0, quota.usedInstances());
    }

    @Test
    void allocateAndReleaseMoveCounters() {
        assertTrue(ledger.allocate("alice", 2, 4));
        assertTrue(ledger.allocate("alice", 1, 2));

        UserQuota afterAllocate = ledger.summary("alice");
        assertEquals(2, afterAllocate.usedInstances());
        assertEquals(3, afterAllocate.usedCpu());
        assertEquals(6, afterAllocate.usedMemory());

        assertTrue(ledger.release("alice", 2, 4));

        UserQuota afterRelease = ledger.summary("alice");
        assertEquals(1, afterRelease.usedInstances());
        assertEquals(1, afterRelease.usedCpu());
        assertEquals(2, afterRelease.usedMemory());
    }

    @Test
    void releaseNeverGoesNegative() {
        ledger.allocate("alice", 1, 1);
        ledger.release("alice", 1, 1);
        ledger.release("alice", 1, 1);
        ledger.release("alice", 4, 8);

        UserQuota quota = ledger.summary("alice");
        assertEquals(0, quota.usedInstances());
        assertEquals(0, quota.usedCpu());
        assertEquals(0, quota.usedMemory());
    }

    @Test
    void unknownUserIsNotTracked() {
        assertFalse(ledger.allocate("ghost", 1, 1));
        assertFalse(ledger.release("ghost", 1, 1));
        assertTrue(ledger.quota("ghost").isEmpty());
        assertThrows(NotFoundException.class, () -> ledger.summary("ghost"));
    }

    @Test
    void concurrentAllocateAndReleaseBalanceOut() throws Exception {
        int rounds = 50;
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < 4; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < rounds; i++) {
                    ledger.allocate("alice", 2, 3);
                    ledger.release("alice", 2, 3);
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        UserQuota quota = ledger.summary("alice");
        assertEquals(0, quota.usedInstances());
        assertEquals(0, quota.usedCpu());
        assertEquals(0, quota.usedMemory());
    }

    @Test
    void hardCapPolicyRefusesThroughCheck() throws Exception {
        QuotaLedger capped = new QuotaLedger(new JdbcQuotaRepository(db), new HardCapQuotaPolicy());
        capped.check("alice", 16, 32);

        capped.allocate("alice", 10, 10);
        assertThrows(fleetportal.core.error.QuotaExceededException.class, () -> capped.check("alice", 8, 1));
    }
}
