package fleetportal.core.config;

import fleetportal.core.deploy.SimulatedDeploymentClient;
import fleetportal.core.deploy.SshDockerDeploymentClient;
import fleetportal.core.error.QuotaExceededException;
import fleetportal.core.placement.CapacityHeadroom;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DependenciesTest {

    private static PortalConfig config() {
        return PortalConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:deps-" + UUID.randomUUID()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withProbeTimeout(Duration.ofMillis(200))
                .withDefaultUserId("demo");
    }

    @Test
    void wiresSimulatedStackByDefault() {
        try (Dependencies deps = Dependencies.create(config())) {
            assertTrue(deps.deploymentClient() instanceof SimulatedDeploymentClient);
            assertEquals(5, deps.routerHandler().controllerCount());
            assertSame(deps.routerHandler(), deps.routerHandler());
            assertTrue(deps.quotaLedger().quota("demo").isPresent());
        }
    }

    @Test
    void sshModeUsesDockerClient() {
        try (Dependencies deps = Dependencies.create(config().withDeployerMode(PortalConfig.DeployerMode.SSH))) {
            assertTrue(deps.deploymentClient() instanceof SshDockerDeploymentClient);
        }
    }

    @Test
    void hardCapModeRefusesOverLimit() throws Exception {
        try (Dependencies deps = Dependencies.create(config().withQuotaMode(PortalConfig.QuotaMode.HARD_CAP))) {
            assertThrows(QuotaExceededException.class, () -> deps.quotaLedger().check("demo", 17, 1));
            deps.quotaLedger().check("demo", 16, 32);
        }
    }

    @Test
    void usageModeNeverRefuses() throws Exception {
        try (Dependencies deps = Dependencies.create(config())) {
            deps.quotaLedger().check("demo", 64, 512);
        }
    }

    @Test
    void unreachableFeedGivesNonLiveHeadroom() {
        try (Dependencies deps = Dependencies.create(config().withCapacityFeedUrl("http://127.0.0.1:1/capacity"))) {
            CapacityHeadroom headroom = deps.capacityScheduler().maxAvailableCapacity();
            assertFalse(headroom.live());
            assertEquals(0, headroom.maxCpu());
        }
    }

    @Test
    void schedulerStartsAndStopsWithClose() {
        Dependencies deps = Dependencies.create(config().withHealthWatchInterval(Duration.ofSeconds(60)));
        try {
            deps.startScheduler();
            assertTrue(deps.scheduler().isRunning());
        } finally {
            deps.close();
        }
        assertFalse(deps.scheduler().isRunning());
    }
}
