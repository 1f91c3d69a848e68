package fleetportal.core.config;

import fleetportal.core.api.v1.ClusterController;
import fleetportal.core.api.v1.HealthController;
import fleetportal.core.api.v1.InstanceController;
import fleetportal.core.api.v1.NodeController;
import fleetportal.core.api.v1.QuotaController;
import fleetportal.core.deploy.DeploymentClient;
import fleetportal.core.deploy.JSchRemoteExec;
import fleetportal.core.deploy.SimulatedDeploymentClient;
import fleetportal.core.deploy.SshDockerDeploymentClient;
import fleetportal.core.health.ClusterAggregator;
import fleetportal.core.health.ConnectProbe;
import fleetportal.core.health.HealthProber;
import fleetportal.core.health.NettyConnectProbe;
import fleetportal.core.ledger.HardCapQuotaPolicy;
import fleetportal.core.ledger.PortLedger;
import fleetportal.core.ledger.QuotaLedger;
import fleetportal.core.ledger.QuotaPolicy;
import fleetportal.core.ledger.UsageBasedQuotaPolicy;
import fleetportal.core.placement.CapacityFeed;
import fleetportal.core.placement.CapacityScheduler;
import fleetportal.core.placement.HttpCapacityFeed;
import fleetportal.core.repository.InstanceRepository;
import fleetportal.core.repository.NodeRepository;
import fleetportal.core.scheduler.HealthWatcher;
import fleetportal.core.scheduler.Scheduler;
import fleetportal.core.server.RouterHandler;
import fleetportal.core.service.InstanceLifecycleController;
import fleetportal.core.service.NodeRegistry;
import fleetportal.core.store.Database;
import fleetportal.core.store.JdbcInstanceRepository;
import fleetportal.core.store.JdbcNodeRepository;
import fleetportal.core.store.JdbcPortAllocationRepository;
import fleetportal.core.store.JdbcQuotaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(PortalConfig.fromEnv());
 * deps.startScheduler(); // start background health watch
 * InstanceLifecycleController lifecycle = deps.lifecycle();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final PortalConfig config;
    private final Database database;
    private final NodeRepository nodeRepository;
    private final InstanceRepository instanceRepository;

    private final NodeRegistry nodeRegistry;
    private final QuotaLedger quotaLedger;
    private final PortLedger portLedger;
    private final ConnectProbe connectProbe;
    private final HealthProber healthProber;
    private final ClusterAggregator clusterAggregator;
    private final CapacityScheduler capacityScheduler;
    private final DeploymentClient deploymentClient;
    private final InstanceLifecycleController lifecycle;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(PortalConfig config, ConnectProbe connectProbe, CapacityFeed capacityFeed,
            DeploymentClient deploymentClient) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.nodeRepository = new JdbcNodeRepository(database);
        this.instanceRepository = new JdbcInstanceRepository(database);

        // Ledgers
        this.quotaLedger = new QuotaLedger(new JdbcQuotaRepository(database), quotaPolicy(config));
        this.portLedger = new PortLedger(new JdbcPortAllocationRepository(database));

        // Services
        this.nodeRegistry = new NodeRegistry(nodeRepository);
        this.connectProbe = connectProbe;
        this.healthProber = new HealthProber(nodeRegistry, connectProbe, config.probePort(), config.probeTimeout());
        this.clusterAggregator = new ClusterAggregator(config.clusterName());
        this.capacityScheduler = new CapacityScheduler(nodeRegistry, capacityFeed);
        this.deploymentClient = deploymentClient;
        this.lifecycle = new InstanceLifecycleController(
                instanceRepository,
                capacityScheduler,
                portLedger,
                quotaLedger,
                deploymentClient,
                config.workspaceRoot());

        quotaLedger.ensureUser(config.defaultUserId(), config.defaultUserId());

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(PortalConfig config) {
        return new Dependencies(config, new NettyConnectProbe(), capacityFeed(config), deploymentClient(config));
    }

    /**
     * Create dependencies with the outward-facing collaborators replaced, for tests.
     */
    public static Dependencies create(PortalConfig config, ConnectProbe connectProbe, CapacityFeed capacityFeed,
            DeploymentClient deploymentClient) {
        return new Dependencies(config, connectProbe, capacityFeed, deploymentClient);
    }

    private static QuotaPolicy quotaPolicy(PortalConfig config) {
        return switch (config.quotaMode()) {
            case USAGE -> new UsageBasedQuotaPolicy();
            case HARD_CAP -> new HardCapQuotaPolicy();
        };
    }

    private static CapacityFeed capacityFeed(PortalConfig config) {
        if (!config.hasCapacityFeed()) {
            log.warn("No capacity feed configured, placement will be random");
            return CapacityFeed.unavailable();
        }
        return new HttpCapacityFeed(config.capacityFeedUrl(), config.capacityFeedTimeout());
    }

    private static DeploymentClient deploymentClient(PortalConfig config) {
        return switch (config.deployerMode()) {
            case SIMULATED -> new SimulatedDeploymentClient();
            case SSH -> new SshDockerDeploymentClient(new JSchRemoteExec(
                    config.sshUser(),
                    config.sshPort(),
                    config.sshIdentityFile(),
                    config.sshKnownHostsFile(),
                    config.sshStrictHostKeys(),
                    Duration.ofSeconds(10),
                    config.sshCommandTimeout()));
        };
    }

    // Getters
    public PortalConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public NodeRegistry nodeRegistry() {
        return nodeRegistry;
    }

    public QuotaLedger quotaLedger() {
        return quotaLedger;
    }

    public PortLedger portLedger() {
        return portLedger;
    }

    public HealthProber healthProber() {
        return healthProber;
    }

    public ClusterAggregator clusterAggregator() {
        return clusterAggregator;
    }

    public CapacityScheduler capacityScheduler() {
        return capacityScheduler;
    }

    public DeploymentClient deploymentClient() {
        return deploymentClient;
    }

    public InstanceLifecycleController lifecycle() {
        return lifecycle;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(database, nodeRegistry, config))
                    .registerController(new InstanceController(lifecycle, config.defaultUserId()))
                    .registerController(new ClusterController(healthProber, clusterAggregator, capacityScheduler))
                    .registerController(new NodeController(nodeRegistry, portLedger))
                    .registerController(new QuotaController(quotaLedger, lifecycle, nodeRegistry,
                            config.defaultUserId()));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(new HealthWatcher(healthProber, clusterAggregator), config);
        }
        return scheduler;
    }

    /**
     * Start the background health watch.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        if (connectProbe instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error closing connect probe: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
