package fleetportal.core.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for the portal core.
 * All settings have sensible defaults.
 */
public final class PortalConfig {

    public enum QuotaMode {
        /** Record usage only, never refuse (billing happens downstream). */
        USAGE,
        /** Refuse requests that would exceed the user's declared limits. */
        HARD_CAP
    }

    public enum DeployerMode {
        SIMULATED,
        SSH
    }

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/fleetportal;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8000;
    private String serverHost = "0.0.0.0";

    // Health probing
    private int probePort = 22;
    private Duration probeTimeout = Duration.ofSeconds(5);
    private Duration healthWatchInterval = Duration.ofSeconds(30);
    private String clusterName = "fleet-cluster";

    // Capacity feed
    private String capacityFeedUrl = null; // unset -> scheduler always runs in fallback mode
    private Duration capacityFeedTimeout = Duration.ofSeconds(3);

    // Deployment
    private DeployerMode deployerMode = DeployerMode.SIMULATED;
    private String sshUser = "root";
    private int sshPort = 22;
    private Path sshIdentityFile = Path.of(System.getProperty("user.home"), ".ssh", "id_rsa");
    private Path sshKnownHostsFile = Path.of(System.getProperty("user.home"), ".ssh", "known_hosts");
    private boolean sshStrictHostKeys = true;
    private Duration sshCommandTimeout = Duration.ofSeconds(120);
    private String workspaceRoot = "/home/mroot/user_data";

    // Quota
    private QuotaMode quotaMode = QuotaMode.USAGE;
    private String defaultUserId = "user-demo-001";

    private PortalConfig() {
    }

    public static PortalConfig defaults() {
        return new PortalConfig();
    }

    public static PortalConfig fromEnv() {
        PortalConfig config = new PortalConfig();

        String dbUrl = System.getenv("PORTAL_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("PORTAL_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String probePort = System.getenv("PORTAL_PROBE_PORT");
        if (probePort != null && !probePort.isBlank()) {
            config.probePort = Integer.parseInt(probePort);
        }

        String probeTimeoutMs = System.getenv("PORTAL_PROBE_TIMEOUT_MS");
        if (probeTimeoutMs != null && !probeTimeoutMs.isBlank()) {
            config.probeTimeout = Duration.ofMillis(Long.parseLong(probeTimeoutMs));
        }

        String watchSec = System.getenv("PORTAL_HEALTH_INTERVAL_SEC");
        if (watchSec != null && !watchSec.isBlank()) {
            config.healthWatchInterval = Duration.ofSeconds(Long.parseLong(watchSec));
        }

        String feedUrl = System.getenv("PORTAL_CAPACITY_FEED_URL");
        if (feedUrl != null && !feedUrl.isBlank()) {
            config.capacityFeedUrl = feedUrl;
        }

        String deployer = System.getenv("PORTAL_DEPLOYER");
        if (deployer != null && !deployer.isBlank()) {
            config.deployerMode = DeployerMode.valueOf(deployer.trim().toUpperCase());
        }

        String sshUser = System.getenv("PORTAL_SSH_USER");
        if (sshUser != null && !sshUser.isBlank()) {
            config.sshUser = sshUser;
        }

        String sshPort = System.getenv("PORTAL_SSH_PORT");
        if (sshPort != null && !sshPort.isBlank()) {
            config.sshPort = Integer.parseInt(sshPort);
        }

        String sshKey = System.getenv("PORTAL_SSH_KEY");
        if (sshKey != null && !sshKey.isBlank()) {
            config.sshIdentityFile = Path.of(sshKey);
        }

        String knownHosts = System.getenv("PORTAL_SSH_KNOWN_HOSTS");
        if (knownHosts != null && !knownHosts.isBlank()) {
            config.sshKnownHostsFile = Path.of(knownHosts);
        }

        String strict = System.getenv("PORTAL_SSH_STRICT_HOST_KEYS");
        if (strict != null && !strict.isBlank()) {
            config.sshStrictHostKeys = Boolean.parseBoolean(strict.trim());
        }

        String quota = System.getenv("PORTAL_QUOTA_MODE");
        if (quota != null && !quota.isBlank()) {
            config.quotaMode = QuotaMode.valueOf(quota.trim().toUpperCase().replace('-', '_'));
        }

        String defaultUser = System.getenv("PORTAL_DEFAULT_USER");
        if (defaultUser != null && !defaultUser.isBlank()) {
            config.defaultUserId = defaultUser;
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int probePort() {
        return probePort;
    }

    public Duration probeTimeout() {
        return probeTimeout;
    }

    public Duration healthWatchInterval() {
        return healthWatchInterval;
    }

    public String clusterName() {
        return clusterName;
    }

    public String capacityFeedUrl() {
        return capacityFeedUrl;
    }

    public boolean hasCapacityFeed() {
        return capacityFeedUrl != null && !capacityFeedUrl.isBlank();
    }

    public Duration capacityFeedTimeout() {
        return capacityFeedTimeout;
    }

    public DeployerMode deployerMode() {
        return deployerMode;
    }

    public String sshUser() {
        return sshUser;
    }

    public int sshPort() {
        return sshPort;
    }

    public Path sshIdentityFile() {
        return sshIdentityFile;
    }

    public Path sshKnownHostsFile() {
        return sshKnownHostsFile;
    }

    public boolean sshStrictHostKeys() {
        return sshStrictHostKeys;
    }

    public Duration sshCommandTimeout() {
        return sshCommandTimeout;
    }

    public String workspaceRoot() {
        return workspaceRoot;
    }

    public QuotaMode quotaMode() {
        return quotaMode;
    }

    public String defaultUserId() {
        return defaultUserId;
    }

    // Fluent setters for testing/customization
    public PortalConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public PortalConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public PortalConfig withProbePort(int port) {
        this.probePort = port;
        return this;
    }

    public PortalConfig withProbeTimeout(Duration timeout) {
        this.probeTimeout = timeout;
        return this;
    }

    public PortalConfig withHealthWatchInterval(Duration interval) {
        this.healthWatchInterval = interval;
        return this;
    }

    public PortalConfig withCapacityFeedUrl(String url) {
        this.capacityFeedUrl = url;
        return this;
    }

    public PortalConfig withDeployerMode(DeployerMode mode) {
        this.deployerMode = mode;
        return this;
    }

    public PortalConfig withQuotaMode(QuotaMode mode) {
        this.quotaMode = mode;
        return this;
    }

    public PortalConfig withDefaultUserId(String userId) {
        this.defaultUserId = userId;
        return this;
    }

    @Override
    public String toString() {
        return "PortalConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", probePort=" + probePort +
                ", probeTimeout=" + probeTimeout +
                ", capacityFeed=" + (hasCapacityFeed() ? capacityFeedUrl : "none") +
                ", deployer=" + deployerMode +
                ", quotaMode=" + quotaMode +
                '}';
    }
}
