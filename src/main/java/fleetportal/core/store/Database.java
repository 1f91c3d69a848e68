package fleetportal.core.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import fleetportal.core.config.PortalConfig;
import fleetportal.core.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(PortalConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("fleetportal-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- NODES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS nodes (
                            id              VARCHAR(64) PRIMARY KEY,
                            hostname        VARCHAR(256) NOT NULL,
                            address         VARCHAR(128) NOT NULL,
                            role            VARCHAR(20) DEFAULT 'WORKER',
                            cpu_cores       INT,
                            memory_gb       DOUBLE,
                            description     VARCHAR(1024),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- INSTANCES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS instances (
                            id                VARCHAR(64) PRIMARY KEY,
                            name              VARCHAR(64) NOT NULL,
                            image             VARCHAR(256) NOT NULL,
                            owner_id          VARCHAR(64) NOT NULL,
                            node_id           VARCHAR(64),
                            node_address      VARCHAR(128),
                            port              INT,
                            cpu               INT NOT NULL,
                            memory_gb         INT NOT NULL,
                            status            VARCHAR(20) NOT NULL,
                            deployment_handle VARCHAR(256),
                            error_message     VARCHAR(2048),
                            created_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at        TIMESTAMP,
                            stopped_at        TIMESTAMP
                        );
                    """);

            // ---------- QUOTAS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS user_quotas (
                            user_id         VARCHAR(64) PRIMARY KEY,
                            username        VARCHAR(64) NOT NULL,
                            max_instances   INT DEFAULT 5,
                            max_cpu         INT DEFAULT 16,
                            max_memory      INT DEFAULT 32,
                            used_instances  INT DEFAULT 0 CHECK (used_instances >= 0),
                            used_cpu        INT DEFAULT 0 CHECK (used_cpu >= 0),
                            used_memory     INT DEFAULT 0 CHECK (used_memory >= 0)
                        );
                    """);

            // ---------- PORTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS port_allocations (
                            node_id         VARCHAR(64) NOT NULL,
                            instance_id     VARCHAR(64) NOT NULL,
                            port            INT NOT NULL,
                            allocated_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            PRIMARY KEY (node_id, instance_id),
                            CONSTRAINT uq_node_port UNIQUE (node_id, port)
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS port_watermarks (
                            node_id         VARCHAR(64) PRIMARY KEY,
                            high_water_mark INT NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_nodes_role ON nodes(role);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_instances_owner ON instances(owner_id, created_at DESC);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_instances_node ON instances(node_id, status);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new PersistenceException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
