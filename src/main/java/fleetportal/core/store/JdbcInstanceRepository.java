package fleetportal.core.store;

import fleetportal.core.error.PersistenceException;
import fleetportal.core.model.Instance;
import fleetportal.core.model.InstanceStatus;
import fleetportal.core.repository.InstanceRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of InstanceRepository.
 */
public class JdbcInstanceRepository implements InstanceRepository {

    private final Database db;

    public JdbcInstanceRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Instance instance) {
        String sql = """
                    MERGE INTO instances (id, name, image, owner_id, node_id, node_address, port, cpu, memory_gb,
                                          status, deployment_handle, error_message, created_at, started_at, stopped_at)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instance.id());
            ps.setString(2, instance.name());
            ps.setString(3, instance.image());
            ps.setString(4, instance.ownerId());
            ps.setString(5, instance.nodeId());
            ps.setString(6, instance.nodeAddress());
            if (instance.port() != null) {
                ps.setInt(7, instance.port());
            } else {
                ps.setNull(7, Types.INTEGER);
            }
            ps.setInt(8, instance.cpu());
            ps.setInt(9, instance.memoryGb());
            ps.setString(10, instance.status().name());
            ps.setString(11, instance.deploymentHandle());
            ps.setString(12, instance.errorMessage());
            setTimestamp(ps, 13, instance.createdAt() != null ? instance.createdAt() : Instant.now());
            setTimestamp(ps, 14, instance.startedAt());
            setTimestamp(ps, 15, instance.stoppedAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save instance: " + instance.id(), e);
        }
    }

    @Override
    public Optional<Instance> findById(String instanceId) {
        String sql = "SELECT * FROM instances WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instanceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to find instance: " + instanceId, e);
        }
    }

    @Override
    public List<Instance> findByOwner(String ownerId) {
        String sql = "SELECT * FROM instances WHERE owner_id = ? ORDER BY created_at DESC, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ownerId);
            try (ResultSet rs = ps.executeQuery()) {
                List<Instance> results = new ArrayList<>();
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list instances of owner: " + ownerId, e);
        }
    }

    @Override
    public String generateId() {
        return "i-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    private Instance mapRow(ResultSet rs) throws SQLException {
        int port = rs.getInt("port");
        Integer portValue = rs.wasNull() ? null : port;

        return Instance.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .image(rs.getString("image"))
                .ownerId(rs.getString("owner_id"))
                .nodeId(rs.getString("node_id"))
                .nodeAddress(rs.getString("node_address"))
                .port(portValue)
                .cpu(rs.getInt("cpu"))
                .memoryGb(rs.getInt("memory_gb"))
                .status(InstanceStatus.valueOf(rs.getString("status")))
                .deploymentHandle(rs.getString("deployment_handle"))
                .errorMessage(rs.getString("error_message"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .stoppedAt(toInstant(rs.getTimestamp("stopped_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
