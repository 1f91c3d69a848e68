package fleetportal.core.store;

import fleetportal.core.error.PersistenceException;
import fleetportal.core.model.Node;
import fleetportal.core.model.NodeRole;
import fleetportal.core.repository.NodeRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of NodeRepository.
 */
public class JdbcNodeRepository implements NodeRepository {

    private final Database db;

    public JdbcNodeRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Node node) {
        String sql = """
                    MERGE INTO nodes (id, hostname, address, role, cpu_cores, memory_gb, description, created_at)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, node.id());
            ps.setString(2, node.hostname());
            ps.setString(3, node.address());
            ps.setString(4, node.role().name());
            if (node.cpuCores() != null) {
                ps.setInt(5, node.cpuCores());
            } else {
                ps.setNull(5, Types.INTEGER);
            }
            if (node.memoryGb() != null) {
                ps.setDouble(6, node.memoryGb());
            } else {
                ps.setNull(6, Types.DOUBLE);
            }
            ps.setString(7, node.description());
            ps.setTimestamp(8, Timestamp.from(node.createdAt() != null ? node.createdAt() : Instant.now()));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save node: " + node.id(), e);
        }
    }

    @Override
    public Optional<Node> findById(String nodeId) {
        String sql = "SELECT * FROM nodes WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, nodeId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to find node: " + nodeId, e);
        }
    }

    @Override
    public List<Node> findAll() {
        String sql = "SELECT * FROM nodes ORDER BY id";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            return mapRows(rs);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list nodes", e);
        }
    }

    @Override
    public List<Node> findByRole(NodeRole role) {
        String sql = "SELECT * FROM nodes WHERE role = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, role.name());
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list nodes by role: " + role, e);
        }
    }

    @Override
    public boolean delete(String nodeId) {
        String sql = "DELETE FROM nodes WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, nodeId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to delete node: " + nodeId, e);
        }
    }

    private List<Node> mapRows(ResultSet rs) throws SQLException {
        List<Node> results = new ArrayList<>();
        while (rs.next()) {
            results.add(mapRow(rs));
        }
        return results;
    }

    private Node mapRow(ResultSet rs) throws SQLException {
        int cores = rs.getInt("cpu_cores");
        Integer cpuCores = rs.wasNull() ? null : cores;
        double mem = rs.getDouble("memory_gb");
        Double memoryGb = rs.wasNull() ? null : mem;
        Timestamp created = rs.getTimestamp("created_at");

        return Node.builder()
                .id(rs.getString("id"))
                .hostname(rs.getString("hostname"))
                .address(rs.getString("address"))
                .role(NodeRole.valueOf(rs.getString("role")))
                .cpuCores(cpuCores)
                .memoryGb(memoryGb)
                .description(rs.getString("description"))
                .createdAt(created != null ? created.toInstant() : null)
                .build();
    }
}
