package fleetportal.core.store;

import fleetportal.core.error.PersistenceException;
import fleetportal.core.repository.PortAllocationRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of PortAllocationRepository.
 * The (node_id, port) unique constraint backs up the caller's per-node serialization.
 */
public class JdbcPortAllocationRepository implements PortAllocationRepository {

    private final Database db;

    public JdbcPortAllocationRepository(Database db) {
        this.db = db;
    }

    @Override
    public Map<String, Integer> findByNode(String nodeId) {
        String sql = "SELECT instance_id, port FROM port_allocations WHERE node_id = ? ORDER BY port";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, nodeId);
            try (ResultSet rs = ps.executeQuery()) {
                Map<String, Integer> result = new LinkedHashMap<>();
                while (rs.next()) {
                    result.put(rs.getString("instance_id"), rs.getInt("port"));
                }
                return result;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read port allocations of node: " + nodeId, e);
        }
    }

    @Override
    public int highWaterMark(String nodeId, int defaultValue) {
        String sql = "SELECT high_water_mark FROM port_watermarks WHERE node_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, nodeId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : defaultValue;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read high-water mark of node: " + nodeId, e);
        }
    }

    @Override
    public void assign(String nodeId, String instanceId, int port, int highWaterMark) {
        String insertSql = "INSERT INTO port_allocations (node_id, instance_id, port) VALUES (?, ?, ?)";
        String markSql = "MERGE INTO port_watermarks (node_id, high_water_mark) KEY (node_id) VALUES (?, ?)";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement insert = conn.prepareStatement(insertSql);
                    PreparedStatement mark = conn.prepareStatement(markSql)) {

                insert.setString(1, nodeId);
                insert.setString(2, instanceId);
                insert.setInt(3, port);
                insert.executeUpdate();

                mark.setString(1, nodeId);
                mark.setInt(2, highWaterMark);
                mark.executeUpdate();

                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to assign port " + port + " on node " + nodeId, e);
        }
    }

    @Override
    public Optional<Integer> remove(String nodeId, String instanceId) {
        String selectSql = "SELECT port FROM port_allocations WHERE node_id = ? AND instance_id = ?";
        String deleteSql = "DELETE FROM port_allocations WHERE node_id = ? AND instance_id = ?";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement select = conn.prepareStatement(selectSql);
                    PreparedStatement delete = conn.prepareStatement(deleteSql)) {

                select.setString(1, nodeId);
                select.setString(2, instanceId);
                Integer port = null;
                try (ResultSet rs = select.executeQuery()) {
                    if (rs.next()) {
                        port = rs.getInt(1);
                    }
                }

                if (port == null) {
                    conn.commit();
                    return Optional.empty();
                }

                delete.setString(1, nodeId);
                delete.setString(2, instanceId);
                delete.executeUpdate();
                conn.commit();
                return Optional.of(port);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to release port of " + instanceId + " on node " + nodeId, e);
        }
    }
}
