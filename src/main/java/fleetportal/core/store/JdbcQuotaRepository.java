package fleetportal.core.store;

import fleetportal.core.error.PersistenceException;
import fleetportal.core.model.UserQuota;
import fleetportal.core.repository.QuotaRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * JDBC implementation of QuotaRepository.
 */
public class JdbcQuotaRepository implements QuotaRepository {

    private final Database db;

    public JdbcQuotaRepository(Database db) {
        this.db = db;
    }

    @Override
    public Optional<UserQuota> findByUserId(String userId) {
        String sql = "SELECT * FROM user_quotas WHERE user_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read quota of user: " + userId, e);
        }
    }

    @Override
    public boolean update(UserQuota quota) {
        String sql = """
                    UPDATE user_quotas
                    SET username = ?, max_instances = ?, max_cpu = ?, max_memory = ?,
                        used_instances = ?, used_cpu = ?, used_memory = ?
                    WHERE user_id = ?
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, quota.username());
                ps.setInt(2, quota.maxInstances());
                ps.setInt(3, quota.maxCpu());
                ps.setInt(4, quota.maxMemory());
                ps.setInt(5, quota.usedInstances());
                ps.setInt(6, quota.usedCpu());
                ps.setInt(7, quota.usedMemory());
                ps.setString(8, quota.userId());

                int updated = ps.executeUpdate();
                conn.commit();
                return updated > 0;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to update quota of user: " + quota.userId(), e);
        }
    }

    @Override
    public boolean insertIfAbsent(UserQuota quota) {
        String selectSql = "SELECT 1 FROM user_quotas WHERE user_id = ?";
        String insertSql = """
                    INSERT INTO user_quotas (user_id, username, max_instances, max_cpu, max_memory,
                                             used_instances, used_cpu, used_memory)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement check = conn.prepareStatement(selectSql)) {
                check.setString(1, quota.userId());
                try (ResultSet rs = check.executeQuery()) {
                    if (rs.next()) {
                        return false;
                    }
                }
            }

            try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                ps.setString(1, quota.userId());
                ps.setString(2, quota.username());
                ps.setInt(3, quota.maxInstances());
                ps.setInt(4, quota.maxCpu());
                ps.setInt(5, quota.maxMemory());
                ps.setInt(6, quota.usedInstances());
                ps.setInt(7, quota.usedCpu());
                ps.setInt(8, quota.usedMemory());
                ps.executeUpdate();
            }
            conn.commit();
            return true;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to create quota of user: " + quota.userId(), e);
        }
    }

    private UserQuota mapRow(ResultSet rs) throws SQLException {
        return new UserQuota(
                rs.getString("user_id"),
                rs.getString("username"),
                rs.getInt("max_instances"),
                rs.getInt("max_cpu"),
                rs.getInt("max_memory"),
                rs.getInt("used_instances"),
                rs.getInt("used_cpu"),
                rs.getInt("used_memory"));
    }
}
