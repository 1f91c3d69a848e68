package fleetportal.core.repository;

import fleetportal.core.model.UserQuota;

import java.util.Optional;

/**
 * Repository interface for per-user quota counters.
 * Callers serialize read-modify-write sequences per user.
 */
public interface QuotaRepository {

    Optional<UserQuota> findByUserId(String userId);

    /**
     * Overwrite the counters and limits of an existing user.
     *
     * @return false if the user does not exist
     */
    boolean update(UserQuota quota);

    /**
     * Create the user row unless one exists already.
     *
     * @return true if a row was inserted
     */
    boolean insertIfAbsent(UserQuota quota);
}
