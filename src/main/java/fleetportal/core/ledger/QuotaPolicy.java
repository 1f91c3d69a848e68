package fleetportal.core.ledger;

import fleetportal.core.error.QuotaExceededException;
import fleetportal.core.model.UserQuota;

/**
 * Admission decision taken before any resource is committed.
 * Implementations must not mutate counters.
 */
public interface QuotaPolicy {

    /**
     * @param current the user's counters, null when the user is unknown
     * @throws QuotaExceededException when the request must be refused
     */
    void check(String userId, UserQuota current, int cpu, int memoryGb) throws QuotaExceededException;
}
