package fleetportal.core.ledger;

import fleetportal.core.model.UserQuota;

/**
 * Usage-based accounting: every request is admitted and only recorded.
 * Declared max limits are informational.
 */
public final class UsageBasedQuotaPolicy implements QuotaPolicy {

    @Override
    public void check(String userId, UserQuota current, int cpu, int memoryGb) {
        // always admitted
    }
}
