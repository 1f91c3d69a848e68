package fleetportal.core.ledger;

import fleetportal.core.error.QuotaExceededException;
import fleetportal.core.model.UserQuota;

/**
 * Refuses a request that would push a known user past any declared limit.
 * Unknown users are admitted, matching the ledger's treatment of them.
 */
public final class HardCapQuotaPolicy implements QuotaPolicy {

    @Override
    public void check(String userId, UserQuota current, int cpu, int memoryGb) throws QuotaExceededException {
        if (current == null) {
            return;
        }
        if (current.usedInstances() + 1 > current.maxInstances()) {
            throw new QuotaExceededException("Instance limit reached (" + current.usedInstances() + "/"
                    + current.maxInstances() + ")");
        }
        if (current.usedCpu() + cpu > current.maxCpu()) {
            throw new QuotaExceededException("Requested " + cpu + " vCPU but only " + current.availableCpu()
                    + " of " + current.maxCpu() + " remain");
        }
        if (current.usedMemory() + memoryGb > current.maxMemory()) {
            throw new QuotaExceededException("Requested " + memoryGb + " GB RAM but only "
                    + current.availableMemory() + " of " + current.maxMemory() + " GB remain");
        }
    }
}
