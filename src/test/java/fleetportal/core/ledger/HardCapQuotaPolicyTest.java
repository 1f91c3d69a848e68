package fleetportal.core.ledger;

import fleetportal.core.error.QuotaExceededException;
import fleetportal.core.model.UserQuota;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HardCapQuotaPolicyTest {

    private final QuotaPolicy policy = new HardCapQuotaPolicy();

    @Test
    void admitsWithinLimits() {
        UserQuota quota = new UserQuota("u", "u", 5, 16, 32, 4, 14, 30);
        assertDoesNotThrow(() -> policy.check("u", quota, 2, 2));
    }

    @Test
    void refusesWhenInstanceLimitReached() {
        UserQuota quota = new UserQuota("u", "u", 5, 16, 32, 5, 5, 5);
        QuotaExceededException e = assertThrows(QuotaExceededException.class,
                () -> policy.check("u", quota, 1, 1));
        assertEquals("Quota exceeded", e.getMessage());
        assertTrue(e.detail().contains("5/5"));
    }

    @Test
    void refusesWhenCpuWouldOverflow() {
        UserQuota quota = new UserQuota("u", "u", 5, 16, 32, 1, 15, 0);
        QuotaExceededException e = assertThrows(QuotaExceededException.class,
                () -> policy.check("u", quota, 2, 1));
        assertTrue(e.detail().contains("vCPU"));
    }

    @Test
    void refusesWhenMemoryWouldOverflow() {
        UserQuota quota = new UserQuota("u", "u", 5, 16, 32, 1, 0, 31);
        assertThrows(QuotaExceededException.class, () -> policy.check("u", quota, 1, 2));
    }

    @Test
    void admitsUnknownUser() {
        assertDoesNotThrow(() -> policy.check("ghost", null, 8, 32));
    }

    @Test
    void usagePolicyAdmitsEverything() {
        UserQuota full = new UserQuota("u", "u", 1, 1, 1, 1, 1, 1);
        assertDoesNotThrow(() -> new UsageBasedQuotaPolicy().check("u", full, 8, 32));
    }
}
