package fleetportal.core.ledger;

import fleetportal.core.error.NotFoundException;
import fleetportal.core.error.QuotaExceededException;
import fleetportal.core.model.UserQuota;
import fleetportal.core.repository.QuotaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Per-user quota bookkeeping.
 * Every read-modify-write on a user's counters runs under that user's lock.
 */
public class QuotaLedger {

    private static final Logger log = LoggerFactory.getLogger(QuotaLedger.class);

    private final QuotaRepository repository;
    private final QuotaPolicy policy;
    private final KeyedLocks locks = new KeyedLocks();

    public QuotaLedger(QuotaRepository repository, QuotaPolicy policy) {
        this.repository = repository;
        this.policy = policy;
    }

    /**
     * Register a user with default limits unless already known.
     *
     * @return true if the user was created
     */
    public boolean ensureUser(String userId, String username) {
        return locks.withLock(userId, () -> {
            boolean created = repository.insertIfAbsent(UserQuota.fresh(userId, username));
            if (created) {
                log.info("Registered quota for user {}", userId);
            }
            return created;
        });
    }

    public Optional<UserQuota> quota(String userId) {
        return repository.findByUserId(userId);
    }

    /**
     * @throws NotFoundException if the user is unknown
     */
    public UserQuota summary(String userId) {
        return repository.findByUserId(userId).orElseThrow(() -> NotFoundException.user(userId));
    }

    /**
     * Admission check. Commits nothing.
     */
    public void check(String userId, int cpu, int memoryGb) throws QuotaExceededException {
        UserQuota current = repository.findByUserId(userId).orElse(null);
        policy.check(userId, current, cpu, memoryGb);
    }

    /**
     * Count one more instance and its cpu/memory against the user.
     *
     * @return false if the user does not exist
     */
    public boolean allocate(String userId, int cpu, int memoryGb) {
        return locks.withLock(userId, () -> {
            Optional<UserQuota> current = repository.findByUserId(userId);
            if (current.isEmpty()) {
                log.debug("Quota allocate skipped, unknown user {}", userId);
                return false;
            }
            UserQuota next = current.get().plus(cpu, memoryGb);
            repository.update(next);
            log.debug("Quota allocated for {}: instances={}, cpu={}, memory={}",
                    userId, next.usedInstances(), next.usedCpu(), next.usedMemory());
            return true;
        });
    }

    /**
     * Give back one instance and its cpu/memory. Counters never drop below zero.
     *
     * @return false if the user does not exist (nothing changed)
     */
    public boolean release(String userId, int cpu, int memoryGb) {
        return locks.withLock(userId, () -> {
            Optional<UserQuota> current = repository.findByUserId(userId);
            if (current.isEmpty()) {
                return false;
            }
            UserQuota next = current.get().minus(cpu, memoryGb);
            repository.update(next);
            log.debug("Quota released for {}: instances={}, cpu={}, memory={}",
                    userId, next.usedInstances(), next.usedCpu(), next.usedMemory());
            return true;
        });
    }
}
