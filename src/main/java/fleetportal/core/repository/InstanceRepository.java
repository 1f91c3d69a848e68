package fleetportal.core.repository;

import fleetportal.core.model.Instance;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for instance records.
 * Records are never deleted.
 */
public interface InstanceRepository {

    /**
     * Insert or replace an instance record.
     */
    void save(Instance instance);

    Optional<Instance> findById(String instanceId);

    /**
     * All records of one owner, newest first, terminated ones included.
     */
    List<Instance> findByOwner(String ownerId);

    /**
     * Generate a new unique instance ID.
     */
    String generateId();
}
