package fleetportal.core.service;

import fleetportal.core.deploy.DeployRequest;
import fleetportal.core.deploy.DeployResult;
import fleetportal.core.deploy.DeploymentClient;
import fleetportal.core.error.DeploymentException;
import fleetportal.core.error.DeploymentFailureException;
import fleetportal.core.error.InsufficientCapacityException;
import fleetportal.core.error.InvalidStateException;
import fleetportal.core.error.NotFoundException;
import fleetportal.core.error.PersistenceException;
import fleetportal.core.error.QuotaExceededException;
import fleetportal.core.ledger.KeyedLocks;
import fleetportal.core.ledger.PortLedger;
import fleetportal.core.ledger.QuotaLedger;
import fleetportal.core.model.Instance;
import fleetportal.core.model.InstanceCounts;
import fleetportal.core.model.InstanceSpec;
import fleetportal.core.model.InstanceStatus;
import fleetportal.core.model.Placement;
import fleetportal.core.placement.CapacityScheduler;
import fleetportal.core.repository.InstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Instance state machine.
 *
 * <pre>
 * PENDING -> RUNNING -> STOPPED -> RUNNING -> ... -> TERMINATED
 * PENDING -> ERROR (deploy failed, resources already released)
 * </pre>
 *
 * A launch commits a port and quota before deploying; any failure after those
 * commits releases them again before the error leaves this class. Transitions
 * on one instance are serialized; different instances proceed in parallel.
 * An instance owned by someone else is reported as not found.
 */
public class InstanceLifecycleController {

    private static final Logger log = LoggerFactory.getLogger(InstanceLifecycleController.class);

    private final InstanceRepository instances;
    private final CapacityScheduler scheduler;
    private final PortLedger ports;
    private final QuotaLedger quotas;
    private final DeploymentClient deployer;
    private final String workspaceRoot;
    private final KeyedLocks locks = new KeyedLocks();

    public InstanceLifecycleController(
            InstanceRepository instances,
            CapacityScheduler scheduler,
            PortLedger ports,
            QuotaLedger quotas,
            DeploymentClient deployer,
            String workspaceRoot) {
        this.instances = instances;
        this.scheduler = scheduler;
        this.ports = ports;
        this.quotas = quotas;
        this.deployer = deployer;
        this.workspaceRoot = workspaceRoot;
    }

    /**
     * Launch a new instance for the owner.
     *
     * @return the RUNNING record
     * @throws IllegalArgumentException      if the request is malformed
     * @throws QuotaExceededException        if the quota policy refuses; nothing committed
     * @throws InsufficientCapacityException if no worker fits; nothing committed
     * @throws DeploymentFailureException    if the deploy failed; port and quota released,
     *                                       an ERROR record kept for history
     */
    public Instance create(String ownerId, InstanceSpec spec)
            throws QuotaExceededException, InsufficientCapacityException, DeploymentFailureException {
        spec.validate();

        quotas.check(ownerId, spec.cpu(), spec.memoryGb());
        Placement placement = scheduler.selectNode(spec.cpu(), spec.memoryGb());
        if (placement.isDegraded()) {
            log.warn("Launching {} for {} on {} without capacity validation", spec.name(), ownerId,
                    placement.nodeId());
        }

        String instanceId = instances.generateId();
        return locks.call(instanceId, () -> launch(ownerId, instanceId, spec, placement));
    }

    private Instance launch(String ownerId, String instanceId, InstanceSpec spec, Placement placement)
            throws DeploymentFailureException {
        int port = ports.allocate(placement.nodeId(), instanceId);

        boolean quotaCounted;
        try {
            quotaCounted = quotas.allocate(ownerId, spec.cpu(), spec.memoryGb());
        } catch (RuntimeException e) {
            releasePort(placement.nodeId(), instanceId, e);
            throw e;
        }

        Instance pending = Instance.builder()
                .id(instanceId)
                .name(spec.name())
                .image(spec.image())
                .ownerId(ownerId)
                .nodeId(placement.nodeId())
                .nodeAddress(placement.address())
                .port(port)
                .cpu(spec.cpu())
                .memoryGb(spec.memoryGb())
                .status(InstanceStatus.PENDING)
                .createdAt(Instant.now())
                .build();

        DeployRequest request = new DeployRequest(
                placement.address(),
                "fleet-" + instanceId,
                spec.image(),
                port,
                spec.cpu(),
                spec.memoryGb(),
                workspaceRoot + "/" + ownerId + "/" + instanceId,
                spec.env());

        DeployResult result;
        try {
            result = deployer.deploy(request);
            if (result == null || result.handle() == null || result.handle().isBlank()) {
                throw new DeploymentException("deployer returned no handle");
            }
        } catch (DeploymentException | RuntimeException e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.toString();
            log.warn("Deploy of {} on {} failed, rolling back: {}", instanceId, placement.nodeId(), reason);
            rollback(pending, quotaCounted, e);
            saveFailed(pending, reason, e);
            throw new DeploymentFailureException(instanceId, reason, e);
        }

        Instance running = pending.toBuilder()
                .status(InstanceStatus.RUNNING)
                .deploymentHandle(result.handle())
                .startedAt(Instant.now())
                .build();

        try {
            instances.save(running);
        } catch (PersistenceException e) {
            log.error("Could not record running instance {}, rolling back", instanceId, e);
            rollback(pending, quotaCounted, e);
            try {
                deployer.remove(placement.address(), result.handle());
            } catch (DeploymentException | RuntimeException removeError) {
                log.warn("Could not remove orphaned workload {} on {}: {}", result.handle(), placement.address(),
                        removeError.getMessage());
                e.addSuppressed(removeError);
            }
            throw e;
        }

        log.info("Instance {} ({}) running on {} port {} for {}",
                instanceId, spec.name(), placement.nodeId(), port, ownerId);
        return running;
    }

    /**
     * RUNNING or PENDING to STOPPED. Resources stay held.
     */
    public Instance stop(String ownerId, String instanceId) throws DeploymentFailureException {
        return locks.call(instanceId, () -> {
            Instance current = visible(ownerId, instanceId);
            if (current.status() != InstanceStatus.RUNNING && current.status() != InstanceStatus.PENDING) {
                throw new InvalidStateException("stop", instanceId, current.status());
            }

            if (current.deploymentHandle() != null) {
                try {
                    deployer.stop(current.nodeAddress(), current.deploymentHandle());
                } catch (DeploymentException | RuntimeException e) {
                    throw new DeploymentFailureException(instanceId, e.getMessage(), e);
                }
            }

            Instance stopped = current.toBuilder()
                    .status(InstanceStatus.STOPPED)
                    .stoppedAt(Instant.now())
                    .build();
            instances.save(stopped);
            log.info("Instance {} stopped", instanceId);
            return stopped;
        });
    }

    /**
     * STOPPED to RUNNING.
     */
    public Instance start(String ownerId, String instanceId) throws DeploymentFailureException {
        return locks.call(instanceId, () -> {
            Instance current = visible(ownerId, instanceId);
            if (current.status() != InstanceStatus.STOPPED) {
                throw new InvalidStateException("start", instanceId, current.status());
            }

            if (current.deploymentHandle() != null) {
                try {
                    deployer.start(current.nodeAddress(), current.deploymentHandle());
                } catch (DeploymentException | RuntimeException e) {
                    throw new DeploymentFailureException(instanceId, e.getMessage(), e);
                }
            }

            Instance started = current.toBuilder()
                    .status(InstanceStatus.RUNNING)
                    .startedAt(Instant.now())
                    .stoppedAt(null)
                    .build();
            instances.save(started);
            log.info("Instance {} started", instanceId);
            return started;
        });
    }

    /**
     * Remove the workload and give back its port and quota.
     * Terminating a TERMINATED instance changes nothing.
     * A workload that cannot be removed does not block termination.
     */
    public Instance terminate(String ownerId, String instanceId) {
        return locks.withLock(instanceId, () -> {
            Instance current = visible(ownerId, instanceId);
            if (current.status() == InstanceStatus.TERMINATED) {
                return current;
            }

            if (current.deploymentHandle() != null) {
                try {
                    deployer.remove(current.nodeAddress(), current.deploymentHandle());
                } catch (DeploymentException | RuntimeException e) {
                    log.warn("Could not remove workload {} of instance {} on {}, terminating anyway: {}",
                            current.deploymentHandle(), instanceId, current.nodeAddress(), e.getMessage());
                }
            }

            // ERROR records released their resources when the deploy failed
            if (current.status() != InstanceStatus.ERROR) {
                if (current.nodeId() != null) {
                    ports.release(current.nodeId(), instanceId);
                }
                quotas.release(current.ownerId(), current.cpu(), current.memoryGb());
            }

            Instance terminated = current.toBuilder()
                    .status(InstanceStatus.TERMINATED)
                    .port(null)
                    .stoppedAt(Instant.now())
                    .build();
            instances.save(terminated);
            log.info("Instance {} terminated (was {})", instanceId, current.status());
            return terminated;
        });
    }

    /**
     * Owner's live instances, newest first.
     *
     * @param status only this status; null means everything except TERMINATED
     */
    public List<Instance> list(String ownerId, InstanceStatus status) {
        return instances.findByOwner(ownerId).stream()
                .filter(i -> status == null
                        ? i.status() != InstanceStatus.TERMINATED
                        : i.status() == status)
                .toList();
    }

    /**
     * Any record of the owner, TERMINATED included.
     */
    public Instance get(String ownerId, String instanceId) {
        return visible(ownerId, instanceId);
    }

    public InstanceCounts summary(String ownerId) {
        int total = 0;
        int running = 0;
        int stopped = 0;
        int pending = 0;
        for (Instance instance : instances.findByOwner(ownerId)) {
            switch (instance.status()) {
                case TERMINATED -> {
                    continue;
                }
                case RUNNING -> running++;
                case STOPPED -> stopped++;
                case PENDING -> pending++;
                default -> {
                }
            }
            total++;
        }
        return new InstanceCounts(total, running, stopped, pending);
    }

    private Instance visible(String ownerId, String instanceId) {
        return instances.findById(instanceId)
                .filter(i -> i.isOwnedBy(ownerId))
                .orElseThrow(() -> NotFoundException.instance(instanceId));
    }

    private void rollback(Instance pending, boolean quotaCounted, Throwable cause) {
        releasePort(pending.nodeId(), pending.id(), cause);
        if (quotaCounted) {
            try {
                quotas.release(pending.ownerId(), pending.cpu(), pending.memoryGb());
            } catch (RuntimeException e) {
                log.error("Could not release quota of {} for {}", pending.ownerId(), pending.id(), e);
                cause.addSuppressed(e);
            }
        }
    }

    private void releasePort(String nodeId, String instanceId, Throwable cause) {
        try {
            ports.release(nodeId, instanceId);
        } catch (RuntimeException e) {
            log.error("Could not release port of {} on {}", instanceId, nodeId, e);
            cause.addSuppressed(e);
        }
    }

    private void saveFailed(Instance pending, String reason, Throwable cause) {
        Instance failed = pending.toBuilder()
                .status(InstanceStatus.ERROR)
                .port(null)
                .errorMessage(reason)
                .build();
        try {
            instances.save(failed);
        } catch (PersistenceException e) {
            log.error("Could not record failed instance {}", pending.id(), e);
            cause.addSuppressed(e);
        }
    }
}
