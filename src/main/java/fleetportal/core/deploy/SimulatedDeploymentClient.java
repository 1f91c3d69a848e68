package fleetportal.core.deploy;

import fleetportal.core.error.DeploymentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process deployer for local runs and tests.
 * Keeps workload state in memory; nothing leaves the JVM.
 */
public class SimulatedDeploymentClient implements DeploymentClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatedDeploymentClient.class);

    public enum State {
        RUNNING,
        STOPPED
    }

    private final Map<String, State> workloads = new ConcurrentHashMap<>();

    @Override
    public DeployResult deploy(DeployRequest request) throws DeploymentException {
        String handle = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        workloads.put(handle, State.RUNNING);
        log.info("Simulated deploy of {} ({}) on {}:{} -> {}",
                request.workloadName(), request.image(), request.address(), request.port(), handle);
        return new DeployResult(handle);
    }

    @Override
    public void stop(String address, String handle) throws DeploymentException {
        transition(handle, State.STOPPED);
    }

    @Override
    public void start(String address, String handle) throws DeploymentException {
        transition(handle, State.RUNNING);
    }

    @Override
    public void remove(String address, String handle) throws DeploymentException {
        if (workloads.remove(handle) == null) {
            throw new DeploymentException("no such workload: " + handle);
        }
        log.info("Simulated remove of {} on {}", handle, address);
    }

    public State state(String handle) {
        return workloads.get(handle);
    }

    public int workloadCount() {
        return workloads.size();
    }

    private void transition(String handle, State next) throws DeploymentException {
        if (workloads.replace(handle, next) == null) {
            throw new DeploymentException("no such workload: " + handle);
        }
        log.debug("Simulated workload {} -> {}", handle, next);
    }
}
