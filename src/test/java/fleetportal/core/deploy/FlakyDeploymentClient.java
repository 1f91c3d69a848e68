package fleetportal.core.deploy;

import fleetportal.core.error.DeploymentException;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulated deployer whose calls can be made to fail on demand.
 */
public class FlakyDeploymentClient extends SimulatedDeploymentClient {

    private volatile boolean failDeploy;
    private volatile boolean failLifecycle;
    private volatile boolean crashLifecycle;
    private final AtomicInteger removeCalls = new AtomicInteger();

    public void failDeploy(boolean fail) {
        this.failDeploy = fail;
    }

    /** Make stop, start and remove fail. */
    public void failLifecycle(boolean fail) {
        this.failLifecycle = fail;
    }

    /** Make stop and start throw an unchecked exception, as a broken transport would. */
    public void crashLifecycle(boolean crash) {
        this.crashLifecycle = crash;
    }

    public int removeCalls() {
        return removeCalls.get();
    }

    @Override
    public DeployResult deploy(DeployRequest request) throws DeploymentException {
        if (failDeploy) {
            throw new DeploymentException("docker: image not found: " + request.image());
        }
        return super.deploy(request);
    }

    @Override
    public void stop(String address, String handle) throws DeploymentException {
        if (crashLifecycle) {
            throw new IllegalStateException("transport closed");
        }
        if (failLifecycle) {
            throw new DeploymentException("ssh: connection reset");
        }
        super.stop(address, handle);
    }

    @Override
    public void start(String address, String handle) throws DeploymentException {
        if (crashLifecycle) {
            throw new IllegalStateException("transport closed");
        }
        if (failLifecycle) {
            throw new DeploymentException("ssh: connection reset");
        }
        super.start(address, handle);
    }

    @Override
    public void remove(String address, String handle) throws DeploymentException {
        removeCalls.incrementAndGet();
        if (failLifecycle) {
            throw new DeploymentException("ssh: connection reset");
        }
        super.remove(address, handle);
    }
}
