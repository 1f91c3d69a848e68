package fleetportal.core.deploy;

import fleetportal.core.error.DeploymentException;

/**
 * Runs workloads on fleet nodes.
 * Handles are opaque to callers and only meaningful to the client that issued them.
 */
public interface DeploymentClient {

    DeployResult deploy(DeployRequest request) throws DeploymentException;

    void stop(String address, String handle) throws DeploymentException;

    void start(String address, String handle) throws DeploymentException;

    /**
     * Stop and delete the workload.
     */
    void remove(String address, String handle) throws DeploymentException;
}
