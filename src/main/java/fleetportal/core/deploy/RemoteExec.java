package fleetportal.core.deploy;

import fleetportal.core.error.DeploymentException;

/**
 * Runs a command on a fleet node.
 */
public interface RemoteExec {

    /**
     * @throws DeploymentException if the node cannot be reached or the command does not finish in time;
     *                             a command that runs and fails is reported through the exit status
     */
    ExecResult exec(String address, RemoteCommand command) throws DeploymentException;
}
