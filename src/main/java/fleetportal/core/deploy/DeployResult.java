package fleetportal.core.deploy;

/**
 * @param handle identifier of the running workload, used for stop/start/remove
 */
public record DeployResult(String handle) {
}
