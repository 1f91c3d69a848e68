package fleetportal.core.error;

/**
 * The deployment collaborator could not start, stop or resume a workload.
 * When raised from a launch, the port and quota have already been released.
 */
public class DeploymentFailureException extends PlacementException {

    private final String instanceId;
    private final String reason;

    public DeploymentFailureException(String instanceId, String reason, Throwable cause) {
        super("Deployment failed for instance " + instanceId, cause);
        this.instanceId = instanceId;
        this.reason = reason;
    }

    public String instanceId() {
        return instanceId;
    }

    @Override
    public String detail() {
        return reason;
    }
}
