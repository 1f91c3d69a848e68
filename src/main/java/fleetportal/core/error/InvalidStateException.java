package fleetportal.core.error;

import fleetportal.core.model.InstanceStatus;

/**
 * A lifecycle operation is not allowed from the instance's current status.
 */
public class InvalidStateException extends PortalException {

    private final InstanceStatus current;

    public InvalidStateException(String operation, String instanceId, InstanceStatus current) {
        super("Cannot " + operation + " instance " + instanceId + ": instance is in '"
                + current.name().toLowerCase() + "' state");
        this.current = current;
    }

    public InstanceStatus current() {
        return current;
    }
}
