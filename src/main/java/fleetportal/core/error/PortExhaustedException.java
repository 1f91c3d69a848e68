package fleetportal.core.error;

/**
 * Every port in the allocatable range is live on the node.
 */
public class PortExhaustedException extends PortalException {

    private final String nodeId;

    public PortExhaustedException(String nodeId, int rangeStart, int rangeEnd) {
        super("No free port on node " + nodeId + " in range " + rangeStart + "-" + rangeEnd);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
