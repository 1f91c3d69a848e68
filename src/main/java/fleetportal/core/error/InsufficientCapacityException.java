package fleetportal.core.error;

/**
 * No worker node can host the requested cpu/memory right now.
 * Carries the largest single-node headroom so the caller can explain the shortfall.
 */
public class InsufficientCapacityException extends PlacementException {

    private final int requestedCpu;
    private final int requestedMemory;
    private final double maxAvailableCpu;
    private final double maxAvailableMemory;

    public InsufficientCapacityException(int requestedCpu, int requestedMemory,
            double maxAvailableCpu, double maxAvailableMemory) {
        super("Insufficient Capacity");
        this.requestedCpu = requestedCpu;
        this.requestedMemory = requestedMemory;
        this.maxAvailableCpu = maxAvailableCpu;
        this.maxAvailableMemory = maxAvailableMemory;
    }

    public int requestedCpu() {
        return requestedCpu;
    }

    public int requestedMemory() {
        return requestedMemory;
    }

    public double maxAvailableCpu() {
        return maxAvailableCpu;
    }

    public double maxAvailableMemory() {
        return maxAvailableMemory;
    }

    @Override
    public String detail() {
        return "Requested " + requestedCpu + " vCPU and " + requestedMemory + " GB RAM, but max available is "
                + (int) maxAvailableCpu + " vCPU and " + (int) maxAvailableMemory + " GB RAM.";
    }
}
