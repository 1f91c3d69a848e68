package fleetportal.core.model;

/**
 * Per-user quota limits and usage counters.
 * Used counters are never negative.
 */
public record UserQuota(
        String userId,
        String username,
        int maxInstances,
        int maxCpu,
        int maxMemory,
        int usedInstances,
        int usedCpu,
        int usedMemory) {

    public static final int DEFAULT_MAX_INSTANCES = 5;
    public static final int DEFAULT_MAX_CPU = 16;
    public static final int DEFAULT_MAX_MEMORY = 32;

    public static UserQuota fresh(String userId, String username) {
        return new UserQuota(userId, username, DEFAULT_MAX_INSTANCES, DEFAULT_MAX_CPU, DEFAULT_MAX_MEMORY, 0, 0, 0);
    }

    public UserQuota plus(int cpu, int memory) {
        return new UserQuota(userId, username, maxInstances, maxCpu, maxMemory,
                usedInstances + 1, usedCpu + cpu, usedMemory + memory);
    }

    /** Decrement, clamped at zero. */
    public UserQuota minus(int cpu, int memory) {
        return new UserQuota(userId, username, maxInstances, maxCpu, maxMemory,
                Math.max(0, usedInstances - 1), Math.max(0, usedCpu - cpu), Math.max(0, usedMemory - memory));
    }

    public int availableInstances() {
        return Math.max(0, maxInstances - usedInstances);
    }

    public int availableCpu() {
        return Math.max(0, maxCpu - usedCpu);
    }

    public int availableMemory() {
        return Math.max(0, maxMemory - usedMemory);
    }

    public double cpuUsagePercent() {
        return percent(usedCpu, maxCpu);
    }

    public double memoryUsagePercent() {
        return percent(usedMemory, maxMemory);
    }

    private static double percent(int used, int max) {
        if (max == 0) {
            return 0.0;
        }
        return Math.round(used * 1000.0 / max) / 10.0;
    }
}
