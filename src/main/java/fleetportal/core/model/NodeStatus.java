package fleetportal.core.model;

import java.time.Instant;

/**
 * Result of probing a single node. Recomputed on every probe, never stored.
 */
public record NodeStatus(
        String nodeId,
        NodeHealth health,
        boolean online,
        double responseTimeMs,
        Instant checkedAt,
        String errorMessage) {

    public static NodeStatus healthy(String nodeId, double responseTimeMs) {
        return new NodeStatus(nodeId, NodeHealth.HEALTHY, true, responseTimeMs, Instant.now(), null);
    }

    public static NodeStatus refused(String nodeId, double responseTimeMs) {
        return new NodeStatus(nodeId, NodeHealth.HEALTHY, true, responseTimeMs, Instant.now(),
                "probe port refused connection (host is online)");
    }

    public static NodeStatus timedOut(String nodeId, double responseTimeMs) {
        return new NodeStatus(nodeId, NodeHealth.UNHEALTHY, false, responseTimeMs, Instant.now(),
                "connection timed out");
    }

    public static NodeStatus unreachable(String nodeId, double responseTimeMs, String reason) {
        return new NodeStatus(nodeId, NodeHealth.UNHEALTHY, false, responseTimeMs, Instant.now(),
                "network error: " + reason);
    }

    public static NodeStatus unknown(String nodeId, double responseTimeMs, String reason) {
        return new NodeStatus(nodeId, NodeHealth.UNKNOWN, false, responseTimeMs, Instant.now(),
                "probe failed: " + reason);
    }
}
