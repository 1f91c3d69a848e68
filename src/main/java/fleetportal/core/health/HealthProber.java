package fleetportal.core.health;

import fleetportal.core.model.Node;
import fleetportal.core.model.NodeStatus;
import fleetportal.core.model.NodeWithStatus;
import fleetportal.core.service.NodeRegistry;
import io.netty.channel.ConnectTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Concurrent reachability probing of the registered fleet.
 *
 * Outcome policy:
 * - handshake succeeds: HEALTHY, online
 * - handshake refused: HEALTHY, online (the host answered, only the port is closed)
 * - timed out: UNHEALTHY, offline
 * - other transport failure: UNHEALTHY, offline
 * - anything unexpected inside the probe: UNKNOWN, offline
 *
 * A probe never fails the batch; every node gets a status record.
 */
public class HealthProber {

    private static final Logger log = LoggerFactory.getLogger(HealthProber.class);

    /** Added on top of the connect timeout before the prober gives up on a probe itself */
    private static final long DEADLINE_GRACE_MS = 250;

    private final NodeRegistry registry;
    private final ConnectProbe probe;
    private final int probePort;
    private final Duration timeout;

    public HealthProber(NodeRegistry registry, ConnectProbe probe, int probePort, Duration timeout) {
        this.registry = registry;
        this.probe = probe;
        this.probePort = probePort;
        this.timeout = timeout;
    }

    /**
     * Probe one node and wait for the outcome.
     */
    public NodeStatus probe(Node node) {
        return probeAsync(node).join();
    }

    /**
     * Probe one node. The returned future always completes normally.
     */
    public CompletableFuture<NodeStatus> probeAsync(Node node) {
        long startNanos = System.nanoTime();

        CompletableFuture<Void> attempt;
        try {
            attempt = probe.connect(node.address(), probePort, timeout);
            if (attempt == null) {
                throw new IllegalStateException("probe returned no result");
            }
        } catch (RuntimeException e) {
            log.warn("Probe of node {} failed to start: {}", node.id(), e.toString());
            return CompletableFuture.completedFuture(
                    NodeStatus.unknown(node.id(), elapsedMs(startNanos), e.toString()));
        }

        return attempt
                .orTimeout(timeout.toMillis() + DEADLINE_GRACE_MS, TimeUnit.MILLISECONDS)
                .handle((ignored, error) -> classify(node, startNanos, error))
                .exceptionally(error -> NodeStatus.unknown(node.id(), elapsedMs(startNanos), error.toString()));
    }

    /**
     * Probe every registered node concurrently.
     * Each probe is bounded by its own timeout; the result keeps registry order.
     */
    public List<NodeWithStatus> probeAll() {
        return probeAll(registry.list(null));
    }

    public List<NodeWithStatus> probeAll(List<Node> nodes) {
        if (nodes.isEmpty()) {
            return List.of();
        }

        long startNanos = System.nanoTime();

        List<CompletableFuture<NodeStatus>> pending = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            pending.add(probeAsync(node));
        }

        CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();

        List<NodeWithStatus> results = new ArrayList<>(nodes.size());
        int online = 0;
        for (int i = 0; i < nodes.size(); i++) {
            NodeStatus status = pending.get(i).join();
            if (status.online()) {
                online++;
            }
            results.add(new NodeWithStatus(nodes.get(i), status));
        }

        log.debug("Probed {} nodes in {}ms, {} online", nodes.size(), Math.round(elapsedMs(startNanos)), online);
        return results;
    }

    /**
     * Probe a single registered node.
     *
     * @throws fleetportal.core.error.NotFoundException if the node is not registered
     */
    public NodeWithStatus probeNode(String nodeId) {
        Node node = registry.get(nodeId);
        return new NodeWithStatus(node, probe(node));
    }

    private NodeStatus classify(Node node, long startNanos, Throwable error) {
        double elapsed = elapsedMs(startNanos);
        if (error == null) {
            return NodeStatus.healthy(node.id(), elapsed);
        }

        Throwable cause = unwrap(error);

        if (cause instanceof ConnectTimeoutException
                || cause instanceof SocketTimeoutException
                || cause instanceof TimeoutException) {
            log.debug("Node {} ({}) timed out after {}ms", node.id(), node.address(), elapsed);
            return NodeStatus.timedOut(node.id(), elapsed);
        }
        if (cause instanceof ConnectException) {
            log.debug("Node {} ({}) refused port {}", node.id(), node.address(), probePort);
            return NodeStatus.refused(node.id(), elapsed);
        }
        if (cause instanceof IOException) {
            log.debug("Node {} ({}) unreachable: {}", node.id(), node.address(), cause.getMessage());
            return NodeStatus.unreachable(node.id(), elapsed, String.valueOf(cause.getMessage()));
        }

        log.warn("Unexpected probe failure for node {}: {}", node.id(), cause.toString());
        return NodeStatus.unknown(node.id(), elapsed, cause.toString());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static double elapsedMs(long startNanos) {
        return Math.round((System.nanoTime() - startNanos) / 10_000.0) / 100.0;
    }
}
