package fleetportal.core.api.v1;

import fleetportal.core.api.Controller;
import fleetportal.core.api.Requests;
import fleetportal.core.api.v1.dto.CapacityResponse;
import fleetportal.core.api.v1.dto.ClusterStatusResponse;
import fleetportal.core.api.v1.dto.NodeStatusResponse;
import fleetportal.core.health.ClusterAggregator;
import fleetportal.core.health.HealthProber;
import fleetportal.core.model.NodeWithStatus;
import fleetportal.core.placement.CapacityScheduler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for live cluster health (public API).
 * Every call probes the fleet afresh.
 *
 * GET /api/v1/cluster/status[?include_nodes=true]
 * GET /api/v1/cluster/nodes
 * GET /api/v1/cluster/nodes/{id}/health
 * GET /api/v1/cluster/capacity
 */
public class ClusterController implements Controller {

    private static final String STATUS_PATH = "/api/v1/cluster/status";
    private static final String NODES_PATH = "/api/v1/cluster/nodes";
    private static final String CAPACITY_PATH = "/api/v1/cluster/capacity";
    private static final Pattern NODE_HEALTH_PATTERN = Pattern.compile("^/api/v1/cluster/nodes/([^/]+)/health$");

    private final HealthProber prober;
    private final ClusterAggregator aggregator;
    private final CapacityScheduler scheduler;

    public ClusterController(HealthProber prober, ClusterAggregator aggregator, CapacityScheduler scheduler) {
        this.prober = prober;
        this.aggregator = aggregator;
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.GET)) {
            return false;
        }
        return STATUS_PATH.equals(path)
                || NODES_PATH.equals(path)
                || CAPACITY_PATH.equals(path)
                || NODE_HEALTH_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (STATUS_PATH.equals(path)) {
            boolean includeNodes = Boolean.parseBoolean(Requests.queryParam(req, "include_nodes"));
            List<NodeWithStatus> nodes = prober.probeAll();
            return ControllerResponse.ok(ClusterStatusResponse.from(aggregator.aggregate(nodes, includeNodes)));
        }

        if (NODES_PATH.equals(path)) {
            List<NodeStatusResponse> nodes = prober.probeAll().stream()
                    .map(NodeStatusResponse::from)
                    .toList();
            return ControllerResponse.ok(nodes);
        }

        if (CAPACITY_PATH.equals(path)) {
            return ControllerResponse.ok(CapacityResponse.from(scheduler.maxAvailableCapacity()));
        }

        Matcher nodeHealth = NODE_HEALTH_PATTERN.matcher(path);
        if (nodeHealth.matches()) {
            return ControllerResponse.ok(NodeStatusResponse.from(prober.probeNode(nodeHealth.group(1))));
        }

        throw new IllegalArgumentException("unsupported cluster request: " + path);
    }
}
