package fleetportal.core.api.v1;

import fleetportal.core.api.Controller;
import fleetportal.core.api.Requests;
import fleetportal.core.api.v1.dto.NodeRequest;
import fleetportal.core.api.v1.dto.NodeResponse;
import fleetportal.core.ledger.PortLedger;
import fleetportal.core.model.Node;
import fleetportal.core.model.NodeRole;
import fleetportal.core.service.NodeRegistry;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the node registry (public API).
 *
 * GET    /api/v1/nodes[?role=]  - List nodes
 * GET    /api/v1/nodes/{id}     - Get a node with its port usage
 * POST   /api/v1/nodes          - Register a node
 * PUT    /api/v1/nodes/{id}     - Update a node
 * DELETE /api/v1/nodes/{id}     - Remove a node
 */
public class NodeController implements Controller {

    private static final Pattern NODES_PATTERN = Pattern.compile("^/api/v1/nodes$");
    private static final Pattern NODE_BY_ID_PATTERN = Pattern.compile("^/api/v1/nodes/([^/]+)$");

    private final NodeRegistry registry;
    private final PortLedger ports;

    public NodeController(NodeRegistry registry, PortLedger ports) {
        this.registry = registry;
        this.ports = ports;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (NODES_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (NODE_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT)
                    || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        HttpMethod method = req.method();

        if (NODES_PATTERN.matcher(path).matches()) {
            if (method.equals(HttpMethod.POST)) {
                Node node = Requests.body(req, NodeRequest.class).toNode(null);
                return ControllerResponse.created(NodeResponse.from(registry.add(node)));
            }
            String role = Requests.queryParam(req, "role");
            return ControllerResponse.ok(registry.list(role != null ? NodeRole.parse(role) : null).stream()
                    .map(NodeResponse::from)
                    .toList());
        }

        Matcher byId = NODE_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            String nodeId = byId.group(1);
            if (method.equals(HttpMethod.PUT)) {
                Node changes = Requests.body(req, NodeRequest.class).toNode(nodeId);
                return ControllerResponse.ok(NodeResponse.from(registry.update(nodeId, changes)));
            }
            if (method.equals(HttpMethod.DELETE)) {
                registry.delete(nodeId);
                return ControllerResponse.noContent();
            }
            Node node = registry.get(nodeId);
            return ControllerResponse.ok(NodeResponse.from(node, ports.usage(nodeId)));
        }

        throw new IllegalArgumentException("unsupported node request: " + method + " " + path);
    }
}
