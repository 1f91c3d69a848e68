package fleetportal.core.api.v1;

import fleetportal.core.api.Controller;
import fleetportal.core.api.Requests;
import fleetportal.core.api.v1.dto.CreateInstanceRequest;
import fleetportal.core.api.v1.dto.InstanceResponse;
import fleetportal.core.error.PlacementException;
import fleetportal.core.model.Instance;
import fleetportal.core.model.InstanceStatus;
import fleetportal.core.service.InstanceLifecycleController;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for user instances (public API).
 *
 * POST   /api/v1/instances              - Launch an instance
 * GET    /api/v1/instances[?status=]    - List the caller's instances
 * GET    /api/v1/instances/summary      - Per-status counts
 * GET    /api/v1/instances/{id}         - Get one instance
 * POST   /api/v1/instances/{id}/stop    - Stop
 * POST   /api/v1/instances/{id}/start   - Start
 * DELETE /api/v1/instances/{id}         - Terminate
 */
public class InstanceController implements Controller {

    private static final Pattern INSTANCES_PATTERN = Pattern.compile("^/api/v1/instances$");
    private static final Pattern SUMMARY_PATTERN = Pattern.compile("^/api/v1/instances/summary$");
    private static final Pattern INSTANCE_BY_ID_PATTERN = Pattern.compile("^/api/v1/instances/([^/]+)$");
    private static final Pattern ACTION_PATTERN = Pattern.compile("^/api/v1/instances/([^/]+)/(stop|start)$");

    private final InstanceLifecycleController lifecycle;
    private final String defaultUserId;

    public InstanceController(InstanceLifecycleController lifecycle, String defaultUserId) {
        this.lifecycle = lifecycle;
        this.defaultUserId = defaultUserId;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (INSTANCES_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (ACTION_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST);
        }
        if (INSTANCE_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path)
            throws PlacementException {
        String caller = Requests.callerId(req, defaultUserId);
        HttpMethod method = req.method();

        if (INSTANCES_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) ? handleCreate(req, caller) : handleList(req, caller);
        }

        Matcher action = ACTION_PATTERN.matcher(path);
        if (action.matches()) {
            String instanceId = action.group(1);
            Instance instance = "stop".equals(action.group(2))
                    ? lifecycle.stop(caller, instanceId)
                    : lifecycle.start(caller, instanceId);
            return ControllerResponse.ok(InstanceResponse.from(instance));
        }

        if (SUMMARY_PATTERN.matcher(path).matches() && method.equals(HttpMethod.GET)) {
            return ControllerResponse.ok(lifecycle.summary(caller));
        }

        Matcher byId = INSTANCE_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            String instanceId = byId.group(1);
            if (method.equals(HttpMethod.DELETE)) {
                lifecycle.terminate(caller, instanceId);
                return ControllerResponse.noContent();
            }
            return ControllerResponse.ok(InstanceResponse.from(lifecycle.get(caller, instanceId)));
        }

        throw new IllegalArgumentException("unsupported instance request: " + method + " " + path);
    }

    private ControllerResponse handleCreate(FullHttpRequest req, String caller) throws PlacementException {
        CreateInstanceRequest request = Requests.body(req, CreateInstanceRequest.class);
        Instance instance = lifecycle.create(caller, request.toSpec());
        return ControllerResponse.created(InstanceResponse.from(instance));
    }

    private ControllerResponse handleList(FullHttpRequest req, String caller) {
        String statusParam = Requests.queryParam(req, "status");
        InstanceStatus status = statusParam != null ? InstanceStatus.parse(statusParam) : null;

        List<InstanceResponse> instances = lifecycle.list(caller, status).stream()
                .map(InstanceResponse::from)
                .toList();
        return ControllerResponse.ok(Map.of("instances", instances, "count", instances.size()));
    }
}
