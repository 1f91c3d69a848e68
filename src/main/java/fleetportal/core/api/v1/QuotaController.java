package fleetportal.core.api.v1;

import fleetportal.core.api.Controller;
import fleetportal.core.api.Requests;
import fleetportal.core.api.v1.dto.DashboardResponse;
import fleetportal.core.api.v1.dto.QuotaResponse;
import fleetportal.core.ledger.QuotaLedger;
import fleetportal.core.model.NodeRole;
import fleetportal.core.service.InstanceLifecycleController;
import fleetportal.core.service.NodeRegistry;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.time.Instant;

/**
 * Controller for the caller's quota and dashboard figures.
 *
 * GET /api/v1/quota
 * GET /api/v1/dashboard/summary
 */
public class QuotaController implements Controller {

    private static final String QUOTA_PATH = "/api/v1/quota";
    private static final String DASHBOARD_PATH = "/api/v1/dashboard/summary";

    private final QuotaLedger quotas;
    private final InstanceLifecycleController lifecycle;
    private final NodeRegistry registry;
    private final String defaultUserId;

    public QuotaController(QuotaLedger quotas, InstanceLifecycleController lifecycle, NodeRegistry registry,
            String defaultUserId) {
        this.quotas = quotas;
        this.lifecycle = lifecycle;
        this.registry = registry;
        this.defaultUserId = defaultUserId;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && (QUOTA_PATH.equals(path) || DASHBOARD_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        String caller = Requests.callerId(req, defaultUserId);

        if (QUOTA_PATH.equals(path)) {
            return ControllerResponse.ok(QuotaResponse.from(quotas.summary(caller)));
        }

        // users without a quota row still get a dashboard
        QuotaResponse quota = quotas.quota(caller).map(QuotaResponse::from).orElse(null);
        DashboardResponse response = new DashboardResponse(
                lifecycle.summary(caller),
                quota,
                new DashboardResponse.NodeCounts(
                        registry.list(null).size(),
                        registry.list(NodeRole.WORKER).size()),
                Instant.now());
        return ControllerResponse.ok(response);
    }
}
