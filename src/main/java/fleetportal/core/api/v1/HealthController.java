package fleetportal.core.api.v1;

import fleetportal.core.api.Controller;
import fleetportal.core.api.v1.dto.HealthResponse;
import fleetportal.core.config.PortalConfig;
import fleetportal.core.service.NodeRegistry;
import fleetportal.core.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final NodeRegistry nodeRegistry;
    private final PortalConfig config;

    public HealthController(Database database, NodeRegistry nodeRegistry, PortalConfig config) {
        this.database = database;
        this.nodeRegistry = nodeRegistry;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (!database.isHealthy()) {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy("connection failed"));
        }

        try {
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    nodeRegistry.list(null).size(),
                    config.hasCapacityFeed() ? "configured" : "none",
                    config.deployerMode().name().toLowerCase());
            return ControllerResponse.ok(response);
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy(e.getMessage()));
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
