package fleetportal;

import fleetportal.core.config.Dependencies;
import fleetportal.core.config.PortalConfig;
import fleetportal.core.server.PortalServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service entry point.
 *
 * Wires dependencies from PORTAL_* environment variables, starts the HTTP API
 * and the background health watch, and tears both down on JVM shutdown.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) {
        PortalConfig config = PortalConfig.fromEnv();

        Dependencies deps = Dependencies.create(config);
        PortalServer server = new PortalServer(deps);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
        }, "fleetportal-shutdown"));

        try {
            server.start(config.serverHost(), config.serverPort());
        } catch (RuntimeException e) {
            log.error("Portal failed to start", e);
            deps.close();
            System.exit(1);
        }

        deps.startScheduler();
        log.info("Fleet portal started");
    }
}
