package fleetportal.core.health;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * A single bounded connectivity attempt against host:port.
 * The future completes normally when the handshake succeeds and exceptionally
 * with the transport error otherwise (refused, timed out, unreachable...).
 */
@FunctionalInterface
public interface ConnectProbe {

    CompletableFuture<Void> connect(String host, int port, Duration timeout);
}
