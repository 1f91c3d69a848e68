package fleetportal.core.scheduler;

import fleetportal.core.config.PortalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - HealthWatcher: periodic fleet probe, logs grade transitions
 *
 * Uses a single-threaded executor so rounds never overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final HealthWatcher healthWatcher;
    private final PortalConfig config;

    private volatile boolean running = false;

    public Scheduler(HealthWatcher healthWatcher, PortalConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "fleetportal-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.healthWatcher = healthWatcher;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.healthWatchInterval().toMillis();
        executor.scheduleWithFixedDelay(healthWatcher, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Health watcher scheduled every {}ms", intervalMs);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }
}
