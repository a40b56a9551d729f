package com.inspectvoice.sealing;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.jboss.logging.Logger;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for the sealed export service.
 * <p>
 * On SIGTERM the lifecycle observer flips a shutdown flag so the health endpoint
 * reports DOWN while in-flight seals finish. A seal that has not yet reached the
 * ledger append is simply discarded; nothing is half-written.
 */
@QuarkusMain
public class SealedExportApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(SealedExportApplication.class);

    public static void main(String[] args) {
        Quarkus.run(SealedExportApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.info("Sealed export service starting...");
        Quarkus.waitForExit();
        return 0;
    }

    /**
     * Checks if the application is shutting down.
     *
     * @return true if shutdown is in progress
     */
    public static boolean isShuttingDown() {
        return ApplicationLifecycleObserver.SHUTTING_DOWN.get();
    }
}

/**
 * Lifecycle observer for application startup and shutdown events.
 */
@ApplicationScoped
class ApplicationLifecycleObserver {

    private static final Logger LOG = Logger.getLogger(ApplicationLifecycleObserver.class);

    static final AtomicBoolean SHUTTING_DOWN = new AtomicBoolean(false);

    void onStart(@Observes StartupEvent event) {
        LOG.info("Sealed export service started successfully");
    }

    void onShutdown(@Observes ShutdownEvent event) {
        LOG.info("Shutdown signal received, draining in-flight seals...");

        // health reports DOWN from here on
        SHUTTING_DOWN.set(true);

        try {
            Thread.sleep(2000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Shutdown grace period interrupted");
        }

        LOG.info("Graceful shutdown complete");
    }
}
