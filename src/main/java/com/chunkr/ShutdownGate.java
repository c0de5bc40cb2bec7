package com.chunkr;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shutdown hook for an insert run. On SIGINT/SIGTERM it asks the pipeline to stop, then holds the JVM
 * until the run has persisted its report and ledger, or until {@code maxWait} passes.
 */
final class ShutdownGate {
    private static final Logger log = LoggerFactory.getLogger(ShutdownGate.class);

    private final Runnable stopRequest;
    private final Duration maxWait;
    private final CountDownLatch released = new CountDownLatch(1);
    private final Thread hook;

    ShutdownGate(Runnable stopRequest, Duration maxWait) {
        this.stopRequest = stopRequest;
        this.maxWait = maxWait;
        this.hook = new Thread(this::onShutdown, "chunkr-shutdown");
    }

    void register() {
        Runtime.getRuntime().addShutdownHook(hook);
    }

    void onShutdown() {
        log.info("shutdown.requested waitingForRunState=true");
        stopRequest.run();
        try {
            if (!released.await(maxWait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("shutdown.timeout waited={} runStateSaved=false", maxWait);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Must only be called once the run state is on disk.
     */
    void release() {
        released.countDown();
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // already shutting down; the hook is running
            log.debug("Shutdown in progress, hook stays registered");
        }
    }
}
