package com.chunkr;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShutdownGateTest {

    @Test
    void shouldHoldShutdownUntilRunStateIsReleased() throws InterruptedException {
        CountDownLatch stopRequested = new CountDownLatch(1);
        ShutdownGate gate = new ShutdownGate(stopRequested::countDown, Duration.ofSeconds(30));
        Thread shutdown = new Thread(gate::onShutdown);

        shutdown.start();

        assertTrue(stopRequested.await(5, TimeUnit.SECONDS));
        shutdown.join(200);
        assertTrue(shutdown.isAlive());

        gate.release();
        shutdown.join(5_000);
        assertFalse(shutdown.isAlive());
    }

    @Test
    void shouldStopWaitingAfterMaxWait() throws InterruptedException {
        ShutdownGate gate = new ShutdownGate(() -> {
        }, Duration.ofMillis(50));
        Thread shutdown = new Thread(gate::onShutdown);

        shutdown.start();
        shutdown.join(5_000);

        assertFalse(shutdown.isAlive());
    }

    @Test
    void shouldReturnImmediatelyWhenAlreadyReleased() throws InterruptedException {
        ShutdownGate gate = new ShutdownGate(() -> {
        }, Duration.ofMinutes(5));
        gate.register();
        gate.release();
        Thread shutdown = new Thread(gate::onShutdown);

        shutdown.start();
        shutdown.join(5_000);

        assertFalse(shutdown.isAlive());
    }
}
