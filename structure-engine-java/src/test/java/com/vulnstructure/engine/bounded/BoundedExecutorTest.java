package com.vulnstructure.engine.bounded;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class BoundedExecutorTest {

    private final BoundedExecutor executor = new BoundedExecutor(100);

    private static final Function<String, String> FAILED = reason -> "failed: " + reason;

    @Test
    void returnsTaskResult() {
        assertEquals("done", executor.call("test", () -> "done", Duration.ofSeconds(1), FAILED));
    }

    @Test
    void slowTaskTimesOutWithinBudget() {
        CountDownLatch never = new CountDownLatch(1);
        long start = System.nanoTime();
        String result = executor.call("test", () -> {
            never.await(30, TimeUnit.SECONDS);
            return "late";
        }, Duration.ofSeconds(1), FAILED);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals("failed: " + BoundedExecutor.TIMEOUT, result);
        assertTrue(elapsedMillis < 3000, "took " + elapsedMillis + " ms");
        never.countDown();
    }

    @Test
    void thrownExceptionBecomesCleanedMessage() {
        String result = executor.call("test", () -> {
            throw new IllegalStateException("  bad\n\tstate  ");
        }, Duration.ofSeconds(1), FAILED);
        assertEquals("failed: bad state", result);
    }

    @Test
    void exceptionWithoutMessageUsesClassName() {
        String result = executor.call("test", () -> {
            throw new UnsupportedOperationException();
        }, Duration.ofSeconds(1), FAILED);
        assertEquals("failed: UnsupportedOperationException", result);
    }

    @Test
    void longMessageIsCapped() {
        BoundedExecutor capped = new BoundedExecutor(10);
        String result = capped.call("test", () -> {
            throw new RuntimeException("abcdefghijklmnop");
        }, Duration.ofSeconds(1), reason -> reason);
        assertEquals("abcdefg...", result);
    }

    @Test
    void workerIsDaemonThread() {
        Boolean daemon = executor.call("test",
                () -> Thread.currentThread().isDaemon()
                        && Thread.currentThread().getName().startsWith("structure-worker-test-"),
                Duration.ofSeconds(1), reason -> false);
        assertTrue(daemon);
    }
}
