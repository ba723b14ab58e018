package com.vulnstructure.engine.bounded;

import com.vulnstructure.engine.support.Texts;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs a task on its own daemon worker thread and waits at most a fixed budget.
 *
 * On timeout the caller gets the failure value for "timeout" immediately. The
 * worker is not interrupted: it is abandoned and keeps running until its task
 * returns, so CPU and memory stay in use until then. Daemon workers never keep
 * the JVM alive.
 *
 * A task that throws yields the failure value for its cleaned message.
 */
public class BoundedExecutor {

    public static final String TIMEOUT = "timeout";

    private static final AtomicInteger WORKER_IDS = new AtomicInteger();

    private final int errorMessageLength;

    public BoundedExecutor(int errorMessageLength) {
        this.errorMessageLength = errorMessageLength;
    }

    /**
     * @param name      label for the worker thread and log lines
     * @param task      work to run
     * @param budget    wall-clock budget
     * @param onFailure maps a failure message to the value returned instead
     */
    public <T> T call(String name, Callable<T> task, Duration budget, Function<String, T> onFailure) {
        FutureTask<T> future = new FutureTask<>(task);
        Thread worker = new Thread(future, "structure-worker-" + name + "-" + WORKER_IDS.incrementAndGet());
        worker.setDaemon(true);
        worker.start();
        try {
            return future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            System.err.println("[structure-engine] WARNING: " + name + " exceeded "
                    + budget.toMillis() + " ms; abandoning worker " + worker.getName());
            return onFailure.apply(TIMEOUT);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return onFailure.apply(Texts.cleanErrorMessage(Texts.describe(cause), errorMessageLength));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return onFailure.apply("interrupted");
        }
    }
}
