package org.ambudispatch.engine.scheduler;

import org.ambudispatch.engine.domain.exception.SimulationException;
import org.ambudispatch.engine.sim.SimulationEngine;
import org.ambudispatch.engine.sim.SimulationResult;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs independent simulations on a fixed pool of worker threads, e.g. one
 * run per policy or per random seed. Each engine builds its own run context,
 * so workers share nothing but read-only input.
 */
public final class RunScheduler {

    private static final Logger LOG = Logger.getLogger(RunScheduler.class.getName());

    private final ExecutorService executor;
    private final int workers;
    private volatile boolean running = true;

    public RunScheduler(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1");
        }
        this.workers = workers;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "simulation-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Submit a single run.
     */
    public Future<SimulationResult> submit(String label, SimulationEngine engine) {
        Objects.requireNonNull(engine, "engine must not be null");
        if (!running) {
            throw new IllegalStateException("Scheduler stopped");
        }
        return executor.submit(() -> {
            LOG.fine(() -> "Run " + label + " started on " + Thread.currentThread().getName());
            return engine.run();
        });
    }

    /**
     * Run every engine and wait for all of them.
     *
     * @param runs labelled engines; the result map keeps the same order
     * @param budget wall-clock budget for the whole batch; a run still going
     *               when it expires is cancelled and reported as CANCELLED
     * @throws SimulationException if any run fails
     */
    public Map<String, SimulationResult> runAll(Map<String, SimulationEngine> runs, Duration budget) {
        Objects.requireNonNull(budget, "budget must not be null");
        Map<String, Future<SimulationResult>> futures = new LinkedHashMap<>();
        runs.forEach((label, engine) -> futures.put(label, submit(label, engine)));

        long deadline = System.nanoTime() + budget.toNanos();
        Map<String, SimulationResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, Future<SimulationResult>> entry : futures.entrySet()) {
            String label = entry.getKey();
            Future<SimulationResult> future = entry.getValue();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                results.put(label, future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                LOG.warning(() -> "Run " + label + " exceeded its budget of " + budget + ", cancelling");
                runs.get(label).cancel();
                results.put(label, await(label, future));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SimulationException("Interrupted while waiting for run " + label, e);
            } catch (ExecutionException e) {
                LOG.log(Level.SEVERE, e.getCause(), () -> "Run " + label + " failed");
                throw failure(label, e);
            }
        }
        return results;
    }

    private static SimulationResult await(String label, Future<SimulationResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SimulationException("Interrupted while waiting for run " + label, e);
        } catch (ExecutionException e) {
            throw failure(label, e);
        }
    }

    private static SimulationException failure(String label, ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof SimulationException) {
            return (SimulationException) cause;
        }
        return new SimulationException("Run " + label + " failed: " + cause, cause);
    }

    public int getWorkers() {
        return workers;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stop the scheduler, waiting briefly for runs in flight.
     */
    public void stop() {
        if (!running) {
            return;
        }
        LOG.fine("Stopping run scheduler");
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
