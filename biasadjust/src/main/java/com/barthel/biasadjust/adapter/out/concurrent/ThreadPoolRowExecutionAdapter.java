package com.barthel.biasadjust.adapter.out.concurrent;

import com.barthel.biasadjust.application.port.out.RowExecutionPort;
import com.barthel.biasadjust.domain.exception.GridAdjustmentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs row jobs on a fixed-size pool created per call. A single worker runs the rows
 * in order on the calling thread. The call returns or throws only after the pool has
 * terminated.
 */
@Slf4j
@Component
public class ThreadPoolRowExecutionAdapter implements RowExecutionPort {

    private static final long TERMINATION_POLL_SECONDS = 10;

    @Override
    public <T> List<T> executeAll(List<? extends Callable<T>> jobs, int workers) {
        if (workers <= 1 || jobs.size() <= 1) {
            return runSequentially(jobs);
        }
        int poolSize = Math.min(workers, jobs.size());
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("grid-row-"));
        try {
            return runOn(pool, jobs);
        } finally {
            pool.shutdownNow();
            awaitTermination(pool);
        }
    }

    // rows interrupted mid-cell still finish that cell, so wait until every worker is gone
    private void awaitTermination(ExecutorService pool) {
        try {
            while (!pool.awaitTermination(TERMINATION_POLL_SECONDS, TimeUnit.SECONDS)) {
                log.debug("Still waiting for cancelled grid rows to stop");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private <T> List<T> runSequentially(List<? extends Callable<T>> jobs) {
        List<T> results = new ArrayList<>(jobs.size());
        for (int row = 0; row < jobs.size(); row++) {
            try {
                results.add(jobs.get(row).call());
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new GridAdjustmentException("Row " + row + " failed", e);
            }
        }
        return results;
    }

    private <T> List<T> runOn(ExecutorService pool, List<? extends Callable<T>> jobs) {
        CompletionService<T> completion = new ExecutorCompletionService<>(pool);
        Map<Future<T>, Integer> rows = new HashMap<>();
        for (int row = 0; row < jobs.size(); row++) {
            rows.put(completion.submit(jobs.get(row)), row);
        }

        List<T> results = new ArrayList<>(Collections.nCopies(jobs.size(), null));
        try {
            for (int done = 0; done < jobs.size(); done++) {
                Future<T> finished = completion.take();
                results.set(rows.get(finished), finished.get());
            }
        } catch (ExecutionException e) {
            rows.keySet().forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            log.warn("Grid row failed, cancelled the remaining rows: {}", cause.toString());
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new GridAdjustmentException("Grid row failed", cause);
        } catch (InterruptedException e) {
            rows.keySet().forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new GridAdjustmentException("Interrupted while waiting for grid rows", e);
        }
        return results;
    }
}
