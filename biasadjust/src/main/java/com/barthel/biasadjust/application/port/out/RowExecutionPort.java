package com.barthel.biasadjust.application.port.out;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Port for running independent grid-row jobs.
 */
public interface RowExecutionPort {
    /**
     * Run every job and return the results in job order. With one worker the jobs run
     * sequentially on the calling thread. The first failure is rethrown once the remaining
     * jobs have been cancelled; no partial result is returned.
     *
     * @param jobs the row jobs, indexed by row
     * @param workers the maximum number of jobs running at once
     * @param <T> the row result type
     * @return one result per job, in job order
     */
    <T> List<T> executeAll(List<? extends Callable<T>> jobs, int workers);
}
