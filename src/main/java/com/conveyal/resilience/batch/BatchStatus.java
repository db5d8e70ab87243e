package com.conveyal.resilience.batch;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Progress of a running batch. Counters are updated by the worker threads and may be read at any time.
 */
public final class BatchStatus {

    public final int total;

    private final AtomicInteger complete = new AtomicInteger();

    private final AtomicInteger failed = new AtomicInteger();

    public BatchStatus (int total) {
        this.total = total;
    }

    void recordSuccess () {
        complete.incrementAndGet();
    }

    void recordFailure () {
        complete.incrementAndGet();
        failed.incrementAndGet();
    }

    /** Areas finished so far, whether they succeeded or failed. */
    public int complete () {
        return complete.get();
    }

    public int failed () {
        return failed.get();
    }

    public boolean isDone () {
        return complete.get() == total;
    }

    @Override
    public String toString () {
        return "BatchStatus{" + complete.get() + "/" + total + " complete, " + failed.get() + " failed}";
    }
}
