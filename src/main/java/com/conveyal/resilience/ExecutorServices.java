package com.conveyal.resilience;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Creates the thread pools used to spread per-area work over the available cores. Pools are created per run and
 * shut down by whoever created them, so nothing JVM-wide outlives a batch.
 */
public abstract class ExecutorServices {

    public static ExecutorService newFixedPool (int nThreads, String name) {
        return Executors.newFixedThreadPool(nThreads, new ThreadFactoryBuilder()
                .setNameFormat(name + "-%d")
                .setDaemon(true)
                .build());
    }

    public static int defaultThreads () {
        return Runtime.getRuntime().availableProcessors();
    }
}
