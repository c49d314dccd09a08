package org.janelia.medslice.service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.janelia.medslice.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class WorkerPools {
    private static final Logger LOG = LoggerFactory.getLogger(WorkerPools.class);

    public static ExecutorService fromConfig(Config config) {
        return createWorkerPool(config.getIntegerPropertyValue("Workers.Count", 0));
    }

    public static ExecutorService slicePoolFromConfig(Config config) {
        return createSlicePool(config.getIntegerPropertyValue("Workers.Count", 0));
    }

    /**
     * Pool for the per slice computations. These are joined by the tasks that submit them,
     * so they must not share a fixed size pool with their callers.
     */
    public static ExecutorService createSlicePool(int workers) {
        int nworkers = getWorkersCount(workers);
        LOG.info("Create a workstealing pool with {} worker threads", nworkers);
        return Executors.newWorkStealingPool(nworkers);
    }

    /**
     * @param workers number of worker threads; 0 or less means one less than the available processors
     */
    public static ExecutorService createWorkerPool(int workers) {
        int nworkers = getWorkersCount(workers);
        LOG.info("Create a thread pool with {} worker threads ({} available processors)",
                nworkers, Runtime.getRuntime().availableProcessors());
        return Executors.newFixedThreadPool(
                nworkers,
                new ThreadFactoryBuilder()
                        .setNameFormat("MEDSLICE-%d")
                        .setDaemon(true)
                        .build());
    }

    static int getWorkersCount(int workers) {
        if (workers > 0) {
            return workers;
        } else {
            return Math.max(Runtime.getRuntime().availableProcessors() - 1, 1);
        }
    }
}
