package com.fringe.performance;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Fans independent per-tile computations out over a work-stealing ForkJoinPool.
 * Results are always returned in tile order so callers assemble identical output either way.
 */
public final class ParallelTileOperations {
    
    private static final int PARALLEL_THRESHOLD = 4;
    private static final ForkJoinPool WORK_STEALING_POOL;
    
    static {
        int parallelism = Math.max(2, Runtime.getRuntime().availableProcessors());
        WORK_STEALING_POOL = new ForkJoinPool(
            parallelism,
            ForkJoinPool.defaultForkJoinWorkerThreadFactory,
            null,
            true
        );
    }
    
    private ParallelTileOperations() {}
    
    /**
     * Applies {@code task} to every tile index in {@code [0, tileCount)}.
     *
     * @param tileCount number of tiles
     * @param task      computation for one tile, must not touch shared mutable state
     * @param parallel  whether to use the pool; small workloads always run on the caller thread
     * @return results indexed by tile
     */
    public static <T> List<T> mapTiles(int tileCount, IntFunction<T> task, boolean parallel) {
        if (tileCount < 0) {
            throw new IllegalArgumentException("tile count must be non-negative");
        }
        
        if (!parallel || tileCount < PARALLEL_THRESHOLD) {
            return mapTilesSequential(tileCount, task);
        }
        
        return WORK_STEALING_POOL.submit(() ->
            IntStream.range(0, tileCount)
                .parallel()
                .mapToObj(task)
                .collect(Collectors.toList())
        ).join();
    }
    
    private static <T> List<T> mapTilesSequential(int tileCount, IntFunction<T> task) {
        var results = new ArrayList<T>(tileCount);
        for (int i = 0; i < tileCount; i++) {
            results.add(task.apply(i));
        }
        return results;
    }
    
    public static int getParallelism() {
        return WORK_STEALING_POOL.getParallelism();
    }
}
