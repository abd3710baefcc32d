package com.kgraph.resolution.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * A fixed set of single-threaded executors. Work submitted under the same key always runs on
 * the same lane, one task at a time, in submission order; different keys may run in parallel.
 */
public class MergeLanes implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MergeLanes.class);

    private final ExecutorService[] lanes;

    public MergeLanes(LaneConfig config) {
        Objects.requireNonNull(config, "config is required");
        this.lanes = new ExecutorService[config.laneCount()];
        for (int i = 0; i < lanes.length; i++) {
            String name = "kgraph-merge-lane-" + i;
            lanes[i] = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, name);
                thread.setDaemon(true);
                return thread;
            });
        }
        log.info("MergeLanes initialized: lanes={}", lanes.length);
    }

    public <T> CompletableFuture<T> submit(String key, Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, lanes[laneOf(key)]);
    }

    int laneOf(String key) {
        return Math.floorMod(Objects.hashCode(key), lanes.length);
    }

    public int laneCount() {
        return lanes.length;
    }

    @Override
    public void close() {
        for (ExecutorService lane : lanes) {
            lane.shutdown();
        }
        try {
            for (ExecutorService lane : lanes) {
                if (!lane.awaitTermination(5, TimeUnit.SECONDS)) {
                    lane.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            for (ExecutorService lane : lanes) {
                lane.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }
    }
}
