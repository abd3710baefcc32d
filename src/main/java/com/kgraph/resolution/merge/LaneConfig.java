package com.kgraph.resolution.merge;

/**
 * Configuration of the single-writer merge lanes.
 *
 * @param laneCount number of lanes; each is served by one thread
 */
public record LaneConfig(int laneCount) {

    public LaneConfig {
        if (laneCount < 1) {
            throw new IllegalArgumentException("laneCount must be >= 1");
        }
    }

    /**
     * One lane per available processor, at least two.
     */
    public static LaneConfig defaults() {
        return new LaneConfig(Math.max(2, Runtime.getRuntime().availableProcessors()));
    }
}
