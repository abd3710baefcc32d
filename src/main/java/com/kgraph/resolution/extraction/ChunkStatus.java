package com.kgraph.resolution.extraction;

public enum ChunkStatus {
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    public boolean isFailure() {
        return this != SUCCEEDED;
    }
}
