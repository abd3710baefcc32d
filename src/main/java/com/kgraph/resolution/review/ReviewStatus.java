package com.kgraph.resolution.review;

public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
