package com.talent.sourcing.review;

public enum ManualResolutionStatus {
    PENDING,
    RESOLVED,
    DISMISSED
}
