package com.civilworks.carbon.model;

/** Outcome of screening one contract. Only {@link #CALCULATED} rows carry an estimate. */
public enum PqeStatus {
    CALCULATED,
    SKIPPED_LOW_VALUE,
    SKIPPED_NO_REF,
    SKIPPED_INVALID_REF
}
