package com.moviz.pipeline;

/**
 * Classification of a unified column for admission control.
 */
public enum ColumnRole {
    /** Dataset-native identifier. Nullable and never counted towards missingness. */
    KEY,
    /** Absence makes the record unusable for identification. */
    CRITICAL,
    /** Absence tolerated up to the missingness threshold. */
    NON_CRITICAL
}
