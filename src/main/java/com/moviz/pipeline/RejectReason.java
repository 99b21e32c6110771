package com.moviz.pipeline;

/**
 * Why a record was dropped before entity resolution. Record-level only; never aborts a run.
 */
public enum RejectReason {
    MALFORMED_FIELD,
    CRITICAL_NULL,
    YEAR_OUT_OF_RANGE,
    EXCLUDED_CONTENT,
    NO_PRODUCTION_DATA,
    FUTURE_RELEASE,
    NON_CRITICAL_THRESHOLD_EXCEEDED
}
