package com.claim.dates.core.model;

/**
 * Distance band of a medical event before the insurance enrollment date.
 * Declared from most to least specific.
 */
public enum ProximityBucket {
    /** 0-90 days before enrollment: core disclosure-duty review window. */
    WITHIN_3_MONTHS_BEFORE,
    WITHIN_1_YEAR_BEFORE,
    /** Past-history review window. */
    WITHIN_5_YEARS_BEFORE,
    OUTSIDE
}
