package com.claim.dates.core.model;

/**
 * Sub-collection of a reader payload that produced a candidate.
 */
public enum CandidateSource {
    GENERIC,
    RANGE_START,
    RANGE_END,
    INSURANCE,
    TABLE_ROW,
    LEGACY
}
