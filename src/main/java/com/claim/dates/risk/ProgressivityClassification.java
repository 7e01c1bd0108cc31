package com.claim.dates.risk;

/**
 * Course of the claimed condition as judged from the visit history.
 */
public enum ProgressivityClassification {
    PROGRESSIVE_CHRONIC,
    TEMPORARY,
    INCONCLUSIVE,
    NOT_ANALYZED
}
