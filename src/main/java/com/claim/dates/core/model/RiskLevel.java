package com.claim.dates.core.model;

/**
 * Categorical investigation risk.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
