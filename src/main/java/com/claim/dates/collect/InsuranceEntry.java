package com.claim.dates.collect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An insurance-tagged date (enrollment, expiry, claim) with its policy details.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InsuranceEntry(
        String date,
        String company,
        String productName,
        String type,
        String importance,
        String confidence
) {
    public static InsuranceEntry of(String date, String company, String productName, String type) {
        return new InsuranceEntry(date, company, productName, type, null, null);
    }
}
