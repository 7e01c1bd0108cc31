package com.claim.dates.enrollment;

import com.claim.dates.core.model.ProximityBucket;

/**
 * Day limits of the proximity buckets, nearest first.
 */
public record ProximityThresholds(int threeMonthDays, int oneYearDays, int fiveYearDays) {

    public ProximityThresholds {
        if (threeMonthDays <= 0 || threeMonthDays > oneYearDays || oneYearDays > fiveYearDays) {
            throw new IllegalArgumentException("Proximity thresholds must be positive and ascending: "
                    + threeMonthDays + ", " + oneYearDays + ", " + fiveYearDays);
        }
    }

    public static ProximityThresholds defaults() {
        return new ProximityThresholds(90, 365, 1825);
    }

    /**
     * Most specific bucket for an event the given number of days before enrollment.
     */
    public ProximityBucket bucketFor(long daysBefore) {
        if (daysBefore <= threeMonthDays) {
            return ProximityBucket.WITHIN_3_MONTHS_BEFORE;
        }
        if (daysBefore <= oneYearDays) {
            return ProximityBucket.WITHIN_1_YEAR_BEFORE;
        }
        if (daysBefore <= fiveYearDays) {
            return ProximityBucket.WITHIN_5_YEARS_BEFORE;
        }
        return ProximityBucket.OUTSIDE;
    }
}
