package com.claim.dates.risk;

/**
 * @param suspicious   true when too many distinct providers were seen in one window
 * @param maxProviders largest number of distinct providers seen in any window
 */
public record DoctorShoppingFinding(boolean suspicious, int maxProviders) {

    private static final DoctorShoppingFinding NONE = new DoctorShoppingFinding(false, 0);

    public DoctorShoppingFinding {
        if (maxProviders < 0) {
            throw new IllegalArgumentException("maxProviders must be >= 0");
        }
    }

    public static DoctorShoppingFinding none() {
        return NONE;
    }
}
