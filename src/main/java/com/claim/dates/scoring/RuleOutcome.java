package com.claim.dates.scoring;

/**
 * Result of a single scoring rule: a signed delta, or a veto that rejects the candidate.
 */
public record RuleOutcome(int delta, String vetoReason) {

    public static final RuleOutcome NEUTRAL = new RuleOutcome(0, null);

    public static RuleOutcome of(int delta) {
        return delta == 0 ? NEUTRAL : new RuleOutcome(delta, null);
    }

    public static RuleOutcome veto(String reason) {
        return new RuleOutcome(0, reason);
    }

    public boolean isVeto() {
        return vetoReason != null;
    }
}
