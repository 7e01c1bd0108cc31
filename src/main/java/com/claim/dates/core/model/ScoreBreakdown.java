package com.claim.dates.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Per-rule contributions to a candidate's relevance score, in evaluation order.
 *
 * @param contributions one entry per scoring rule that ran
 * @param vetoReason    reason the candidate was rejected outright, or null
 */
public record ScoreBreakdown(List<RuleContribution> contributions, String vetoReason) {

    public ScoreBreakdown {
        contributions = contributions != null ? List.copyOf(contributions) : List.of();
    }

    /**
     * A single rule's signed delta.
     */
    public record RuleContribution(String ruleName, int delta) {}

    public int total() {
        return contributions.stream().mapToInt(RuleContribution::delta).sum();
    }

    public boolean isVetoed() {
        return vetoReason != null;
    }

    public Optional<Integer> deltaOf(String ruleName) {
        return contributions.stream()
                .filter(c -> c.ruleName().equals(ruleName))
                .map(RuleContribution::delta)
                .findFirst();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ScoreBreakdown{");
        for (int i = 0; i < contributions.size(); i++) {
            RuleContribution c = contributions.get(i);
            if (i > 0) sb.append(", ");
            sb.append(c.ruleName()).append('=').append(c.delta());
        }
        if (vetoReason != null) {
            sb.append(", veto='").append(vetoReason).append('\'');
        }
        return sb.append('}').toString();
    }
}
