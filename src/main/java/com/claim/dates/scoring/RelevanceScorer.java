package com.claim.dates.scoring;

import com.claim.dates.core.model.DateCandidate;
import com.claim.dates.core.model.ScoreBreakdown;
import com.claim.dates.core.model.ScoreBreakdown.RuleContribution;
import com.claim.dates.core.model.ScoredCandidate;
import com.claim.dates.dedup.DeduplicatedCandidates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores candidates by summing an ordered list of rules.
 * A veto stops evaluation of the remaining rules and rejects the candidate.
 * Default rule order: range validity, type priority, recency, insurance-period role,
 * document metadata, context keywords, frequency.
 */
public class RelevanceScorer {
    private static final Logger log = LoggerFactory.getLogger(RelevanceScorer.class);

    private final List<ScoringRule> rules;

    public RelevanceScorer() {
        this(defaultRules());
    }

    public RelevanceScorer(List<ScoringRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("At least one scoring rule is required");
        }
        this.rules = List.copyOf(rules);
    }

    public static List<ScoringRule> defaultRules() {
        return List.of(
                new RangeValidityRule(),
                new TypePriorityRule(),
                new RecencyRule(),
                new InsurancePeriodRoleRule(),
                new DocumentMetadataRule(),
                new ContextKeywordRule(),
                new FrequencyBonusRule());
    }

    public List<ScoringRule> getRules() {
        return rules;
    }

    /**
     * Creates a new scorer with a different rule list.
     */
    public RelevanceScorer withRules(List<ScoringRule> newRules) {
        return new RelevanceScorer(newRules);
    }

    public ScoredCandidate score(DateCandidate candidate, int frequency, ScoringContext context) {
        List<RuleContribution> contributions = new ArrayList<>(rules.size());
        String vetoReason = null;
        for (ScoringRule rule : rules) {
            RuleOutcome outcome = rule.apply(candidate, frequency, context);
            if (outcome.isVeto()) {
                vetoReason = rule.name() + ": " + outcome.vetoReason();
                break;
            }
            contributions.add(new RuleContribution(rule.name(), outcome.delta()));
        }

        ScoreBreakdown breakdown = new ScoreBreakdown(contributions, vetoReason);
        int total = breakdown.total();
        boolean accepted = vetoReason == null && total >= context.weights().getAcceptanceThreshold();
        log.trace("score.evaluated date={} score={} accepted={} breakdown={}",
                candidate.getIsoDate(), total, accepted, breakdown);
        return new ScoredCandidate(candidate, frequency, total, accepted, breakdown);
    }

    /**
     * Scores every retained candidate with its frequency and ranks the accepted ones.
     */
    public ScoringResult scoreAll(DeduplicatedCandidates candidates, ScoringContext context) {
        return scoreAll(candidates.retained(), candidates, context);
    }

    /**
     * Scores already-classified candidates, reading frequencies from the deduplication result.
     */
    public ScoringResult scoreAll(List<DateCandidate> classified, DeduplicatedCandidates frequencies,
                                  ScoringContext context) {
        List<ScoredCandidate> scored = new ArrayList<>(classified.size());
        for (DateCandidate candidate : classified) {
            int frequency = Math.max(1, frequencies.frequencyOf(candidate.getNormalizedDate()));
            scored.add(score(candidate, frequency, context));
        }
        List<ScoredCandidate> ranked = rank(scored);
        log.debug("score.completed scored={} accepted={}", scored.size(), ranked.size());
        return new ScoringResult(scored, ranked);
    }

    /**
     * Accepted candidates, score descending then date ascending.
     */
    public static List<ScoredCandidate> rank(List<ScoredCandidate> scored) {
        return scored.stream()
                .filter(ScoredCandidate::accepted)
                .sorted(ScoredCandidate.RANKING)
                .toList();
    }
}
