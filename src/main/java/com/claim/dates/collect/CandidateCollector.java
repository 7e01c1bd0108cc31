package com.claim.dates.collect;

import com.claim.dates.core.model.CandidateSource;
import com.claim.dates.core.model.DateCandidate;
import com.claim.dates.core.model.DateCategory;
import com.claim.dates.core.model.Importance;
import com.claim.dates.core.model.RangeBoundary;
import com.claim.dates.rules.DateNormalizationEngine;
import com.claim.dates.rules.DefaultDateNormalizationRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Flattens per-batch reader payloads into date candidates.
 * Every sub-collection is normalized with the same rules; malformed values are
 * dropped and counted, never reported as errors. Batches are independent.
 */
public class CandidateCollector {
    private static final Logger log = LoggerFactory.getLogger(CandidateCollector.class);

    static final String RANGE_START_MARKER = "[range start]";
    static final String RANGE_END_MARKER = "[range end]";

    private static final List<String> INSURANCE_PERIOD_LABELS = List.of(
            "보험기간", "보장기간", "계약기간", "insurance period", "insurance-period",
            "coverage period", "policy period");

    private final DateNormalizationEngine normalizationEngine;

    public CandidateCollector() {
        this(DefaultDateNormalizationRules.createDefaultEngine());
    }

    public CandidateCollector(DateNormalizationEngine normalizationEngine) {
        this.normalizationEngine = normalizationEngine;
    }

    /**
     * Collects candidates from all batches of one case.
     */
    public CollectionResult collect(List<BatchPayload> batches) {
        List<DateCandidate> candidates = new ArrayList<>();
        int rawCount = 0;
        for (int batchIndex = 0; batchIndex < batches.size(); batchIndex++) {
            BatchPayload payload = batches.get(batchIndex);
            if (payload == null) {
                log.debug("batch.skipped index={} reason=empty-payload", batchIndex);
                continue;
            }
            List<DateCandidate> batchCandidates = collectBatch(payload, batchIndex);
            rawCount += payload.rawValueCount();
            candidates.addAll(batchCandidates);
            log.debug("batch.collected index={} raw={} kept={}",
                    batchIndex, payload.rawValueCount(), batchCandidates.size());
        }
        int dropped = rawCount - candidates.size();
        if (dropped > 0) {
            log.debug("collect.dropped count={} reason=malformed-date", dropped);
        }
        return new CollectionResult(candidates, rawCount, dropped);
    }

    /**
     * Collects candidates from a single batch payload.
     */
    public List<DateCandidate> collectBatch(BatchPayload payload, int batchIndex) {
        List<DateCandidate> out = new ArrayList<>();

        for (DateEntry entry : payload.allExtractedDates()) {
            addDateEntry(out, entry, batchIndex, CandidateSource.GENERIC);
        }
        for (RangeEntry range : payload.dateRanges()) {
            addRange(out, range, batchIndex);
        }
        for (InsuranceEntry entry : payload.insuranceDates()) {
            normalizationEngine.normalize(entry.date()).ifPresent(date -> out.add(DateCandidate.builder()
                    .rawText(entry.date())
                    .normalizedDate(date)
                    .sourceBatch(batchIndex)
                    .source(CandidateSource.INSURANCE)
                    .category(DateCategory.fromLabel(entry.type()).orElse(null))
                    .importance(Importance.fromLabel(entry.importance()).orElse(null))
                    .contextSnippet(join(entry.company(), entry.productName(), entry.type()))
                    .confidenceTag(entry.confidence())
                    .build()));
        }
        for (TableRowEntry entry : payload.tableDates()) {
            normalizationEngine.normalize(entry.date()).ifPresent(date -> out.add(DateCandidate.builder()
                    .rawText(entry.date())
                    .normalizedDate(date)
                    .sourceBatch(batchIndex)
                    .source(CandidateSource.TABLE_ROW)
                    .category(DateCategory.fromLabel(entry.tableType()).orElse(null))
                    .importance(Importance.fromLabel(entry.importance()).orElse(null))
                    .contextSnippet(nullToEmpty(entry.rowContent()))
                    .confidenceTag(entry.confidence())
                    .build()));
        }
        for (DateEntry entry : payload.dates()) {
            addDateEntry(out, entry, batchIndex, CandidateSource.LEGACY);
        }
        return out;
    }

    /**
     * Returns true when a range type label names an insurance period.
     */
    public static boolean isInsurancePeriodLabel(String type) {
        if (type == null || type.isBlank()) {
            return false;
        }
        String lower = type.toLowerCase(Locale.ROOT);
        for (String label : INSURANCE_PERIOD_LABELS) {
            if (lower.contains(label)) {
                return true;
            }
        }
        return DateCategory.fromLabel(type).map(DateCategory::isInsurance).orElse(false);
    }

    private void addDateEntry(List<DateCandidate> out, DateEntry entry, int batchIndex, CandidateSource source) {
        normalizationEngine.normalize(entry.date()).ifPresent(date -> out.add(DateCandidate.builder()
                .rawText(entry.date())
                .normalizedDate(date)
                .sourceBatch(batchIndex)
                .source(source)
                .category(DateCategory.fromLabel(entry.type()).orElse(null))
                .importance(Importance.fromLabel(entry.importance()).orElse(null))
                .contextSnippet(nullToEmpty(entry.context()))
                .confidenceTag(entry.confidence())
                .build()));
    }

    private void addRange(List<DateCandidate> out, RangeEntry range, int batchIndex) {
        Optional<LocalDate> start = normalizationEngine.normalize(range.startDate());
        Optional<LocalDate> end = normalizationEngine.normalize(range.endDate());
        boolean insurancePeriod = isInsurancePeriodLabel(range.type());
        // An insurance period carries no single category; classification decides per boundary.
        DateCategory category = insurancePeriod ? null : DateCategory.fromLabel(range.type()).orElse(null);
        Importance importance = Importance.fromLabel(range.importance()).orElse(null);
        String context = nullToEmpty(range.context());

        start.ifPresent(date -> out.add(DateCandidate.builder()
                .rawText(range.startDate())
                .normalizedDate(date)
                .sourceBatch(batchIndex)
                .source(CandidateSource.RANGE_START)
                .category(category)
                .importance(importance)
                .contextSnippet(join(context, RANGE_START_MARKER))
                .confidenceTag(range.confidence())
                .rangeBoundary(new RangeBoundary(RangeBoundary.Role.START, insurancePeriod, end.orElse(null)))
                .build()));
        end.ifPresent(date -> out.add(DateCandidate.builder()
                .rawText(range.endDate())
                .normalizedDate(date)
                .sourceBatch(batchIndex)
                .source(CandidateSource.RANGE_END)
                .category(category)
                .importance(importance)
                .contextSnippet(join(context, RANGE_END_MARKER))
                .confidenceTag(range.confidence())
                .rangeBoundary(new RangeBoundary(RangeBoundary.Role.END, insurancePeriod, start.orElse(null)))
                .build()));
    }

    private static String join(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part != null && !part.isBlank()) {
                if (sb.length() > 0) sb.append(' ');
                sb.append(part.trim());
            }
        }
        return sb.toString();
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
