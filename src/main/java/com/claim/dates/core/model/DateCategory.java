package com.claim.dates.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed vocabulary of roles a date can play in a claim document.
 * Reader labels arrive either as English identifiers or as the Korean
 * labels printed on medical and insurance records.
 */
public enum DateCategory {

    INSURANCE_ENROLLMENT("insurance-enrollment", List.of("보험가입", "가입일", "계약일", "보험시작", "보장개시")),
    INSURANCE_EXPIRY("insurance-expiry", List.of("만기", "보험종료", "보장종료", "만료")),
    ADMISSION("admission", List.of("입원")),
    DISCHARGE("discharge", List.of("퇴원")),
    SURGERY("surgery", List.of("수술", "시술")),
    EXAM("exam", List.of("검사", "촬영", "판독")),
    DIAGNOSIS("diagnosis", List.of("진단", "확진")),
    OUTPATIENT_VISIT("outpatient-visit", List.of("통원", "외래", "진료")),
    DOCUMENT_METADATA("document-metadata", List.of("발급", "출력", "발행", "작성일", "서류")),
    OTHER("other", List.of("기타"));

    private final String id;
    private final List<String> aliases;

    DateCategory(String id, List<String> aliases) {
        this.id = id;
        this.aliases = aliases;
    }

    public String getId() {
        return id;
    }

    /**
     * Returns true for categories that describe a medical event
     * (as opposed to insurance administration or document metadata).
     */
    public boolean isMedicalEvent() {
        return switch (this) {
            case ADMISSION, DISCHARGE, SURGERY, EXAM, DIAGNOSIS, OUTPATIENT_VISIT -> true;
            default -> false;
        };
    }

    public boolean isInsurance() {
        return this == INSURANCE_ENROLLMENT || this == INSURANCE_EXPIRY;
    }

    /**
     * Parses a reader label. Identifiers match with either '-' or '_' separators
     * and any case; otherwise the first category whose alias occurs in the label wins.
     * Expiry aliases are checked before enrollment ones so that "보험만기일" is not
     * mistaken for an enrollment date.
     *
     * @return the category, or empty when the label is blank or unknown (untagged)
     */
    public static Optional<DateCategory> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (DateCategory category : values()) {
            if (category.id.equals(normalized) || category.name().equalsIgnoreCase(label.trim())) {
                return Optional.of(category);
            }
        }
        if (matchesAlias(INSURANCE_EXPIRY, normalized)) {
            return Optional.of(INSURANCE_EXPIRY);
        }
        for (DateCategory category : values()) {
            if (matchesAlias(category, normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    private static boolean matchesAlias(DateCategory category, String label) {
        for (String alias : category.aliases) {
            if (label.contains(alias)) {
                return true;
            }
        }
        return false;
    }
}
