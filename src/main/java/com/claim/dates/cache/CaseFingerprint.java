package com.claim.dates.cache;

import com.claim.dates.api.CaseAnalysisRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.HexFormat;

/**
 * SHA-256 fingerprint of everything that determines a case's analysis result.
 */
public final class CaseFingerprint {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private CaseFingerprint() {
    }

    /**
     * @param processingDate included because year bounds and recency depend on it
     * @return lower-case hex digest
     */
    public static String of(CaseAnalysisRequest request, LocalDate processingDate) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("caseId", request.getCaseId());
        node.put("processingDate", processingDate.toString());
        node.set("batches", MAPPER.valueToTree(request.getBatches()));
        node.put("referenceText", request.getReferenceText().orElse(null));
        node.put("claimDate", request.getClaimDate().map(LocalDate::toString).orElse(null));
        node.put("suppliedEnrollmentDate",
                request.getSuppliedEnrollmentDate().map(LocalDate::toString).orElse(null));

        ObjectNode risk = node.putObject("riskSignals");
        request.getRiskSignals().getDisclosureViolations().ifPresent(v -> risk.put("disclosureViolations", v));
        risk.put("doctorShoppingSuspicious", request.getRiskSignals().getDoctorShopping().suspicious());
        risk.put("doctorShoppingMaxProviders", request.getRiskSignals().getDoctorShopping().maxProviders());
        risk.put("progressivity", request.getRiskSignals().getProgressivity().name());
        node.set("providerVisits", MAPPER.valueToTree(request.getProviderVisits()));

        try {
            byte[] json = MAPPER.writeValueAsBytes(node);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize case " + request.getCaseId(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
