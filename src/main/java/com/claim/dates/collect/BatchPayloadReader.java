package com.claim.dates.collect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the document reader's JSON output into {@link BatchPayload}s.
 *
 * <p>Accepts either a single batch object or an array of batch objects:</p>
 * <pre>
 * {"allExtractedDates": [{"date": "2024-03-05", "context": "수술 시행", "type": "surgery"}],
 *  "dateRanges": [{"startDate": "2020-01-01", "endDate": "2030-01-01", "type": "보험기간"}]}
 * </pre>
 *
 * <p>Unknown properties are ignored; a batch wrapped as {@code {"generatedJson": {...}}}
 * is unwrapped.</p>
 */
public class BatchPayloadReader {
    private static final Logger log = LoggerFactory.getLogger(BatchPayloadReader.class);

    private static final String WRAPPER_FIELD = "generatedJson";

    private final ObjectMapper objectMapper;

    public BatchPayloadReader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public BatchPayloadReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a JSON document holding one batch or an array of batches.
     */
    public List<BatchPayload> read(String json) {
        if (json == null || json.isBlank()) {
            throw new PayloadParseException("Reader payload is empty");
        }
        try {
            return fromTree(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("Reader payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a JSON document from a character stream.
     */
    public List<BatchPayload> read(Reader reader) {
        try {
            return fromTree(objectMapper.readTree(reader));
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("Reader payload is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PayloadParseException("Failed to read reader payload: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a single batch object.
     */
    public BatchPayload readBatch(String json) {
        List<BatchPayload> batches = read(json);
        if (batches.size() != 1) {
            throw new PayloadParseException("Expected a single batch, got " + batches.size());
        }
        return batches.get(0);
    }

    private List<BatchPayload> fromTree(JsonNode root) throws JsonProcessingException {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new PayloadParseException("Reader payload is empty");
        }
        List<BatchPayload> batches = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode node : root) {
                batches.add(toBatch(node));
            }
        } else if (root.isObject()) {
            batches.add(toBatch(root));
        } else {
            throw new PayloadParseException("Reader payload must be an object or array, got " + root.getNodeType());
        }
        log.debug("payload.parsed batches={}", batches.size());
        return batches;
    }

    private BatchPayload toBatch(JsonNode node) throws JsonProcessingException {
        if (!node.isObject()) {
            throw new PayloadParseException("Batch must be a JSON object, got " + node.getNodeType());
        }
        JsonNode body = node.has(WRAPPER_FIELD) ? node.get(WRAPPER_FIELD) : node;
        return objectMapper.treeToValue(body, BatchPayload.class);
    }
}
