package com.vigil.batch;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vigil.check.CheckOutcome;
import com.vigil.check.CheckRequest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON reading of check requests and writing of batch results.
 * <p>
 * Requests: {@code {"identity": "...", "check_type": "...", "config": {...}}}; {@code id} and
 * {@code plugin_type} are accepted as aliases. A document may be a bare array of requests or an
 * object with a {@code checks} array.
 * <p>
 * Results: {@code batch_id}, {@code results[]} (identity, check_type, outcome_kind, message,
 * elapsed_seconds, raw_data, timestamp), {@code summary} and {@code total_elapsed_seconds}.
 */
public final class BatchJson {

    private static final ObjectMapper MAPPER = createMapper();

    private static final TypeReference<List<RequestDocument>> REQUEST_LIST = new TypeReference<>() {
    };

    private BatchJson() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Wire shape of one request.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RequestDocument(
            @JsonProperty("identity") @JsonAlias("id") String identity,
            @JsonProperty("check_type") @JsonAlias("plugin_type") String checkType,
            @JsonProperty("config") Map<String, Object> config
    ) {

        public CheckRequest toRequest() {
            return new CheckRequest(identity, checkType, config);
        }
    }

    /**
     * Parses a request document: an array of requests or an object with a {@code checks} array.
     *
     * @throws BatchJsonException if the JSON is malformed or has the wrong shape
     */
    public static List<CheckRequest> readRequests(String json) {
        if (json == null || json.isBlank()) {
            throw new BatchJsonException("Request document must not be empty", null);
        }
        try {
            JsonNode root = MAPPER.readTree(json);
            JsonNode checks = root != null && root.isObject() ? root.get("checks") : root;
            if (checks == null || !checks.isArray()) {
                throw new BatchJsonException("Expected an array of checks or an object with a 'checks' array", null);
            }
            List<RequestDocument> documents = MAPPER.convertValue(checks, REQUEST_LIST);
            return toRequests(documents);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new BatchJsonException("Failed to read check requests: " + e.getMessage(), e);
        }
    }

    /**
     * Converts bound request documents into requests; null entries stay null and are rejected by
     * the coordinator.
     */
    public static List<CheckRequest> toRequests(List<RequestDocument> documents) {
        List<CheckRequest> requests = new ArrayList<>();
        if (documents != null) {
            for (RequestDocument document : documents) {
                requests.add(document == null ? null : document.toRequest());
            }
        }
        return requests;
    }

    /**
     * Builds the result document as an ordered map, ready for any JSON writer.
     */
    public static Map<String, Object> toDocument(BatchResult result) {
        List<Map<String, Object>> entries = new ArrayList<>(result.size());
        for (CheckResultEntry entry : result.results()) {
            CheckOutcome outcome = entry.outcome();
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("identity", entry.identity());
            item.put("check_type", entry.checkType());
            item.put("outcome_kind", outcome.kind().wireName());
            item.put("message", outcome.message());
            item.put("elapsed_seconds", outcome.elapsedSeconds());
            item.put("raw_data", outcome.rawData());
            item.put("timestamp", outcome.timestamp().toString());
            entries.add(item);
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("batch_id", result.batchId());
        document.put("results", entries);
        document.put("summary", result.summary().asMap());
        document.put("total_elapsed_seconds", result.totalElapsedSeconds());
        return document;
    }

    /**
     * Serializes a batch result.
     *
     * @throws BatchJsonException if serialization fails
     */
    public static String writeResult(BatchResult result) {
        try {
            return MAPPER.writeValueAsString(toDocument(result));
        } catch (JsonProcessingException e) {
            throw new BatchJsonException("Failed to serialize batch result: " + result.batchId(), e);
        }
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Exception thrown when a request document cannot be read or a result cannot be written.
     */
    public static class BatchJsonException extends RuntimeException {
        public BatchJsonException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
