package com.facilityhub.realtime.client.impl.production;

import com.facilityhub.realtime.model.domain.ChangeEvent;
import com.facilityhub.realtime.model.domain.Operation;
import com.facilityhub.realtime.model.dto.CdcEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;

/**
 * Turns CDC topic records into {@link ChangeEvent}s. Accepts bare envelopes and
 * envelopes wrapped in a {@code schema}/{@code payload} pair (JSON converter
 * with schemas enabled). Anything unusable is logged and skipped.
 */
@Slf4j
public class CdcEventParser {

    private final ObjectMapper objectMapper;
    private final String topicPrefix;
    private final Clock clock;

    public CdcEventParser(ObjectMapper objectMapper, String topicPrefix, Clock clock) {
        this.objectMapper = objectMapper;
        this.topicPrefix = topicPrefix;
        this.clock = clock;
    }

    public Optional<ChangeEvent> parse(String topic, String value) {
        if (value == null || value.isBlank()) {
            // tombstones follow deletes and carry nothing new
            return Optional.empty();
        }
        CdcEnvelope envelope;
        try {
            JsonNode root = objectMapper.readTree(value);
            JsonNode payload = root.path("payload");
            JsonNode body = payload.isObject() && payload.has("op") ? payload : root;
            envelope = objectMapper.treeToValue(body, CdcEnvelope.class);
        } catch (JsonProcessingException e) {
            log.warn("Malformed CDC record on topic {}: {}", topic, e.getOriginalMessage());
            return Optional.empty();
        }

        Operation operation = Operation.fromCdcCode(envelope.getOp());
        if (operation == null) {
            log.warn("Unsupported CDC op '{}' on topic {}, skipping", envelope.getOp(), topic);
            return Optional.empty();
        }
        String table = resolveTable(topic, envelope);
        if (table == null) {
            log.warn("Cannot determine table of CDC record on topic {}, skipping", topic);
            return Optional.empty();
        }
        return Optional.of(new ChangeEvent(table, operation, envelope.getBefore(), envelope.getAfter(),
                clock.instant()));
    }

    private String resolveTable(String topic, CdcEnvelope envelope) {
        if (envelope.getSource() != null && envelope.getSource().getTable() != null) {
            return envelope.getSource().getTable();
        }
        if (topic != null && topic.startsWith(topicPrefix) && topic.length() > topicPrefix.length()) {
            return topic.substring(topicPrefix.length());
        }
        return null;
    }
}
