package com.chronofill.backend.service;

import com.chronofill.backend.model.AuditEvent;
import com.chronofill.backend.repository.AuditEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists audit rows in their own transaction so a rollback of the caller keeps the trail.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuditEventService {

    static final int MAX_METADATA_LENGTH = 4000;
    static final int MAX_VALUE_LENGTH = 500;

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;

    /**
     * Fills the correlation id and timestamp on {@code draft}, attaches {@code metadata} as JSON and saves it.
     * Storage problems are logged and swallowed; callers treat auditing as best-effort.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(AuditEvent draft, Map<String, Object> metadata) {
        draft.setMetadata(toJson(draft.getEventType(), metadata));
        draft.setCorrelationId(MDC.get("correlationId"));
        draft.setCreatedAt(Instant.now());
        try {
            auditEventRepository.save(draft);
        } catch (RuntimeException e) {
            log.warn("Audit write failed event={} resource={}/{}: {}", draft.getEventType(),
                    draft.getResourceType(), draft.getResourceId(), e.getMessage());
        }
    }

    private String toJson(String eventType, Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        Map<String, Object> bounded = new LinkedHashMap<>();
        metadata.forEach((key, value) -> bounded.put(key, shorten(value)));
        try {
            String json = objectMapper.writeValueAsString(bounded);
            if (json.length() <= MAX_METADATA_LENGTH) {
                return json;
            }
            log.warn("Audit metadata for event={} is {} chars, storing summary only", eventType, json.length());
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("metadata_truncated", true);
            summary.put("original_length", json.length());
            return objectMapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            log.warn("Audit metadata not serializable event={}: {}", eventType, e.getOriginalMessage());
            return null;
        }
    }

    private static Object shorten(Object value) {
        if (value instanceof String) {
            String text = (String) value;
            if (text.length() > MAX_VALUE_LENGTH) {
                return text.substring(0, MAX_VALUE_LENGTH) + "...";
            }
        }
        return value;
    }
}
