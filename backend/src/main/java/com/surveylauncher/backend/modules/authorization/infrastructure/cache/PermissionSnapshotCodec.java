package com.surveylauncher.backend.modules.authorization.infrastructure.cache;

import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 캐시 스냅샷 JSON 직렬화. 읽을 수 없는 항목은 빈 값으로 돌려 호출 측이 미스로 처리하게 한다.
 */
public class PermissionSnapshotCodec {

    private static final Logger log = LoggerFactory.getLogger(PermissionSnapshotCodec.class);

    private final ObjectMapper objectMapper;

    public PermissionSnapshotCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    public String write(Object snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize permission snapshot", ex);
        }
    }

    public <T> Optional<T> read(String payload, Class<T> type) {
        if (payload == null || payload.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(payload, type));
        } catch (JsonProcessingException ex) {
            log.warn("Unreadable permission snapshot ({}): {}", type.getSimpleName(), ex.getOriginalMessage());
            return Optional.empty();
        }
    }
}
