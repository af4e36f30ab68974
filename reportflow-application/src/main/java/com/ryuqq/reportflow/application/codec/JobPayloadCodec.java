package com.ryuqq.reportflow.application.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.reportflow.core.model.Payload;

/**
 * Job payload와 저장 JSON을 위한 Jackson codec.
 *
 * <p>큐 경계의 wire 형식(리포트 Job, 이메일 Job)과 리포트 레코드에 저장되는 JSON 산출물을
 * 모두 이 codec으로 직렬화합니다.</p>
 *
 * <p><strong>ObjectMapper 설정:</strong></p>
 * <ul>
 *   <li>JavaTimeModule 등록, 날짜는 ISO-8601 문자열</li>
 *   <li>알 수 없는 필드 무시 (생성된 JSON에 추가 필드가 섞여도 실패하지 않음)</li>
 * </ul>
 *
 * <p>모든 실패는 {@link JobPayloadException}으로 던집니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class JobPayloadCodec {

    private final ObjectMapper mapper;

    public JobPayloadCodec() {
        this(createDefaultObjectMapper());
    }

    public JobPayloadCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * 객체를 Payload로 직렬화.
     */
    public Payload encode(Object value) {
        return Payload.of(toJson(value));
    }

    /**
     * Payload를 타입으로 역직렬화.
     *
     * @throws JobPayloadException payload가 비었거나 형식이 맞지 않는 경우
     */
    public <T> T decode(Payload payload, Class<T> type) {
        if (payload == null || payload.isEmpty()) {
            throw new JobPayloadException("Empty payload for " + type.getSimpleName(), null);
        }
        return fromJson(payload.getValue(), type);
    }

    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JobPayloadException("Failed to serialize " + typeName(value), e);
        }
    }

    public <T> T fromJson(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new JobPayloadException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    /**
     * JSON 문자열을 트리로 파싱.
     *
     * @throws JobPayloadException JSON이 아닌 경우
     */
    public JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            throw new JobPayloadException("Empty JSON", null);
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new JobPayloadException("Malformed JSON", e);
        }
    }

    public ObjectNode emptyObject() {
        return mapper.createObjectNode();
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
