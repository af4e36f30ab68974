package com.ryuqq.reportflow.core.contract;

/**
 * 텍스트 생성 요청.
 *
 * @param prompt 사용자 프롬프트
 * @param systemPrompt 시스템 프롬프트 (null 가능)
 * @param maxTokens 최대 토큰 수 (양수)
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record GenerationRequest(String prompt, String systemPrompt, int maxTokens) {

    private static final int DEFAULT_MAX_TOKENS = 1024;

    public GenerationRequest {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt cannot be null or blank");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive (current: " + maxTokens + ")");
        }
    }

    public static GenerationRequest of(String prompt) {
        return new GenerationRequest(prompt, null, DEFAULT_MAX_TOKENS);
    }

    public static GenerationRequest of(String prompt, int maxTokens) {
        return new GenerationRequest(prompt, null, maxTokens);
    }

    public GenerationRequest withSystemPrompt(String systemPrompt) {
        return new GenerationRequest(prompt, systemPrompt, maxTokens);
    }
}
