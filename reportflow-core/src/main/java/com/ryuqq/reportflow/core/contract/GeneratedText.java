package com.ryuqq.reportflow.core.contract;

import java.util.List;

/**
 * 텍스트 생성 응답.
 *
 * <p>생성기는 웹 검색 도구 호출 결과 등으로 여러 텍스트 블록을 반환할 수 있습니다.
 * 호출자는 첫 블록만이 아니라 {@link #text()}로 전체를 이어 붙여 사용해야 합니다.</p>
 *
 * @param segments 응답 텍스트 블록 (순서 유지)
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record GeneratedText(List<String> segments) {

    public GeneratedText {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public static GeneratedText of(String... segments) {
        return new GeneratedText(List.of(segments));
    }

    /**
     * 모든 블록을 순서대로 이어 붙인 텍스트.
     */
    public String text() {
        return String.join("", segments);
    }
}
