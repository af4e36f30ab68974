package com.ryuqq.reportflow.core.text;

/**
 * 블록 안의 인라인 텍스트 조각.
 *
 * @param style 스타일
 * @param text 마커를 제거한 텍스트
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record InlineSegment(Style style, String text) {

    public enum Style {
        PLAIN,
        BOLD,
        ITALIC,
        CODE
    }

    public InlineSegment {
        if (style == null) {
            throw new IllegalArgumentException("style cannot be null");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
    }

    public static InlineSegment plain(String text) {
        return new InlineSegment(Style.PLAIN, text);
    }
}
