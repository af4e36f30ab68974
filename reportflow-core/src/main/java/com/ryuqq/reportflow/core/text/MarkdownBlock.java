package com.ryuqq.reportflow.core.text;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 파싱된 마크다운 블록.
 *
 * <p>level의 의미는 타입마다 다릅니다: HEADING은 1~3, NUMBERED는 원문의 번호,
 * 나머지는 0.</p>
 *
 * @param type 블록 타입
 * @param level 제목 단계 또는 번호
 * @param segments 인라인 조각
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record MarkdownBlock(Type type, int level, List<InlineSegment> segments) {

    public enum Type {
        HEADING,
        BULLET,
        NUMBERED,
        PARAGRAPH
    }

    public MarkdownBlock {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    /**
     * 스타일을 제거한 텍스트.
     */
    public String plainText() {
        return segments.stream().map(InlineSegment::text).collect(Collectors.joining());
    }
}
