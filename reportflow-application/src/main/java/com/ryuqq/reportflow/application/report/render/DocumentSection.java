package com.ryuqq.reportflow.application.report.render;

import com.ryuqq.reportflow.core.text.MarkdownBlock;

import java.util.List;

/**
 * 리포트 문서의 한 섹션.
 *
 * @param kind 섹션 종류
 * @param heading 섹션 제목
 * @param blocks 본문 블록
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record DocumentSection(SectionKind kind, String heading, List<MarkdownBlock> blocks) {

    public DocumentSection {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (heading == null || heading.isBlank()) {
            throw new IllegalArgumentException("heading cannot be null or blank");
        }
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }
}
