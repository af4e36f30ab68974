package com.ryuqq.reportflow.application.report.render;

/**
 * 조립된 리포트를 바이너리 문서(PDF)로 렌더링.
 *
 * <p>구현체는 {@link ReportDocument#sections()}에 있는 섹션만 그립니다. 없는 산출물에는
 * 섹션이 없습니다. 호출은 외부 호출 가드를 거치므로 구현체는 블로킹해도 됩니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DocumentRenderer {

    /**
     * @param document assembled report
     * @return rendered bytes (never null)
     * @throws Exception if rendering fails
     */
    byte[] render(ReportDocument document) throws Exception;
}
