package com.ryuqq.reportflow.application.report.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.reportflow.application.codec.JobPayloadCodec;
import com.ryuqq.reportflow.application.report.analysis.PreAnalysis;
import com.ryuqq.reportflow.application.report.analysis.ReportSummary;
import com.ryuqq.reportflow.application.report.valuation.Valuation;
import com.ryuqq.reportflow.core.text.MarkdownBlock;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ReportDocumentAssembler 테스트.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
class ReportDocumentAssemblerTest {

    private final ReportDocumentAssembler assembler = new ReportDocumentAssembler();
    private final JobPayloadCodec codec = new JobPayloadCodec();

    private static PreAnalysis preAnalysis(ReportSummary summary) {
        return new PreAnalysis("# Acme\nAcme is **big**.", "70%", "40%", "", "", "", "",
            "- telemetry\n- invoices", summary);
    }

    private static Valuation valuation() {
        Valuation.Percentages percentages = new Valuation.Percentages("8.8%", "12.6%");
        Valuation.CalculationDetails details = new Valuation.CalculationDetails(
            BigDecimal.valueOf(6_000_000), BigDecimal.valueOf(4_800_000), new BigDecimal("12.5"),
            BigDecimal.valueOf(30), new BigDecimal("0.6"), 3, 80, 40, BigDecimal.valueOf(2_000_000));
        return new Valuation(176_400, 252_000, Valuation.ChartData.of(176_400, 252_000, percentages), details, List.of());
    }

    @Test
    void 모든_산출물이_있으면_모든_섹션을_순서대로_만든다() {
        // given
        ReportSummary summary = new ReportSummary("Acme leads.", List.of("Scale"), List.of());
        JsonNode supplementary = codec.readTree("{\"sectorName\":\"Logistics\",\"qualitativeComparison\":\"Strong moat.\"}");

        // when
        ReportDocument document = assembler.assemble("Acme", preAnalysis(summary), supplementary, valuation());

        // then
        assertThat(document.sections()).extracting(DocumentSection::kind).containsExactly(
            SectionKind.OVERVIEW,
            SectionKind.DATA_METRICS,
            SectionKind.DATA_COLLECTION,
            SectionKind.SUMMARY,
            SectionKind.COMPETITIVE_COMPARISON,
            SectionKind.VALUATION
        );
        assertThat(document.section(SectionKind.OVERVIEW).orElseThrow().blocks().get(0).type())
            .isEqualTo(MarkdownBlock.Type.HEADING);
        assertThat(document.section(SectionKind.VALUATION).orElseThrow().blocks().get(0).plainText())
            .isEqualTo("Estimated data value range: $0.2M to $0.3M");
    }

    @Test
    void 없는_산출물의_섹션은_만들지_않는다() {
        ReportDocument document = assembler.assemble("Acme", null, null, null);

        assertThat(document.sections()).isEmpty();
        assertThat(document.valuation()).isNull();
    }

    @Test
    void 빈_경쟁_비교와_빈_요약은_생략한다() {
        ReportDocument document = assembler.assemble("Acme", preAnalysis(ReportSummary.empty()), codec.emptyObject(), null);

        assertThat(document.hasSection(SectionKind.SUMMARY)).isFalse();
        assertThat(document.hasSection(SectionKind.COMPETITIVE_COMPARISON)).isFalse();
        assertThat(document.hasSection(SectionKind.OVERVIEW)).isTrue();
    }

    @Test
    void 지표_섹션은_응답이_있는_지표만_포함한다() {
        ReportDocument document = assembler.assemble("Acme", preAnalysis(ReportSummary.empty()), null, null);

        List<MarkdownBlock> blocks = document.section(SectionKind.DATA_METRICS).orElseThrow().blocks();
        assertThat(blocks).filteredOn(block -> block.type() == MarkdownBlock.Type.HEADING)
            .extracting(MarkdownBlock::plainText)
            .containsExactly("Data Reliance", "Data Attribution");
    }
}
