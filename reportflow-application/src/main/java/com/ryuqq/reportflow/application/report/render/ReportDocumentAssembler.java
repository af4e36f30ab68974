package com.ryuqq.reportflow.application.report.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.reportflow.application.report.analysis.DataProfileRow;
import com.ryuqq.reportflow.application.report.analysis.PreAnalysis;
import com.ryuqq.reportflow.application.report.analysis.ReportSummary;
import com.ryuqq.reportflow.application.report.valuation.Valuation;
import com.ryuqq.reportflow.core.contract.QuestionAnswer;
import com.ryuqq.reportflow.core.text.InlineSegment;
import com.ryuqq.reportflow.core.text.MarkdownBlock;
import com.ryuqq.reportflow.core.text.MarkdownParser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 리포트 문서 조립기.
 *
 * <p>세 산출물(사전 분석, 경쟁 비교, 가치 평가)에서 렌더러 입력을 만듭니다.
 * 원본 데이터가 없는 섹션은 만들지 않으며, 서술형 텍스트는 {@link MarkdownParser}로 블록화합니다.</p>
 *
 * <p><strong>섹션 규칙:</strong></p>
 * <ul>
 *   <li>사전 분석이 있으면: 개요, 지표, 데이터 수집, 요약(요약이 비어 있지 않을 때)</li>
 *   <li>경쟁 비교가 빈 객체가 아니면: 경쟁 비교</li>
 *   <li>가치 평가가 있으면: 가치 평가</li>
 * </ul>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class ReportDocumentAssembler {

    private static final Map<String, String> METRIC_TITLES = Map.of(
        "dataReliance", "Data Reliance",
        "dataAttribute", "Data Attribution",
        "dataUniqueness", "Data Uniqueness",
        "dataScarcity", "Data Scarcity",
        "dataOwnership", "Data Ownership",
        "sectorReliance", "Sector Data Reliance"
    );

    /**
     * 문서 조립.
     *
     * @param orgName 조직 이름
     * @param preAnalysis 사전 분석 (null 가능)
     * @param supplementary 경쟁 비교 (null 가능)
     * @param valuation 가치 평가 (null 가능)
     * @return 렌더러 입력
     */
    public ReportDocument assemble(String orgName, PreAnalysis preAnalysis, JsonNode supplementary, Valuation valuation) {
        List<DocumentSection> sections = new ArrayList<>();

        if (preAnalysis != null) {
            addIfNotEmpty(sections, SectionKind.OVERVIEW, "Company Overview", MarkdownParser.parse(preAnalysis.overview()));
            addIfNotEmpty(sections, SectionKind.DATA_METRICS, "Data Profile", metricBlocks(preAnalysis));
            addIfNotEmpty(sections, SectionKind.DATA_COLLECTION, "Data Collection", MarkdownParser.parse(preAnalysis.dataCollection()));
            if (!preAnalysis.summary().isEmpty()) {
                sections.add(new DocumentSection(SectionKind.SUMMARY, "Data Summary", summaryBlocks(preAnalysis.summary())));
            }
        }

        if (hasComparison(supplementary)) {
            sections.add(new DocumentSection(
                SectionKind.COMPETITIVE_COMPARISON,
                "Data Profile & Competitive Moat",
                comparisonBlocks(supplementary)
            ));
        }

        if (valuation != null) {
            sections.add(new DocumentSection(SectionKind.VALUATION, "Preliminary Data Valuation", valuationBlocks(valuation)));
        }

        return new ReportDocument(orgName, preAnalysis, supplementary, valuation, sections);
    }

    static boolean hasComparison(JsonNode supplementary) {
        return supplementary != null && supplementary.isObject() && supplementary.size() > 0;
    }

    private List<MarkdownBlock> metricBlocks(PreAnalysis preAnalysis) {
        List<MarkdownBlock> blocks = new ArrayList<>();
        addMetric(blocks, "dataReliance", preAnalysis.dataReliance());
        addMetric(blocks, "dataAttribute", preAnalysis.dataAttribute());
        addMetric(blocks, "dataUniqueness", preAnalysis.dataUniqueness());
        addMetric(blocks, "dataScarcity", preAnalysis.dataScarcity());
        addMetric(blocks, "dataOwnership", preAnalysis.dataOwnership());
        addMetric(blocks, "sectorReliance", preAnalysis.sectorReliance());
        return blocks;
    }

    private void addMetric(List<MarkdownBlock> blocks, String key, String text) {
        List<MarkdownBlock> parsed = MarkdownParser.parse(text);
        if (parsed.isEmpty()) {
            return;
        }
        blocks.add(heading(METRIC_TITLES.get(key)));
        blocks.addAll(parsed);
    }

    private List<MarkdownBlock> summaryBlocks(ReportSummary summary) {
        List<MarkdownBlock> blocks = new ArrayList<>(MarkdownParser.parse(summary.summary()));
        if (!summary.competitiveAdvantages().isEmpty()) {
            blocks.add(heading("Competitive Advantages"));
            summary.competitiveAdvantages().forEach(advantage ->
                blocks.add(new MarkdownBlock(MarkdownBlock.Type.BULLET, 0, MarkdownParser.parseInline(advantage))));
        }
        if (!summary.dataProfileTable().isEmpty()) {
            blocks.add(heading("Data Profile Table"));
            for (DataProfileRow row : summary.dataProfileTable()) {
                blocks.add(bullet(row.dataMetric() + ": " + row.estimate() + " (" + row.strategicSignificance() + ")"));
            }
        }
        return blocks;
    }

    private List<MarkdownBlock> comparisonBlocks(JsonNode supplementary) {
        List<MarkdownBlock> blocks = new ArrayList<>();
        String sector = supplementary.path("sectorName").asText("");
        String geography = supplementary.path("geographyName").asText("");
        if (!sector.isBlank() || !geography.isBlank()) {
            blocks.add(paragraph("Sector: " + sector + ", Geography: " + geography));
        }

        JsonNode table = supplementary.path("comparisonTable");
        if (table.isArray() && table.size() > 0) {
            blocks.add(heading("Comparison"));
            Iterator<JsonNode> rows = table.elements();
            while (rows.hasNext()) {
                JsonNode row = rows.next();
                blocks.add(bullet(row.path("dataMetric").asText("")
                    + ": organization " + row.path("organizationValue").asText("")
                    + ", sector " + row.path("sectorValue").asText("")
                    + ", geography " + row.path("geographyValue").asText("")));
            }
        }

        String qualitative = supplementary.path("qualitativeComparison").asText("");
        blocks.addAll(MarkdownParser.parse(qualitative));
        return blocks;
    }

    private List<MarkdownBlock> valuationBlocks(Valuation valuation) {
        List<MarkdownBlock> blocks = new ArrayList<>();
        blocks.add(paragraph("Estimated data value range: " + valuation.lowerRangeLabel()
            + " to " + valuation.upperRangeLabel()));
        blocks.add(bullet("Bottom PDV Range: " + valuation.lowerBound()
            + " (" + valuation.chartData().percentages().lower() + " of current value)"));
        blocks.add(bullet("Top PDV Range: " + valuation.upperBound()
            + " (" + valuation.chartData().percentages().upper() + " of current value)"));
        if (!valuation.qaTable().isEmpty()) {
            blocks.add(heading("Questionnaire"));
            for (QuestionAnswer qa : valuation.qaTable()) {
                blocks.add(bullet(qa.question() + " " + qa.answer()));
            }
        }
        return blocks;
    }

    private static void addIfNotEmpty(List<DocumentSection> sections, SectionKind kind, String heading, List<MarkdownBlock> blocks) {
        if (!blocks.isEmpty()) {
            sections.add(new DocumentSection(kind, heading, blocks));
        }
    }

    private static MarkdownBlock heading(String text) {
        return new MarkdownBlock(MarkdownBlock.Type.HEADING, 3, List.of(InlineSegment.plain(text)));
    }

    private static MarkdownBlock bullet(String text) {
        return new MarkdownBlock(MarkdownBlock.Type.BULLET, 0, List.of(InlineSegment.plain(text)));
    }

    private static MarkdownBlock paragraph(String text) {
        return new MarkdownBlock(MarkdownBlock.Type.PARAGRAPH, 0, List.of(InlineSegment.plain(text)));
    }
}
