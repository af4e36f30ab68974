package com.ryuqq.reportflow.application.report.analysis;

import com.ryuqq.reportflow.core.contract.GenerationRequest;

import java.util.List;
import java.util.OptionalDouble;

/**
 * 리포트 파이프라인의 텍스트 생성 요청 모음.
 *
 * <p><strong>토큰 한도:</strong></p>
 * <ul>
 *   <li>개요 300, 지표 각 200</li>
 *   <li>데이터 수집 400, 요약 600</li>
 *   <li>경쟁 비교 800</li>
 * </ul>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class ReportPrompts {

    static final int OVERVIEW_MAX_TOKENS = 300;
    static final int METRIC_MAX_TOKENS = 200;
    static final int DATA_COLLECTION_MAX_TOKENS = 400;
    static final int SUMMARY_MAX_TOKENS = 600;
    static final int SUPPLEMENTARY_MAX_TOKENS = 800;

    private static final String JSON_ONLY = "Respond with ONLY the JSON object, no other text.";

    private ReportPrompts() {
    }

    public static GenerationRequest overview(String orgName) {
        return GenerationRequest.of(
            "Provide a professional 5-line overview for " + orgName + ". "
                + "Focus on their business model, industry and sector position, and key operations.",
            OVERVIEW_MAX_TOKENS);
    }

    /**
     * 지표 요청 목록. {@link ProfileMetrics} 순서(reliance, attribute, uniqueness, scarcity,
     * ownership, sector reliance)를 따르며, 개요가 있으면 각 요청에 개요를 덧붙입니다.
     */
    public static List<GenerationRequest> metrics(String orgName, String overview) {
        List<String> questions = List.of(
            "Estimate the data reliance percentage and detailed analysis for " + orgName + ".",
            "Estimate the data attribute percentage and detailed analysis for " + orgName + ".",
            "Estimate the data uniqueness percentage and detailed analysis for " + orgName + ".",
            "Estimate the data scarcity percentage and detailed analysis for " + orgName + ".",
            "Estimate the data ownership percentage and detailed analysis for " + orgName + ".",
            "What is the typical data reliance percentage for the sector that " + orgName + " operates in?"
        );
        return questions.stream()
            .map(question -> GenerationRequest.of(seeded(question, overview), METRIC_MAX_TOKENS))
            .toList();
    }

    public static GenerationRequest dataCollection(String orgName) {
        return GenerationRequest.of(
            "Provide a detailed analysis of the data collected by " + orgName + ", including:\n"
                + "1. Types of unique data they collect\n"
                + "2. Environmental/ESG data considerations\n"
                + "3. Data collection methods and sources\n"
                + "Format as a professional paragraph.",
            DATA_COLLECTION_MAX_TOKENS);
    }

    public static GenerationRequest summary(String orgName) {
        return GenerationRequest.of(
            "Create a powerful and professional data summary for " + orgName
                + " including their competitive advantages.\n\n"
                + "Provide the response in JSON format:\n"
                + "{\n"
                + "  \"summary\": \"Professional summary text\",\n"
                + "  \"competitiveAdvantages\": [\"advantage 1\", \"advantage 2\", ...],\n"
                + "  \"dataProfileTable\": [\n"
                + "    {\"dataMetric\": \"metric name\", \"estimate\": \"value\", \"strategicSignificance\": \"significance\"}\n"
                + "  ]\n"
                + "}\n\n"
                + JSON_ONLY,
            SUMMARY_MAX_TOKENS);
    }

    /**
     * 경쟁 비교 요청. 조직의 지표를 알고 있으면 함께 전달합니다.
     */
    public static GenerationRequest supplementary(String orgName, ProfileMetrics metrics) {
        StringBuilder prompt = new StringBuilder()
            .append("For ").append(orgName)
            .append(", create a comprehensive Data Profile and Competitive Moat comparison with their sector ")
            .append("and geography across 5 data metrics - data reliance, data attribution, data uniqueness, ")
            .append("data scarcity, and data ownership percentages.\n\n");

        if (metrics != null && metrics.hasAny()) {
            prompt.append("Use these previously estimated values for the organization column:\n");
            appendMetric(prompt, "data reliance", metrics.reliance());
            appendMetric(prompt, "data attribution", metrics.attributable());
            appendMetric(prompt, "data uniqueness", metrics.uniqueness());
            appendMetric(prompt, "data scarcity", metrics.scarcity());
            appendMetric(prompt, "data ownership", metrics.ownership());
            prompt.append('\n');
        }

        prompt.append("Provide response in JSON format:\n")
            .append("{\n")
            .append("  \"sectorName\": \"sector name\",\n")
            .append("  \"geographyName\": \"geography\",\n")
            .append("  \"comparisonTable\": [\n")
            .append("    {\"dataMetric\": \"metric\", \"organizationValue\": \"value\", \"sectorValue\": \"value\", \"geographyValue\": \"value\"}\n")
            .append("  ],\n")
            .append("  \"qualitativeComparison\": \"detailed multiparagraph text analysis of primary data moat including multiple pointers\",\n")
            .append("  \"radarChartData\": {\n")
            .append("    \"data metrics\": [\"data reliance\", \"data scarcity\", ...],\n")
            .append("    \"organizationValues\": [numericvalue1, numericvalue2, ...],\n")
            .append("    \"sectorValues\": [numericvalue1, numericvalue2, ...]\n")
            .append("  }\n")
            .append("}\n\n")
            .append(JSON_ONLY);
        return GenerationRequest.of(prompt.toString(), SUPPLEMENTARY_MAX_TOKENS);
    }

    private static String seeded(String question, String overview) {
        if (overview == null || overview.isBlank()) {
            return question;
        }
        return "Company overview:\n" + overview.trim() + "\n\n" + question;
    }

    private static void appendMetric(StringBuilder prompt, String name, OptionalDouble value) {
        if (value.isPresent()) {
            prompt.append("- ").append(name).append(": ").append(formatPercent(value.getAsDouble())).append("%\n");
        }
    }

    private static String formatPercent(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
