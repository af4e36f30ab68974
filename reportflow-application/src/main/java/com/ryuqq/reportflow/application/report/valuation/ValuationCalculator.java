package com.ryuqq.reportflow.application.report.valuation;

import com.ryuqq.reportflow.application.codec.JobPayloadCodec;
import com.ryuqq.reportflow.application.codec.JobPayloadException;
import com.ryuqq.reportflow.application.protection.ExternalCallGuard;
import com.ryuqq.reportflow.application.report.analysis.ProfileMetrics;
import com.ryuqq.reportflow.core.contract.GenerationRequest;
import com.ryuqq.reportflow.core.contract.ReportJobRequest;
import com.ryuqq.reportflow.core.spi.TextGenerator;
import com.ryuqq.reportflow.core.text.JsonExtraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Year;
import java.util.List;
import java.util.Optional;

/**
 * 가치 평가 계산기.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>설문 답변이 없으면 건너뜀 (empty)</li>
 *   <li>답변에서 수치 입력 추출 (텍스트 생성, JSON 응답)</li>
 *   <li>reliance/attributable 보정 ({@link PercentSanitizer})</li>
 *   <li>{@link ValuationFormula}로 범위 계산</li>
 * </ol>
 *
 * <p>추출 응답을 해석하지 못하면 가치 평가는 없음(empty)으로 처리합니다. 0으로 계산하지 않습니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class ValuationCalculator {

    static final String SYSTEM_PROMPT = "You are a data extraction expert. Extract structured numerical data "
        + "from unstructured text. Always respond with valid JSON only.";
    static final int EXTRACTION_MAX_TOKENS = 1024;
    static final String NOT_PROVIDED = "Not provided";
    static final String NOT_AVAILABLE = "n/a";

    static final List<String> QUESTIONS = List.of(
        "How long has your business been collecting data?",
        "What percentage of business is attributable to data?",
        "What percentage of business is data reliant?",
        "What is the current market value of your business?",
        "For each year collecting data, what was the company valuation each year?"
    );

    private static final Logger log = LoggerFactory.getLogger(ValuationCalculator.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TextGenerator textGenerator;
    private final ExternalCallGuard guard;
    private final JobPayloadCodec codec;
    private final Clock clock;

    public ValuationCalculator(TextGenerator textGenerator, ExternalCallGuard guard, JobPayloadCodec codec, Clock clock) {
        if (textGenerator == null) {
            throw new IllegalArgumentException("textGenerator cannot be null");
        }
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.textGenerator = textGenerator;
        this.guard = guard;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * 가치 평가 계산.
     *
     * @param request 리포트 요청 (설문 답변 포함)
     * @param metrics 사전 분석 지표 (사전 분석이 없으면 null)
     * @return 가치 평가 (답변이 없거나 추출 응답을 해석하지 못하면 empty)
     * @throws Exception 텍스트 생성 호출 실패 또는 deadline 초과
     */
    public Optional<Valuation> calculate(ReportJobRequest request, ProfileMetrics metrics) throws Exception {
        if (request.answers().isEmpty()) {
            log.debug("Report {} has no questionnaire answers, skipping valuation", request.reportId());
            return Optional.empty();
        }

        GenerationRequest extraction = extractionRequest(request);
        String raw = guard.call(ExternalCallGuard.TEXT_GENERATION, () -> textGenerator.generate(extraction)).text();

        ValuationInputs inputs;
        try {
            inputs = codec.fromJson(JsonExtraction.extract(raw), ValuationInputs.class);
        } catch (JobPayloadException e) {
            log.warn("Failed to parse valuation inputs for report {}: {}", request.reportId(), e.getMessage());
            return Optional.empty();
        }

        ProfileMetrics known = metrics == null ? ProfileMetrics.empty() : metrics;
        return Optional.of(valuate(request, inputs, known));
    }

    /**
     * 추출된 입력으로 가치 평가 생성.
     */
    Valuation valuate(ReportJobRequest request, ValuationInputs inputs, ProfileMetrics metrics) {
        double reliancePercent = PercentSanitizer.sanitize(inputs.dataReliancePercent(), metrics.reliance());
        double attributablePercent = PercentSanitizer.sanitize(inputs.dataAttributablePercent(), metrics.attributable());
        QualityMetrics quality = QualityMetrics.from(metrics);

        ValuationFormula.Figures figures = ValuationFormula.compute(inputs.yearlyValuations(), reliancePercent, quality);

        BigDecimal current = inputs.currentCompanyValue();
        Valuation.Percentages percentages = new Valuation.Percentages(
            shareOf(figures.lowerBound(), current),
            shareOf(figures.upperBound(), current)
        );

        Valuation.CalculationDetails details = new Valuation.CalculationDetails(
            figures.totalValuation(),
            figures.dataRelianceValuation(),
            ValuationFormula.DATA_DECAY_PERCENT,
            ValuationFormula.LOWER_BOUND_DISCOUNT_PERCENT,
            figures.qualityMultiplier(),
            inputs.yearsCollectingData(),
            reliancePercent,
            attributablePercent,
            current
        );

        return new Valuation(
            figures.lowerBound(),
            figures.upperBound(),
            Valuation.ChartData.of(figures.lowerBound(), figures.upperBound(), percentages),
            details,
            request.answers()
        );
    }

    GenerationRequest extractionRequest(ReportJobRequest request) {
        StringBuilder prompt = new StringBuilder()
            .append("You are a data extraction expert. Extract structured numerical data from the following user responses.\n\n")
            .append("Questions and Answers:\n");
        for (int i = 0; i < QUESTIONS.size(); i++) {
            String question = QUESTIONS.get(i);
            prompt.append(i + 1).append(". ").append(question).append('\n')
                .append("   Answer: ").append(request.answerTo(question).orElse(NOT_PROVIDED)).append("\n\n");
        }
        prompt.append("Extract and provide the following in JSON format:\n")
            .append("{\n")
            .append("  \"yearsCollectingData\": <number of years as integer>,\n")
            .append("  \"dataAttributablePercent\": <percentage as decimal, e.g., 75 for 75%>,\n")
            .append("  \"dataReliancePercent\": <percentage as decimal, e.g., 80 for 80%>,\n")
            .append("  \"currentCompanyValue\": <current market value as number without commas or currency symbols>,\n")
            .append("  \"yearlyValuations\": [<array of company valuations for each year, starting from first year of ")
            .append("data collection to present. If not provided by user, calculate: start at 10% of current value, ")
            .append("increase by 10% of current value each year until reaching current value, then hold at current value>]\n")
            .append("}\n\n")
            .append("Important:\n")
            .append("- All percentages should be decimals (e.g., 75 not 0.75)\n")
            .append("- All monetary values should be numbers without commas or symbols\n")
            .append("- yearlyValuations should be an array with length equal to yearsCollectingData\n")
            .append("- Current year is ").append(Year.now(clock).getValue()).append("\n\n")
            .append("Respond with ONLY the JSON object, no other text.");
        return GenerationRequest.of(prompt.toString(), EXTRACTION_MAX_TOKENS).withSystemPrompt(SYSTEM_PROMPT);
    }

    static String shareOf(long amount, BigDecimal currentValue) {
        if (currentValue == null || currentValue.signum() <= 0) {
            return NOT_AVAILABLE;
        }
        BigDecimal percent = BigDecimal.valueOf(amount)
            .multiply(HUNDRED)
            .divide(currentValue, MathContext.DECIMAL64)
            .setScale(1, RoundingMode.HALF_UP);
        return percent.toPlainString() + "%";
    }
}
