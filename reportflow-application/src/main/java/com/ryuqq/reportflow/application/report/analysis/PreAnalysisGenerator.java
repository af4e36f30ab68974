package com.ryuqq.reportflow.application.report.analysis;

import com.ryuqq.reportflow.application.codec.JobPayloadCodec;
import com.ryuqq.reportflow.application.codec.JobPayloadException;
import com.ryuqq.reportflow.application.protection.ExternalCallGuard;
import com.ryuqq.reportflow.core.contract.GenerationRequest;
import com.ryuqq.reportflow.core.spi.TextGenerator;
import com.ryuqq.reportflow.core.text.JsonExtraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 사전 분석 생성기.
 *
 * <p><strong>호출 순서:</strong></p>
 * <ol>
 *   <li>회사 개요</li>
 *   <li>지표 6개 (개요로 seed, metric executor에서 동시 실행)</li>
 *   <li>데이터 수집 분석</li>
 *   <li>요약 JSON (해석 실패 시 {@link ReportSummary#empty()})</li>
 * </ol>
 *
 * <p>요약 해석 실패를 제외한 호출 실패는 그대로 던지며, 파이프라인이 단계 결과를 없음으로 처리합니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class PreAnalysisGenerator {

    private static final Logger log = LoggerFactory.getLogger(PreAnalysisGenerator.class);

    private final TextGenerator textGenerator;
    private final ExternalCallGuard guard;
    private final JobPayloadCodec codec;
    private final ExecutorService metricExecutor;

    /**
     * @param metricExecutor 지표 호출 실행기 (소유권은 호출자에게 있음)
     */
    public PreAnalysisGenerator(
        TextGenerator textGenerator,
        ExternalCallGuard guard,
        JobPayloadCodec codec,
        ExecutorService metricExecutor
    ) {
        if (textGenerator == null) {
            throw new IllegalArgumentException("textGenerator cannot be null");
        }
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (metricExecutor == null) {
            throw new IllegalArgumentException("metricExecutor cannot be null");
        }
        this.textGenerator = textGenerator;
        this.guard = guard;
        this.codec = codec;
        this.metricExecutor = metricExecutor;
    }

    /**
     * 사전 분석 생성.
     *
     * @param orgName 조직 이름
     * @return 사전 분석 산출물
     * @throws Exception 텍스트 생성 호출 실패 또는 deadline 초과
     */
    public PreAnalysis generate(String orgName) throws Exception {
        String overview = generate(ReportPrompts.overview(orgName));

        List<String> metrics = generateMetrics(ReportPrompts.metrics(orgName, overview));

        String dataCollection = generate(ReportPrompts.dataCollection(orgName));
        ReportSummary summary = parseSummary(orgName, generate(ReportPrompts.summary(orgName)));

        return new PreAnalysis(
            overview,
            metrics.get(0),
            metrics.get(1),
            metrics.get(2),
            metrics.get(3),
            metrics.get(4),
            metrics.get(5),
            dataCollection,
            summary
        );
    }

    private List<String> generateMetrics(List<GenerationRequest> requests) throws Exception {
        List<Callable<String>> calls = new ArrayList<>(requests.size());
        for (GenerationRequest request : requests) {
            calls.add(() -> generate(request));
        }

        List<Future<String>> futures = metricExecutor.invokeAll(calls);
        List<String> answers = new ArrayList<>(futures.size());
        try {
            for (Future<String> future : futures) {
                answers.add(future.get());
            }
        } catch (ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        }
        return answers;
    }

    private ReportSummary parseSummary(String orgName, String raw) {
        try {
            return codec.fromJson(JsonExtraction.extract(raw), ReportSummary.class);
        } catch (JobPayloadException e) {
            log.warn("Unparseable summary for {}, using empty summary: {}", orgName, e.getMessage());
            return ReportSummary.empty();
        }
    }

    private String generate(GenerationRequest request) throws Exception {
        return guard.call(ExternalCallGuard.TEXT_GENERATION, () -> textGenerator.generate(request)).text();
    }
}
