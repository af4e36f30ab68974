package com.ryuqq.reportflow.application.report.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.reportflow.application.codec.JobPayloadCodec;
import com.ryuqq.reportflow.application.codec.JobPayloadException;
import com.ryuqq.reportflow.application.protection.ExternalCallGuard;
import com.ryuqq.reportflow.core.contract.GenerationRequest;
import com.ryuqq.reportflow.core.spi.TextGenerator;
import com.ryuqq.reportflow.core.text.JsonExtraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 경쟁 비교(보충) 생성기.
 *
 * <p>생성된 JSON 객체를 그대로 보존합니다. 객체로 해석되지 않으면 빈 객체 {@code {}}를
 * 반환하고, 호출 실패는 그대로 던집니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class SupplementaryGenerator {

    private static final Logger log = LoggerFactory.getLogger(SupplementaryGenerator.class);

    private final TextGenerator textGenerator;
    private final ExternalCallGuard guard;
    private final JobPayloadCodec codec;

    public SupplementaryGenerator(TextGenerator textGenerator, ExternalCallGuard guard, JobPayloadCodec codec) {
        if (textGenerator == null) {
            throw new IllegalArgumentException("textGenerator cannot be null");
        }
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.textGenerator = textGenerator;
        this.guard = guard;
        this.codec = codec;
    }

    /**
     * 경쟁 비교 생성.
     *
     * @param orgName 조직 이름
     * @param metrics 사전 분석 지표 (없으면 null)
     * @return 비교 JSON 객체 (해석 실패 시 빈 객체)
     * @throws Exception 텍스트 생성 호출 실패 또는 deadline 초과
     */
    public JsonNode generate(String orgName, ProfileMetrics metrics) throws Exception {
        GenerationRequest request = ReportPrompts.supplementary(orgName, metrics);
        String raw = guard.call(ExternalCallGuard.TEXT_GENERATION, () -> textGenerator.generate(request)).text();

        try {
            JsonNode node = codec.readTree(JsonExtraction.extract(raw));
            if (node.isObject()) {
                return node;
            }
            log.warn("Supplementary comparison for {} is not a JSON object, using empty object", orgName);
        } catch (JobPayloadException e) {
            log.warn("Unparseable supplementary comparison for {}, using empty object: {}", orgName, e.getMessage());
        }
        return codec.emptyObject();
    }
}
