package com.ryuqq.reportflow.adapter.runner;

import com.ryuqq.reportflow.application.delivery.DeliveryConfig;
import com.ryuqq.reportflow.application.protection.ExternalCallGuard;
import com.ryuqq.reportflow.application.report.PipelineConfig;
import com.ryuqq.reportflow.core.model.QueueName;
import com.ryuqq.reportflow.core.protection.FixedTimeoutPolicy;
import com.ryuqq.reportflow.core.protection.TimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 실행 설정.
 *
 * <p>classpath의 {@code reportflow.properties}를 읽고, 같은 키를 대문자와 '_'로 바꾼
 * 환경 변수({@code reportflow.email.delay-ms} → {@code REPORTFLOW_EMAIL_DELAY_MS})가
 * 있으면 그 값을 우선합니다.</p>
 *
 * <p>각 config record로 변환하는 메서드를 제공하며, 값 검증은 record의 compact
 * constructor가 담당합니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class ReportFlowSettings {

    public static final String RESOURCE = "reportflow.properties";

    public static final String REPORT_QUEUE = "reportflow.report.queue";
    public static final String REPORT_CONCURRENCY = "reportflow.report.concurrency";
    public static final String REPORT_METRIC_CONCURRENCY = "reportflow.report.metric-concurrency";
    public static final String EMAIL_QUEUE = "reportflow.email.queue";
    public static final String EMAIL_CONCURRENCY = "reportflow.email.concurrency";
    public static final String EMAIL_DELAY_MS = "reportflow.email.delay-ms";
    public static final String EMAIL_SENDER = "reportflow.email.sender";
    public static final String WORKER_POLLING_INTERVAL_MS = "reportflow.worker.polling-interval-ms";
    public static final String WORKER_SHUTDOWN_TIMEOUT_MS = "reportflow.worker.shutdown-timeout-ms";
    public static final String TIMEOUT_DEFAULT_MS = "reportflow.timeout.default-ms";
    public static final String TIMEOUT_TEXT_GENERATION_MS = "reportflow.timeout.text-generation-ms";
    public static final String TIMEOUT_DOCUMENT_RENDER_MS = "reportflow.timeout.document-render-ms";
    public static final String TIMEOUT_MAIL_SEND_MS = "reportflow.timeout.mail-send-ms";

    static final int DEFAULT_REPORT_CONCURRENCY = 2;

    private static final List<String> KEYS = List.of(
        REPORT_QUEUE, REPORT_CONCURRENCY, REPORT_METRIC_CONCURRENCY,
        EMAIL_QUEUE, EMAIL_CONCURRENCY, EMAIL_DELAY_MS, EMAIL_SENDER,
        WORKER_POLLING_INTERVAL_MS, WORKER_SHUTDOWN_TIMEOUT_MS,
        TIMEOUT_DEFAULT_MS, TIMEOUT_TEXT_GENERATION_MS, TIMEOUT_DOCUMENT_RENDER_MS, TIMEOUT_MAIL_SEND_MS
    );

    private static final Logger log = LoggerFactory.getLogger(ReportFlowSettings.class);

    private final Map<String, String> values;

    private ReportFlowSettings(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    /**
     * classpath 리소스와 프로세스 환경 변수로 설정 로드.
     *
     * @return 설정
     * @throws UncheckedIOException 리소스를 읽을 수 없는 경우
     */
    public static ReportFlowSettings load() {
        Properties properties = new Properties();
        try (InputStream in = ReportFlowSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.info("{} not found on classpath, using defaults", RESOURCE);
            } else {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return load(properties, System.getenv());
    }

    /**
     * 주어진 properties와 환경 변수로 설정 생성.
     *
     * @param properties 파일 설정
     * @param environment 환경 변수 (우선)
     * @return 설정
     */
    public static ReportFlowSettings load(Properties properties, Map<String, String> environment) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }

        Map<String, String> values = new HashMap<>();
        for (String key : KEYS) {
            String fileValue = properties.getProperty(key);
            if (fileValue != null && !fileValue.isBlank()) {
                values.put(key, fileValue.trim());
            }
            String envValue = environment.get(environmentName(key));
            if (envValue != null && !envValue.isBlank()) {
                log.debug("{} overridden by {}", key, environmentName(key));
                values.put(key, envValue.trim());
            }
        }
        return new ReportFlowSettings(values);
    }

    /**
     * 설정 키에 대응하는 환경 변수 이름.
     */
    static String environmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    public PipelineConfig pipelineConfig() {
        return new PipelineConfig(
            QueueName.of(string(REPORT_QUEUE, PipelineConfig.DEFAULT_QUEUE)),
            intValue(REPORT_METRIC_CONCURRENCY, PipelineConfig.DEFAULT_METRIC_CONCURRENCY)
        );
    }

    public DeliveryConfig deliveryConfig() {
        return new DeliveryConfig(
            QueueName.of(string(EMAIL_QUEUE, DeliveryConfig.DEFAULT_QUEUE)),
            longValue(EMAIL_DELAY_MS, DeliveryConfig.DEFAULT_DELAY_MS),
            string(EMAIL_SENDER, DeliveryConfig.DEFAULT_SENDER)
        );
    }

    public QueueWorkerConfig workerConfig() {
        return new QueueWorkerConfig(
            longValue(WORKER_POLLING_INTERVAL_MS, QueueWorkerConfig.DEFAULT_POLLING_INTERVAL_MS),
            QueueWorkerConfig.DEFAULT_CONCURRENCY,
            longValue(WORKER_SHUTDOWN_TIMEOUT_MS, QueueWorkerConfig.DEFAULT_SHUTDOWN_TIMEOUT_MS)
        );
    }

    public int reportConcurrency() {
        return intValue(REPORT_CONCURRENCY, DEFAULT_REPORT_CONCURRENCY);
    }

    public int emailConcurrency() {
        return intValue(EMAIL_CONCURRENCY, QueueWorkerConfig.DEFAULT_CONCURRENCY);
    }

    /**
     * 외부 호출별 timeout 정책. 0은 timeout 없음.
     */
    public TimeoutPolicy timeoutPolicy() {
        Map<String, Long> overrides = new HashMap<>();
        putIfPresent(overrides, ExternalCallGuard.TEXT_GENERATION, TIMEOUT_TEXT_GENERATION_MS);
        putIfPresent(overrides, ExternalCallGuard.DOCUMENT_RENDER, TIMEOUT_DOCUMENT_RENDER_MS);
        putIfPresent(overrides, ExternalCallGuard.MAIL_SEND, TIMEOUT_MAIL_SEND_MS);
        return new FixedTimeoutPolicy(longValue(TIMEOUT_DEFAULT_MS, 0L), overrides);
    }

    public String get(String key) {
        return values.get(key);
    }

    private void putIfPresent(Map<String, Long> overrides, String callName, String key) {
        if (values.containsKey(key)) {
            overrides.put(callName, longValue(key, 0L));
        }
    }

    private String string(String key, String defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    private int intValue(String key, int defaultValue) {
        String value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + value + ")", e);
        }
    }

    private long longValue(String key, long defaultValue) {
        String value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number (current: " + value + ")", e);
        }
    }
}
