package com.ryuqq.reportflow.core.contract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * 이메일 큐 Job의 Payload.
 *
 * <p>리포트 파이프라인이 문서 생성에 성공하면 만들어지고, Delivery Dispatcher handler가
 * 한 번 소비합니다. {@code reportId}는 상관관계 ID로, 리포트와 무관한 이메일에는 없습니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeliveryMessage(
    @JsonProperty("fromEmail") String sender,
    @JsonProperty("toEmail") String recipient,
    @JsonProperty("subject") String subject,
    @JsonProperty("htmlBody") String htmlBody,
    @JsonProperty("textBody") String textBody,
    @JsonProperty("attachments") List<Attachment> attachments,
    @JsonProperty("reportId") String reportId,
    @JsonProperty("subdomain") String subdomain
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 발신자, 수신자, 제목, 본문이 누락된 경우
     */
    public DeliveryMessage {
        if (sender == null || sender.isBlank()) {
            throw new IllegalArgumentException("sender cannot be null or blank");
        }
        if (recipient == null || recipient.isBlank()) {
            throw new IllegalArgumentException("recipient cannot be null or blank");
        }
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject cannot be null or blank");
        }
        if (htmlBody == null) {
            throw new IllegalArgumentException("htmlBody cannot be null");
        }
        if (textBody == null) {
            throw new IllegalArgumentException("textBody cannot be null");
        }
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    /**
     * 상관관계 ID (리포트 ID).
     *
     * @return 리포트 ID (리포트와 무관한 이메일이면 empty)
     */
    public Optional<String> correlationId() {
        if (reportId == null || reportId.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(reportId);
    }
}
