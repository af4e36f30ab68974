package com.ryuqq.reportflow.application.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.reportflow.core.contract.Attachment;
import com.ryuqq.reportflow.core.contract.DeliveryMessage;
import com.ryuqq.reportflow.core.contract.NotificationEvent;
import com.ryuqq.reportflow.core.contract.ReportJobRequest;
import com.ryuqq.reportflow.core.contract.ReportType;
import com.ryuqq.reportflow.core.model.Payload;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JobPayloadCodec 테스트.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
class JobPayloadCodecTest {

    private final JobPayloadCodec codec = new JobPayloadCodec();

    @Test
    void 리포트_Job_wire_형식을_해석한다() {
        // given
        String wire = "{\"reportId\":\"r-1\",\"orgName\":\"Acme\",\"workflowId\":\"wf\",\"reportType\":\"SUPPLEMENT\","
            + "\"userEmail\":\"user@acme.io\",\"platformId\":null,\"organizationId\":\"o1\",\"orgWorkflowId\":\"owf\","
            + "\"subdomain\":\"acme\",\"enableADV\":true,"
            + "\"pdvAnswers\":[{\"question\":\"Q1\",\"answer\":\"A1\"}],\"extra\":\"ignored\"}";

        // when
        ReportJobRequest request = codec.decode(Payload.of(wire), ReportJobRequest.class);

        // then
        assertThat(request.reportId()).isEqualTo("r-1");
        assertThat(request.reportType()).isEqualTo(ReportType.SUPPLEMENT);
        assertThat(request.platformId()).isNull();
        assertThat(request.tenantId()).isEqualTo("o1");
        assertThat(request.enableValuation()).isTrue();
        assertThat(request.answerTo("Q1")).contains("A1");
    }

    @Test
    void 이메일_Job은_wire_필드_이름으로_직렬화된다() {
        // given
        DeliveryMessage message = new DeliveryMessage("from@x.io", "to@x.io", "Subject", "<p>hi</p>", "hi",
            List.of(new Attachment("r.pdf", "AAAA", "adv-report-pdf", "application/pdf")), "r-1", "acme");

        // when
        JsonNode json = codec.readTree(codec.encode(message).getValue());

        // then
        assertThat(json.path("fromEmail").asText()).isEqualTo("from@x.io");
        assertThat(json.path("toEmail").asText()).isEqualTo("to@x.io");
        assertThat(json.path("attachments").get(0).path("ContentID").asText()).isEqualTo("adv-report-pdf");
        assertThat(json.path("attachments").get(0).path("Content").asText()).isEqualTo("AAAA");
    }

    @Test
    void 날짜는_ISO_문자열로_직렬화된다() {
        NotificationEvent event = NotificationEvent.unread("t", "d", "o1", "p1", Instant.parse("2024-01-01T00:00:00Z"));

        JsonNode json = codec.readTree(codec.toJson(event));

        assertThat(json.path("createdAt").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(json.has("topicKey")).isFalse();
    }

    @Test
    void 필수_필드가_없으면_JobPayloadException() {
        assertThatThrownBy(() -> codec.decode(Payload.of("{\"orgName\":\"Acme\"}"), ReportJobRequest.class))
            .isInstanceOf(JobPayloadException.class)
            .hasMessageContaining("ReportJobRequest");
    }

    @Test
    void JSON이_아니면_JobPayloadException() {
        assertThatThrownBy(() -> codec.readTree("not json at all {"))
            .isInstanceOf(JobPayloadException.class);
    }
}
