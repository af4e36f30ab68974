package com.ryuqq.reportflow.application.delivery;

import com.ryuqq.reportflow.application.codec.JobPayloadCodec;
import com.ryuqq.reportflow.application.notification.NotificationService;
import com.ryuqq.reportflow.application.protection.ExternalCallGuard;
import com.ryuqq.reportflow.core.contract.DeliveryMessage;
import com.ryuqq.reportflow.core.contract.Job;
import com.ryuqq.reportflow.core.contract.MailReceipt;
import com.ryuqq.reportflow.core.handler.JobHandler;
import com.ryuqq.reportflow.core.model.Payload;
import com.ryuqq.reportflow.core.record.DeliveryStatus;
import com.ryuqq.reportflow.core.record.ReportRecord;
import com.ryuqq.reportflow.core.record.ReportUpdate;
import com.ryuqq.reportflow.core.spi.MailTransport;
import com.ryuqq.reportflow.core.spi.ReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 이메일 Job handler.
 *
 * <p>이메일 Job 하나당 {@link MailTransport#send(DeliveryMessage)}를 정확히 한 번 호출하고
 * 결과를 상관관계 리포트 레코드에 기록합니다.</p>
 *
 * <p><strong>성공:</strong></p>
 * <ul>
 *   <li>레코드에 mailMessageId, DELIVERED 기록 (deliveryError 초기화)</li>
 *   <li>"PDV Report Delivered" 알림 이중 기록</li>
 *   <li>결과 {@code {jobId, messageId}} 반환</li>
 * </ul>
 *
 * <p><strong>실패:</strong></p>
 * <ul>
 *   <li>레코드에 DELIVERY_FAILED + 오류 메시지 기록</li>
 *   <li>예외를 다시 던져 worker가 Job을 FAILED로 표시</li>
 * </ul>
 *
 * <p>상관관계 ID(reportId)가 없는 메일은 레코드 갱신과 알림을 건너뜁니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class DeliveryJobHandler implements JobHandler {

    public static final String DELIVERED_TITLE = "PDV Report Delivered";

    private static final Logger log = LoggerFactory.getLogger(DeliveryJobHandler.class);

    private final MailTransport mailTransport;
    private final ReportRepository reportRepository;
    private final NotificationService notificationService;
    private final JobPayloadCodec codec;
    private final ExternalCallGuard guard;

    public DeliveryJobHandler(
        MailTransport mailTransport,
        ReportRepository reportRepository,
        NotificationService notificationService,
        JobPayloadCodec codec,
        ExternalCallGuard guard
    ) {
        if (mailTransport == null) {
            throw new IllegalArgumentException("mailTransport cannot be null");
        }
        if (reportRepository == null) {
            throw new IllegalArgumentException("reportRepository cannot be null");
        }
        if (notificationService == null) {
            throw new IllegalArgumentException("notificationService cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        this.mailTransport = mailTransport;
        this.reportRepository = reportRepository;
        this.notificationService = notificationService;
        this.codec = codec;
        this.guard = guard;
    }

    @Override
    public Payload handle(Job job) throws Exception {
        DeliveryMessage message = codec.decode(job.payload(), DeliveryMessage.class);
        Optional<String> reportId = message.correlationId();

        MailReceipt receipt;
        try {
            receipt = guard.call(ExternalCallGuard.MAIL_SEND, () -> mailTransport.send(message));
        } catch (Exception e) {
            log.error("Email job {} to {} failed: {}", job.id().getValue(), message.recipient(), e.getMessage());
            reportId.ifPresent(id -> recordFailure(id, e));
            throw e;
        }

        log.info("Email job {} sent to {} (messageId={})",
            job.id().getValue(), message.recipient(), receipt.messageId());
        reportId.ifPresent(id -> recordDelivered(id, receipt));

        return codec.encode(new DeliveryReceipt(job.id().getValue(), receipt.messageId()));
    }

    private void recordDelivered(String reportId, MailReceipt receipt) {
        ReportRecord record;
        try {
            record = reportRepository.update(reportId, ReportUpdate.builder()
                .mailMessageId(receipt.messageId())
                .deliveryStatus(DeliveryStatus.DELIVERED)
                .deliveryError(null)
                .build());
        } catch (RuntimeException e) {
            log.error("Email for report {} was sent but the record could not be updated", reportId, e);
            return;
        }

        if (record.tenantId() == null) {
            log.warn("Report {} has no tenant, skipping delivered notification", reportId);
            return;
        }
        notificationService.notify(
            DELIVERED_TITLE,
            "Your PDV report has been delivered to your email.",
            record.tenantId(),
            record.platformId()
        );
    }

    private void recordFailure(String reportId, Exception cause) {
        try {
            reportRepository.update(reportId, ReportUpdate.builder()
                .deliveryStatus(DeliveryStatus.DELIVERY_FAILED)
                .deliveryError(errorMessage(cause))
                .build());
        } catch (RuntimeException e) {
            log.error("Failed to record delivery failure for report {}", reportId, e);
        }
    }

    static String errorMessage(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
