package com.ryuqq.reportflow.core.record;

/**
 * 리포트 이메일 배달 상태.
 *
 * <p>레코드에는 하나의 상태만 저장되므로 DELIVERED와 DELIVERY_FAILED가 동시에
 * 기록될 수 없습니다. 배달을 시도하지 않은 리포트는 상태가 없습니다(null).</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public enum DeliveryStatus {

    /**
     * 배달 Job이 예약됨.
     */
    PENDING,

    /**
     * 메일 전송 성공.
     */
    DELIVERED,

    /**
     * 메일 전송 실패 또는 리포트 생성 전체 실패.
     */
    DELIVERY_FAILED
}
