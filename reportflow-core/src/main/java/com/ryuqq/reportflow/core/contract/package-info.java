/**
 * 큐와 외부 협력자 경계를 오가는 계약 타입 패키지.
 *
 * <p>Job 스냅샷, 리포트/이메일 Job의 wire payload, 알림 이벤트, 텍스트 생성 요청/응답,
 * 이벤트 스트림 메시지를 정의합니다. Jackson 어노테이션은 wire 필드 이름을 고정하는 데만
 * 사용하며, 직렬화 자체는 application 계층의 codec이 담당합니다.</p>
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.core.contract;
