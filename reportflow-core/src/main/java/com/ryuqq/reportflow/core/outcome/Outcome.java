package com.ryuqq.reportflow.core.outcome;

/**
 * Job 실행 결과.
 *
 * <ul>
 *   <li>{@link Ok}: handler가 결과를 반환하며 정상 종료</li>
 *   <li>{@link Fail}: handler가 예외를 던져 실패</li>
 * </ul>
 *
 * <p>재시도 결과 타입은 없습니다. 실패한 Job의 재시도는 외부 브로커 설정의
 * 책임이며, 이 계층은 실패를 기록만 합니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
