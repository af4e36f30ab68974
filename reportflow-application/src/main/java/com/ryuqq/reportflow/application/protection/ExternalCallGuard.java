package com.ryuqq.reportflow.application.protection;

import com.ryuqq.reportflow.core.protection.TimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 외부 호출 deadline 적용기.
 *
 * <p>텍스트 생성, 문서 렌더링, 메일 전송 호출을 {@link TimeoutPolicy}의 호출별 deadline
 * 안에서 실행합니다. deadline을 넘기면 호출 스레드를 인터럽트하고
 * {@link ExternalCallTimeoutException}을 던지므로, 멈춘 외부 호출이 worker 슬롯을
 * 무기한 점유하지 않습니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>deadline 0: 호출자 스레드에서 바로 실행</li>
 *   <li>deadline &gt; 0: 전용 스레드에서 실행 후 deadline까지 대기</li>
 *   <li>호출이 던진 예외는 감싸지 않고 그대로 다시 던짐</li>
 * </ul>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class ExternalCallGuard implements AutoCloseable {

    public static final String TEXT_GENERATION = "text.generate";
    public static final String DOCUMENT_RENDER = "document.render";
    public static final String MAIL_SEND = "mail.send";

    private static final Logger log = LoggerFactory.getLogger(ExternalCallGuard.class);

    private final TimeoutPolicy timeoutPolicy;
    private final ExecutorService callExecutor;

    /**
     * @param timeoutPolicy 호출별 deadline 정책
     * @throws IllegalArgumentException timeoutPolicy가 null인 경우
     */
    public ExternalCallGuard(TimeoutPolicy timeoutPolicy) {
        if (timeoutPolicy == null) {
            throw new IllegalArgumentException("timeoutPolicy cannot be null");
        }
        this.timeoutPolicy = timeoutPolicy;
        this.callExecutor = Executors.newCachedThreadPool(new CallThreadFactory());
    }

    /**
     * deadline 안에서 외부 호출 실행.
     *
     * @param callName 호출 이름 (정책 조회 키)
     * @param call 외부 호출
     * @return 호출 결과
     * @throws ExternalCallTimeoutException deadline 초과
     * @throws InterruptedException 대기 중 인터럽트
     * @throws Exception 호출이 던진 예외
     */
    public <T> T call(String callName, Callable<T> call) throws Exception {
        if (callName == null || call == null) {
            throw new IllegalArgumentException("callName and call cannot be null");
        }

        long timeoutMs = timeoutPolicy.getPerCallTimeoutMs(callName);
        if (timeoutMs <= 0) {
            return call.call();
        }

        long startNanos = System.nanoTime();
        Future<T> future = callExecutor.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            timeoutPolicy.recordTimeout(callName, elapsedMs);
            log.warn("External call '{}' exceeded {}ms deadline", callName, timeoutMs);
            throw new ExternalCallTimeoutException(callName, timeoutMs);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }

    private static final class CallThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "external-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
