package com.ryuqq.reportflow.adapter.inmemory.store;

import com.ryuqq.reportflow.core.record.DeliveryStatus;
import com.ryuqq.reportflow.core.record.ReportRecord;
import com.ryuqq.reportflow.core.record.ReportUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryReportRepository 테스트.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
class InMemoryReportRepositoryTest {

    private InMemoryReportRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryReportRepository();
        repository.create(ReportRecord.empty("r-1"));
    }

    @Test
    void update_부분_갱신은_다른_필드를_유지한다() {
        // given
        repository.update("r-1", ReportUpdate.builder().preAnalysisData("{\"summary\":\"x\"}").build());

        // when
        ReportRecord updated = repository.update("r-1", ReportUpdate.builder().deliveryJobId("job-1").build());

        // then
        assertThat(updated.preAnalysisData()).isEqualTo("{\"summary\":\"x\"}");
        assertThat(updated.deliveryJobId()).isEqualTo("job-1");
        assertThat(repository.findById("r-1")).contains(updated);
    }

    @Test
    void update_없는_레코드는_예외() {
        assertThatThrownBy(() -> repository.update("missing", ReportUpdate.builder().build()))
            .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void create_중복_ID는_예외() {
        assertThatThrownBy(() -> repository.create(ReportRecord.empty("r-1")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void update_동시_갱신도_필드를_잃지_않는다() throws Exception {
        // given
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);

        // when
        executor.submit(() -> {
            start.await();
            repository.update("r-1", ReportUpdate.builder().mailMessageId("m-1").build());
            return null;
        });
        executor.submit(() -> {
            start.await();
            repository.update("r-1", ReportUpdate.builder().deliveryStatus(DeliveryStatus.DELIVERED).build());
            return null;
        });
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        // then
        ReportRecord record = repository.findById("r-1").orElseThrow();
        assertThat(record.mailMessageId()).isEqualTo("m-1");
        assertThat(record.deliveryStatus()).isEqualTo(DeliveryStatus.DELIVERED);
    }
}
