package com.ryuqq.reportflow.adapter.inmemory.store;

import com.ryuqq.reportflow.core.contract.NotificationEvent;
import com.ryuqq.reportflow.core.model.TopicKey;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryNotificationRepository 테스트.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
class InMemoryNotificationRepositoryTest {

    @Test
    void findByTopic_테넌트별로_생성_순서대로_조회() {
        // given
        InMemoryNotificationRepository repository = new InMemoryNotificationRepository();
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        repository.create(NotificationEvent.unread("first", "d", "o1", "p1", now));
        repository.create(NotificationEvent.unread("other", "d", "o2", "p1", now));
        repository.create(NotificationEvent.unread("second", "d", "o1", "p1", now));

        // when & then
        assertThat(repository.findByTopic(TopicKey.of("p1", "o1")))
            .extracting(NotificationEvent::title)
            .containsExactly("first", "second");
        assertThat(repository.findByTopic(TopicKey.of("p2", "o1"))).isEmpty();
        assertThat(repository.count()).isEqualTo(3);
    }
}
