package com.ryuqq.reportflow.adapter.inmemory.bus;

import com.ryuqq.reportflow.core.contract.NotificationEvent;
import com.ryuqq.reportflow.core.spi.NotificationBus;
import com.ryuqq.reportflow.core.spi.Subscription;
import com.ryuqq.reportflow.testkit.contract.AbstractNotificationBusContractTest;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test for InMemoryNotificationBus adapter.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 * @see AbstractNotificationBusContractTest
 */
class InMemoryNotificationBusContractTest extends AbstractNotificationBusContractTest {

    @Override
    protected NotificationBus createBus() {
        return new InMemoryNotificationBus();
    }

    @Test
    void subscribe_SameListenerTwice_RemovedOneRegistrationAtATime() {
        // given
        List<NotificationEvent> received = new CopyOnWriteArrayList<>();
        Consumer<NotificationEvent> listener = received::add;
        Subscription first = bus.subscribe(P1_O1, listener);
        bus.subscribe(P1_O1, listener);

        // when
        first.unsubscribe();
        bus.publish(P1_O1, event("update"));

        // then
        assertThat(received).hasSize(1);
        assertThat(bus.listenerCount(P1_O1)).isEqualTo(1);
    }
}
