package io.incentedge.webhooks.poller;

import io.incentedge.webhooks.delivery.DeliveryEngine;
import io.incentedge.webhooks.model.DeliveryStatus;
import io.incentedge.webhooks.model.Subscription;
import io.incentedge.webhooks.testing.Fixtures;
import io.incentedge.webhooks.testing.InMemoryDeliveryStore;
import io.incentedge.webhooks.testing.InMemorySubscriptionStore;
import io.incentedge.webhooks.testing.RecordingTransport;
import io.incentedge.webhooks.testing.StubConnections;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RetryPollerTest {
    private final InMemoryDeliveryStore deliveries = new InMemoryDeliveryStore();
    private final InMemorySubscriptionStore subscriptions = new InMemorySubscriptionStore();
    private final RecordingTransport transport = RecordingTransport.respondingWith(200);

    private RetryScheduler scheduler() {
        DeliveryEngine engine = DeliveryEngine.builder()
                .connectionProvider(StubConnections.noop())
                .deliveryStore(deliveries)
                .subscriptionStore(subscriptions)
                .transport(transport)
                .build();
        return RetryScheduler.builder()
                .connectionProvider(StubConnections.noop())
                .deliveryStore(deliveries)
                .subscriptionStore(subscriptions)
                .engine(engine)
                .build();
    }

    @Test
    void intervalMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPoller(scheduler(), 0));
    }

    @Test
    void scheduledRunDeliversDueRecords() throws Exception {
        Subscription subscription = Fixtures.subscription("sub_1", "project.created").build();
        subscriptions.put(subscription);
        deliveries.put(Fixtures.record("d1", subscription, Instant.now().minusSeconds(1)).build());

        try (RetryPoller poller = new RetryPoller(scheduler(), 20)) {
            poller.start();
            poller.start();
            assertTrue(poller.isRunning());

            long deadline = System.currentTimeMillis() + 5_000;
            while (deliveries.get("d1").status() != DeliveryStatus.DELIVERED
                    && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
        }
        assertEquals(DeliveryStatus.DELIVERED, deliveries.get("d1").status());
        assertEquals(1, transport.requests().size());
    }

    @Test
    void closedPollerCannotRestart() {
        RetryPoller poller = new RetryPoller(scheduler(), 1_000);
        poller.start();
        poller.close();

        assertFalse(poller.isRunning());
        assertThrows(IllegalStateException.class, poller::start);
    }

    @Test
    void pollSurvivesSchedulerFailure() {
        deliveries.setClaimUnavailable(true);
        RetryPoller poller = new RetryPoller(scheduler(), 1_000);

        assertDoesNotThrow(poller::poll);
    }
}
