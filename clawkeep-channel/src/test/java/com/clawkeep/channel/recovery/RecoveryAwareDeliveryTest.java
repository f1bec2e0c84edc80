package com.clawkeep.channel.recovery;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryAwareDeliveryTest {

    private static final String ACCOUNT = "acct";

    private final AtomicLong clock = new AtomicLong(0);
    private final List<String> sent = new ArrayList<>();
    private ConnectionRecoveryTracker<String> tracker;
    private RecoveryAwareDelivery<String> delivery;

    @BeforeEach
    void setUp() {
        tracker = new ConnectionRecoveryTracker<>(30_000, clock::get);
        delivery = new RecoveryAwareDelivery<>(tracker, text -> {
            if (text.startsWith("fail")) {
                return CompletableFuture.failedFuture(new IllegalStateException("rejected"));
            }
            sent.add(text);
            return CompletableFuture.completedFuture(null);
        });
        delivery.registerFlush(ACCOUNT);
    }

    @Test
    void sendsDirectlyWhenIdle() {
        assertEquals(RecoveryAwareDelivery.Outcome.SENT, delivery.deliver(ACCOUNT, "hi").join());
        assertEquals(List.of("hi"), sent);
    }

    @Test
    void defersWhileRecoveringAndReplaysInOrder() {
        tracker.setRecovering(ACCOUNT);

        assertEquals(RecoveryAwareDelivery.Outcome.DEFERRED, delivery.deliver(ACCOUNT, "one").join());
        assertEquals(RecoveryAwareDelivery.Outcome.DEFERRED, delivery.deliver(ACCOUNT, "two").join());
        assertTrue(sent.isEmpty());

        assertEquals(2, tracker.clearRecoveringAndFlush(ACCOUNT).join());
        assertEquals(List.of("one", "two"), sent);
    }

    @Test
    void fallsBackToDirectSendAfterWindowLapses() {
        tracker.setRecovering(ACCOUNT);
        clock.addAndGet(30_000);

        assertEquals(RecoveryAwareDelivery.Outcome.SENT, delivery.deliver(ACCOUNT, "late").join());
        assertEquals(List.of("late"), sent);
    }

    @Test
    void flushSkipsFailingItems() {
        tracker.setRecovering(ACCOUNT);
        delivery.deliver(ACCOUNT, "a").join();
        delivery.deliver(ACCOUNT, "fail-b").join();
        delivery.deliver(ACCOUNT, "c").join();

        assertEquals(3, tracker.clearRecoveringAndFlush(ACCOUNT).join());
        assertEquals(List.of("a", "c"), sent);
    }
}
