package com.clawkeep.channel.recovery;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Outbound send path that defers deliveries while an account is recovering.
 *
 * @param <T> delivery type
 */
@Slf4j
public class RecoveryAwareDelivery<T> {

    /** Result of {@link #deliver}. */
    public enum Outcome {
        SENT, DEFERRED
    }

    private final ConnectionRecoveryTracker<T> tracker;
    private final Function<T, CompletableFuture<Void>> sender;

    /**
     * @param sender sends one delivery over the live transport
     */
    public RecoveryAwareDelivery(ConnectionRecoveryTracker<T> tracker, Function<T, CompletableFuture<Void>> sender) {
        this.tracker = tracker;
        this.sender = sender;
    }

    /**
     * Deliver, or queue when the account is recovering. If the window lapses
     * between the check and the enqueue the delivery is sent directly.
     */
    public CompletableFuture<Outcome> deliver(String accountId, T delivery) {
        if (tracker.isRecovering(accountId) && tracker.queueDelivery(accountId, delivery)) {
            return CompletableFuture.completedFuture(Outcome.DEFERRED);
        }
        return sender.apply(delivery).thenApply(v -> Outcome.SENT);
    }

    /**
     * Register the flush handler for an account: queued deliveries are
     * re-sent one by one in order; a failing item is logged and skipped.
     */
    public void registerFlush(String accountId) {
        tracker.setFlushHandler(accountId, queued -> flushSequentially(accountId, queued));
    }

    private CompletableFuture<Void> flushSequentially(String accountId, List<T> queued) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (T item : queued) {
            chain = chain.thenCompose(v -> sendQuietly(accountId, item));
        }
        return chain;
    }

    private CompletableFuture<Void> sendQuietly(String accountId, T item) {
        CompletableFuture<Void> sent;
        try {
            sent = sender.apply(item);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        return sent.exceptionally(err -> {
            log.error("Recovery flush failed for account {}: {}", accountId, err.getMessage());
            return null;
        });
    }
}
