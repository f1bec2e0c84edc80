package com.clawkeep.channel.recovery;

import lombok.extern.slf4j.Slf4j;

import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;

/**
 * Translates transport debug messages into recovery transitions for one
 * account: a "closed" marker starts recovery, an "opened" marker during
 * recovery flushes the queue. Signals are ignored while shutting down.
 */
@Slf4j
public class RecoverySignalHandler {

    public static final String CLOSED_MARKER = "WebSocket connection closed";
    public static final String OPENED_MARKER = "WebSocket connection opened";

    private final ConnectionRecoveryTracker<?> tracker;
    private final String accountId;
    private final BooleanSupplier isShuttingDown;
    private final IntConsumer onQueued;
    private final IntConsumer onFlushed;

    public RecoverySignalHandler(ConnectionRecoveryTracker<?> tracker,
                                 String accountId,
                                 BooleanSupplier isShuttingDown,
                                 IntConsumer onQueued,
                                 IntConsumer onFlushed) {
        this.tracker = tracker;
        this.accountId = accountId;
        this.isShuttingDown = isShuttingDown != null ? isShuttingDown : () -> false;
        this.onQueued = onQueued;
        this.onFlushed = onFlushed;
    }

    /**
     * Handle one transport debug message.
     */
    public void onDebug(Object msg) {
        String message = String.valueOf(msg);
        if (isShuttingDown.getAsBoolean()) {
            return;
        }
        if (message.contains(CLOSED_MARKER)) {
            tracker.setRecovering(accountId);
            int count = tracker.getQueuedCount(accountId);
            if (count > 0 && onQueued != null) {
                onQueued.accept(count);
            }
            return;
        }
        if (message.contains(OPENED_MARKER) && tracker.isRecovering(accountId)) {
            tracker.clearRecoveringAndFlush(accountId).whenComplete((flushed, err) -> {
                if (err != null) {
                    log.error("Recovery flush failed for account {}: {}", accountId, err.getMessage(), err);
                    return;
                }
                if (flushed > 0) {
                    log.info("Flushed {} deferred deliveries for account {}", flushed, accountId);
                    if (onFlushed != null) {
                        onFlushed.accept(flushed);
                    }
                }
            });
        }
    }
}
