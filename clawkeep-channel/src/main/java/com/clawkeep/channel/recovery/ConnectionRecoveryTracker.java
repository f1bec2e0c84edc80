package com.clawkeep.channel.recovery;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Per-account recovery state for transient transport disconnects.
 * <p>
 * While an account is recovering, outbound deliveries are queued instead of
 * sent. Expiry of the recovery window is checked lazily in
 * {@link #isRecovering(String)}; there is no background timer. An expired
 * window discards its queue.
 *
 * @param <T> queued delivery type
 */
@Slf4j
public class ConnectionRecoveryTracker<T> {

    public static final long DEFAULT_RECOVERY_WINDOW_MS = 30_000L;

    private final Map<String, AccountRecoveryState<T>> accountStates = new HashMap<>();
    private final long windowMs;
    private final LongSupplier clock;

    public ConnectionRecoveryTracker() {
        this(DEFAULT_RECOVERY_WINDOW_MS, System::currentTimeMillis);
    }

    public ConnectionRecoveryTracker(long windowMs, LongSupplier clock) {
        if (windowMs <= 0) {
            throw new IllegalArgumentException("recovery window must be positive: " + windowMs);
        }
        this.windowMs = windowMs;
        this.clock = clock;
    }

    private static final class AccountRecoveryState<T> {
        private boolean recovering;
        private long recoverUntil;
        private List<T> queue = new ArrayList<>();
        private Function<List<T>, CompletableFuture<Void>> flushHandler;
    }

    private AccountRecoveryState<T> getOrCreateState(String accountId) {
        return accountStates.computeIfAbsent(accountId, k -> new AccountRecoveryState<>());
    }

    /**
     * Mark account as recovering; the window starts now.
     */
    public synchronized void setRecovering(String accountId) {
        AccountRecoveryState<T> state = getOrCreateState(accountId);
        state.recovering = true;
        state.recoverUntil = clock.getAsLong() + windowMs;
        log.debug("Account {} recovering until {}", accountId, state.recoverUntil);
    }

    /**
     * Check whether the account is inside its recovery window. A lapsed
     * window flips the account back to idle and drops its queue.
     */
    public synchronized boolean isRecovering(String accountId) {
        AccountRecoveryState<T> state = accountStates.get(accountId);
        if (state == null || !state.recovering) {
            return false;
        }
        if (clock.getAsLong() >= state.recoverUntil) {
            if (!state.queue.isEmpty()) {
                log.warn("Recovery window lapsed for account {}, dropping {} queued deliveries",
                        accountId, state.queue.size());
            }
            state.recovering = false;
            state.queue = new ArrayList<>();
            return false;
        }
        return true;
    }

    /**
     * Queue a delivery while recovering.
     *
     * @return false when the account is not (or no longer) recovering; the
     *         caller must then send directly
     */
    public synchronized boolean queueDelivery(String accountId, T delivery) {
        if (!isRecovering(accountId)) {
            return false;
        }
        accountStates.get(accountId).queue.add(delivery);
        return true;
    }

    /**
     * Register a handler that receives the queue when recovery ends through
     * {@link #clearRecoveringAndFlush(String)}.
     */
    public synchronized void setFlushHandler(String accountId, Function<List<T>, CompletableFuture<Void>> handler) {
        getOrCreateState(accountId).flushHandler = handler;
    }

    /**
     * End recovery and hand the queue, in enqueue order, to the flush handler.
     *
     * @return future completing with the number of flushed deliveries once the
     *         handler has finished; failed if the handler fails
     */
    public CompletableFuture<Integer> clearRecoveringAndFlush(String accountId) {
        List<T> toFlush;
        Function<List<T>, CompletableFuture<Void>> handler;
        synchronized (this) {
            AccountRecoveryState<T> state = accountStates.get(accountId);
            if (state == null) {
                return CompletableFuture.completedFuture(0);
            }
            toFlush = drain(state);
            handler = state.flushHandler;
        }
        int count = toFlush.size();
        if (count == 0 || handler == null) {
            return CompletableFuture.completedFuture(count);
        }
        CompletableFuture<Void> flushed;
        try {
            flushed = handler.apply(List.copyOf(toFlush));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return flushed.thenApply(v -> count);
    }

    /**
     * End recovery and return the queue without invoking the flush handler.
     */
    public synchronized List<T> clearRecovering(String accountId) {
        AccountRecoveryState<T> state = accountStates.get(accountId);
        if (state == null) {
            return List.of();
        }
        return List.copyOf(drain(state));
    }

    public synchronized int getQueuedCount(String accountId) {
        AccountRecoveryState<T> state = accountStates.get(accountId);
        return state != null ? state.queue.size() : 0;
    }

    /** Drop all account state. */
    public synchronized void reset() {
        accountStates.clear();
    }

    public long getWindowMs() {
        return windowMs;
    }

    private List<T> drain(AccountRecoveryState<T> state) {
        state.recovering = false;
        state.recoverUntil = 0;
        List<T> drained = state.queue;
        state.queue = new ArrayList<>();
        return drained;
    }
}
