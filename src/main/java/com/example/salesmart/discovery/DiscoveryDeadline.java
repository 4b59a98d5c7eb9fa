package com.example.salesmart.discovery;

import java.time.Duration;

import com.example.salesmart.llm.ModelCallGuard;

/**
 * Run-wide deadline plus a cancel flag, passed to every stage.
 */
public final class DiscoveryDeadline {

    private final long deadlineMs;
    private volatile boolean cancelled;

    private DiscoveryDeadline(long deadlineMs) {
        this.deadlineMs = deadlineMs;
    }

    public static DiscoveryDeadline after(Duration timeout) {
        return new DiscoveryDeadline(System.currentTimeMillis() + timeout.toMillis());
    }

    public static DiscoveryDeadline unbounded() {
        return new DiscoveryDeadline(Long.MAX_VALUE);
    }

    public void cancel() {
        cancelled = true;
    }

    public long remainingMs() {
        return Math.max(0, deadlineMs - System.currentTimeMillis());
    }

    public boolean exhausted() {
        return cancelled || remainingMs() <= 0;
    }

    /** Caps a per-call timeout at the time left in the run. */
    public Duration cap(Duration callTimeout) {
        long remaining = remainingMs();
        return callTimeout.toMillis() <= remaining ? callTimeout : Duration.ofMillis(remaining);
    }

    public void check(DiscoveryStage stage) {
        if (cancelled) {
            throw new DiscoveryCancelledException("Discovery cancelled during " + stage);
        }
        if (remainingMs() <= 0) {
            throw new DiscoveryCancelledException("Discovery deadline exceeded during " + stage);
        }
    }

    /** Model calls made during {@code stage} stop retrying once this deadline is up. */
    public ModelCallGuard guard(DiscoveryStage stage) {
        return new ModelCallGuard() {
            @Override
            public void beforeAttempt() {
                check(stage);
            }

            @Override
            public boolean exhausted() {
                return DiscoveryDeadline.this.exhausted();
            }

            @Override
            public long remainingMs() {
                return DiscoveryDeadline.this.remainingMs();
            }
        };
    }
}
