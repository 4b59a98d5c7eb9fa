package com.example.salesmart.llm;

/**
 * Lets the caller stop a model call between attempts. Checked before every
 * attempt; backoff waits never outlast {@link #remainingMs()}.
 */
public interface ModelCallGuard {

    ModelCallGuard NONE = new ModelCallGuard() {
        @Override
        public void beforeAttempt() {
        }

        @Override
        public boolean exhausted() {
            return false;
        }

        @Override
        public long remainingMs() {
            return Long.MAX_VALUE;
        }
    };

    /** Throws the caller's own stop exception when no further attempt may start. */
    void beforeAttempt();

    boolean exhausted();

    long remainingMs();
}
