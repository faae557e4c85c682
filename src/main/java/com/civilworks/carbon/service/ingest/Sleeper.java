package com.civilworks.carbon.service.ingest;

import java.time.Duration;

/**
 * Blocking wait used for retry backoff and inter-page pacing. Injected so tests can record
 * the requested waits instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration);

    static Sleeper threadSleep() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) return;
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting " + duration, ie);
            }
        };
    }
}
