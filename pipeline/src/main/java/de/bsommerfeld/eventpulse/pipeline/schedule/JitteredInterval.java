package de.bsommerfeld.eventpulse.pipeline.schedule;

import java.time.Duration;
import java.util.Random;

/**
 * Poll interval plus a random delay, so several workers started together
 * drift apart instead of hitting Reddit in lockstep. The jitter is uniform in
 * {@code [0, min(interval / 10, cap)]}.
 */
public final class JitteredInterval {

    private final Duration interval;
    private final long maxJitterMillis;
    private final Random random;

    public JitteredInterval(Duration interval, Duration cap) {
        this(interval, cap, new Random());
    }

    JitteredInterval(Duration interval, Duration cap, Random random) {
        this.interval = interval;
        this.maxJitterMillis = Math.max(0, Math.min(interval.toMillis() / 10, cap.toMillis()));
        this.random = random;
    }

    public Duration next() {
        if (maxJitterMillis == 0)
            return interval;
        long jitter = Math.round(random.nextDouble() * maxJitterMillis);
        return interval.plusMillis(jitter);
    }

    public Duration maxJitter() {
        return Duration.ofMillis(maxJitterMillis);
    }
}
