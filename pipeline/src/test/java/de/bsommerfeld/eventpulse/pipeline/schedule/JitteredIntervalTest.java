package de.bsommerfeld.eventpulse.pipeline.schedule;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class JitteredIntervalTest {

    @Test
    void next_shouldStayWithinTenPercentOfInterval() {
        var interval = new JitteredInterval(Duration.ofSeconds(300), Duration.ofSeconds(60), new Random(42));

        assertEquals(Duration.ofSeconds(30), interval.maxJitter());
        for (int i = 0; i < 1000; i++) {
            Duration next = interval.next();
            assertTrue(next.compareTo(Duration.ofSeconds(300)) >= 0, "below interval: " + next);
            assertTrue(next.compareTo(Duration.ofSeconds(330)) <= 0, "above jitter bound: " + next);
        }
    }

    @Test
    void next_shouldHonorTheCap() {
        var interval = new JitteredInterval(Duration.ofSeconds(3600), Duration.ofSeconds(30), new Random(7));

        assertEquals(Duration.ofSeconds(30), interval.maxJitter());
        for (int i = 0; i < 1000; i++) {
            assertTrue(interval.next().compareTo(Duration.ofSeconds(3630)) <= 0);
        }
    }

    @Test
    void next_shouldReturnPlainIntervalWhenCapIsZero() {
        var interval = new JitteredInterval(Duration.ofSeconds(300), Duration.ZERO);

        assertEquals(Duration.ofSeconds(300), interval.next());
    }

    @Test
    void next_shouldActuallyVary() {
        var interval = new JitteredInterval(Duration.ofSeconds(300), Duration.ofSeconds(30), new Random(1));

        assertNotEquals(interval.next(), interval.next());
    }
}
