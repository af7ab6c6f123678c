package de.bsommerfeld.eventpulse.worker;

import com.google.inject.Inject;
import de.bsommerfeld.eventpulse.core.domain.Event;
import de.bsommerfeld.eventpulse.db.EventRepository;
import de.bsommerfeld.eventpulse.db.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Seeds a handful of campus events and one pending job per event, so a
 * worker started in TEST mode has something to chew on.
 */
public class DemoData {

    private static final Logger LOG = LoggerFactory.getLogger(DemoData.class);

    private final EventRepository events;
    private final JobRepository jobs;
    private final Clock clock;

    @Inject
    public DemoData(EventRepository events, JobRepository jobs, Clock clock) {
        this.events = events;
        this.jobs = jobs;
        this.clock = clock;
    }

    static List<Event> demoEvents(Instant now) {
        return List.of(
                new Event("demo-hackathon", "AI Hackathon", "24 hours of building with free food.",
                        List.of("hackathon", "ai"), List.of(), "approved", now.minus(Duration.ofHours(3))),
                new Event("demo-career-fair", "Spring Career Fair", null,
                        List.of("Career Fair"), List.of(), "approved", now.minus(Duration.ofHours(2))),
                new Event("demo-concert", "Open Air Concert on the Quad", null,
                        List.of("music"), List.of("CampusLife"), "pending", now.minus(Duration.ofHours(1))),
                new Event("demo-private", "Members only mixer", null,
                        List.of(), List.of("private_club", "missing_sub"), "approved", now));
    }

    /** @return number of seeded events */
    public int seed() {
        Instant now = clock.instant();
        List<Event> demo = demoEvents(now);
        for (Event event : demo) {
            events.save(event);
            jobs.enqueue("job-" + event.id(), event.id(), event.createdAt());
        }
        LOG.info("[TEST] Seeded {} demo events with pending jobs", demo.size());
        return demo.size();
    }
}
