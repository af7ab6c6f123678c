package de.bsommerfeld.eventpulse.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.eventpulse.core.domain.Event;
import de.bsommerfeld.eventpulse.core.result.CallResult;
import de.bsommerfeld.eventpulse.core.util.StringLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to {@code event_submissions}. The worker never writes events.
 */
@Singleton
public class EventRepository {

    private static final Logger LOG = LoggerFactory.getLogger(EventRepository.class);

    static final String TABLE = "event_submissions";

    private final StorageGateway storage;

    @Inject
    public EventRepository(StorageGateway storage) {
        this.storage = storage;
    }

    public Optional<Event> findById(String id) {
        List<Map<String, Object>> rows = storage.select(TABLE, Query.where().eq("id", id).limit(1));
        if (rows.isEmpty())
            return Optional.empty();
        return Optional.ofNullable(toEvent(rows.get(0)));
    }

    /**
     * Events created at or after {@code since} whose status is one of
     * {@code statuses}, oldest first.
     */
    public List<Event> findCreatedSince(Instant since, List<String> statuses) {
        List<Map<String, Object>> rows = storage.select(TABLE, Query.where()
                .gte("created_at", since)
                .in("status", statuses)
                .orderBy("created_at", true));

        List<Event> events = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Event event = toEvent(row);
            if (event != null)
                events.add(event);
        }
        return events;
    }

    /** Maps a row to an {@link Event}; rows without an id are skipped with a warning. */
    static Event toEvent(Map<String, Object> row) {
        String id = Rows.string(row, "id");
        if (id == null || id.isBlank()) {
            LOG.warn("Skipping event row without id: {}", row);
            return null;
        }
        return new Event(
                id,
                Rows.string(row, "title"),
                Rows.string(row, "description"),
                StringLists.parse(row.get("tags")),
                StringLists.parse(row.get("subreddits")),
                Rows.string(row, "status"),
                Rows.instant(row, "created_at"));
    }

    /** Writes an event row. Only used to seed demo data in TEST mode. */
    public void save(Event event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", event.id());
        row.put("title", event.title());
        row.put("description", event.description());
        row.put("tags", event.tags());
        row.put("subreddits", event.subreddits());
        row.put("status", event.status());
        row.put("created_at", event.createdAt());
        CallResult<Integer> result = storage.insert(TABLE, row);
        if (!result.isOk()) {
            throw new StorageException("Failed to save event " + event.id() + ": " + result.detail());
        }
    }
}
