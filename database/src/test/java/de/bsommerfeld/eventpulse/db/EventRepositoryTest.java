package de.bsommerfeld.eventpulse.db;

import de.bsommerfeld.eventpulse.core.domain.Event;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class EventRepositoryTest {

    private InMemoryStorageGateway storage;
    private EventRepository repository;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorageGateway();
        repository = new EventRepository(storage);
    }

    @Test
    void findById_shouldMapSerializedTagColumns() {
        storage.insert("event_submissions", Map.of(
                "id", "E1",
                "title", "AI Hackathon",
                "tags", "[\"hackathon\", \" \"]",
                "subreddits", "[]",
                "status", "approved",
                "created_at", "2024-05-01T12:00:00+00:00"));

        Optional<Event> event = repository.findById("E1");

        assertTrue(event.isPresent());
        assertEquals(List.of("hackathon"), event.get().tags());
        assertTrue(event.get().subreddits().isEmpty());
        assertEquals(Instant.parse("2024-05-01T12:00:00Z"), event.get().createdAt());
    }

    @Test
    void findById_shouldReturnEmptyForUnknownEvent() {
        assertTrue(repository.findById("missing").isEmpty());
    }

    @Test
    void findCreatedSince_shouldFilterByStatusAndInstant() {
        repository.save(event("E1", "approved", Instant.parse("2024-05-01T10:00:00Z")));
        repository.save(event("E2", "approved", Instant.parse("2024-05-01T12:00:00Z")));
        repository.save(event("E3", "rejected", Instant.parse("2024-05-01T13:00:00Z")));
        repository.save(event("E4", "pending", Instant.parse("2024-05-01T14:00:00Z")));

        List<Event> events = repository.findCreatedSince(Instant.parse("2024-05-01T12:00:00Z"),
                List.of("approved", "pending"));

        assertEquals(List.of("E2", "E4"), events.stream().map(Event::id).collect(Collectors.toList()));
    }

    @Test
    void toEvent_shouldSkipRowsWithoutId() {
        assertNull(EventRepository.toEvent(Map.of("title", "orphan")));
    }

    @Test
    void save_shouldThrowOnDuplicateId() {
        repository.save(event("E1", "approved", Instant.now()));

        assertThrows(StorageException.class, () -> repository.save(event("E1", "approved", Instant.now())));
    }

    private static Event event(String id, String status, Instant createdAt) {
        return new Event(id, "Title " + id, null, List.of("ai"), List.of(), status, createdAt);
    }
}
