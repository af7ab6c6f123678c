package de.bsommerfeld.eventpulse.pipeline.schedule;

import de.bsommerfeld.eventpulse.core.domain.Event;
import de.bsommerfeld.eventpulse.core.event.ApplicationEventBus;
import de.bsommerfeld.eventpulse.db.EventRepository;
import de.bsommerfeld.eventpulse.db.InMemoryStorageGateway;
import de.bsommerfeld.eventpulse.db.StorageException;
import de.bsommerfeld.eventpulse.db.WatermarkRepository;
import de.bsommerfeld.eventpulse.pipeline.EventPipeline;
import de.bsommerfeld.eventpulse.pipeline.PipelineResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WatermarkSchedulerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");
    private static final List<String> STATUSES = List.of("approved", "pending");

    private InMemoryStorageGateway storage;
    private EventRepository events;
    private WatermarkRepository watermarks;
    private EventPipeline pipeline;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorageGateway();
        events = new EventRepository(storage);
        watermarks = new WatermarkRepository(storage);
        pipeline = mock(EventPipeline.class);
        when(pipeline.process(any(Event.class), anyBoolean())).thenAnswer(invocation -> new PipelineResult(
                invocation.<Event>getArgument(0).id(), PipelineResult.Outcome.COMPLETED, 1, 0, 1, 0, 1, 0));
    }

    private void saveEvent(String id, String status, Instant createdAt) {
        events.save(new Event(id, "Robotics demo " + id, null, List.of("robotics"), List.of(), status, createdAt));
    }

    private WatermarkScheduler schedulerAt(Instant now, EventRepository eventRepository) {
        return new WatermarkScheduler(eventRepository, watermarks, pipeline, new ApplicationEventBus(),
                Clock.fixed(now, ZoneOffset.UTC), STATUSES,
                new JitteredInterval(Duration.ofSeconds(300), Duration.ZERO));
    }

    private WatermarkScheduler schedulerAt(Instant now) {
        return schedulerAt(now, events);
    }

    @Test
    void runCycle_shouldProcessDiscoveredEventsAndAdvanceWatermarkToCycleStart() {
        saveEvent("E1", "approved", T0);
        saveEvent("E2", "pending", T0.plusSeconds(60));
        saveEvent("E3", "rejected", T0.plusSeconds(120));
        Instant cycleStart = T0.plusSeconds(600);

        schedulerAt(cycleStart).runCycle();

        verify(pipeline).process(argThat(e -> e.id().equals("E1")), eq(true));
        verify(pipeline).process(argThat(e -> e.id().equals("E2")), eq(true));
        verify(pipeline, never()).process(argThat(e -> e.id().equals("E3")), anyBoolean());
        assertEquals(cycleStart, watermarks.read(WatermarkScheduler.WATERMARK_KEY).orElseThrow());
    }

    @Test
    void runCycle_shouldOnlyPickUpEventsNewerThanWatermark() {
        saveEvent("E1", "approved", T0);
        schedulerAt(T0.plusSeconds(600)).runCycle();

        saveEvent("E4", "approved", T0.plusSeconds(900));
        schedulerAt(T0.plusSeconds(1200)).runCycle();

        verify(pipeline, times(1)).process(argThat(e -> e.id().equals("E1")), anyBoolean());
        verify(pipeline, times(1)).process(argThat(e -> e.id().equals("E4")), anyBoolean());
    }

    @Test
    void runCycle_shouldAdvanceWatermarkEvenWhenAnEventFails() {
        saveEvent("E1", "approved", T0);
        saveEvent("E2", "approved", T0.plusSeconds(60));
        when(pipeline.process(argThat(e -> e != null && e.id().equals("E1")), anyBoolean()))
                .thenThrow(new IllegalStateException("boom"));
        Instant cycleStart = T0.plusSeconds(600);

        schedulerAt(cycleStart).runCycle();

        verify(pipeline).process(argThat(e -> e != null && e.id().equals("E2")), anyBoolean());
        assertEquals(cycleStart, watermarks.read(WatermarkScheduler.WATERMARK_KEY).orElseThrow());
    }

    @Test
    void runCycle_shouldKeepWatermarkWhenDiscoveryFails() {
        EventRepository broken = mock(EventRepository.class);
        when(broken.findCreatedSince(any(), any())).thenThrow(new StorageException("connection refused"));

        assertThrows(StorageException.class, () -> schedulerAt(T0, broken).runCycle());
        assertTrue(watermarks.read(WatermarkScheduler.WATERMARK_KEY).isEmpty());
    }

    @Test
    void runCycle_shouldStartFromEpochWithoutStoredWatermark() {
        saveEvent("OLD", "approved", Instant.parse("2001-01-01T00:00:00Z"));

        schedulerAt(T0).runCycle();

        verify(pipeline).process(argThat(e -> e.id().equals("OLD")), eq(true));
    }
}
