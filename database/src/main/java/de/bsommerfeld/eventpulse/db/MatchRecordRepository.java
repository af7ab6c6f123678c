package de.bsommerfeld.eventpulse.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.eventpulse.core.domain.MatchKind;
import de.bsommerfeld.eventpulse.core.domain.MatchRecord;
import de.bsommerfeld.eventpulse.core.result.CallResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Access to stored matches in {@code reddit_comments}. Records are
 * insert-only; {@code (event_id, reddit_id)} is unique.
 */
@Singleton
public class MatchRecordRepository {

    static final String TABLE = "reddit_comments";

    private final StorageGateway storage;

    @Inject
    public MatchRecordRepository(StorageGateway storage) {
        this.storage = storage;
    }

    public boolean existsForEvent(String eventId) {
        return !storage.select(TABLE, Query.where().eq("event_id", eventId).limit(1)).isEmpty();
    }

    /**
     * @return {@code OK} on insert, {@code DUPLICATE} if the pair already
     *         exists, anything else is a failure the caller may retry
     */
    public CallResult<Integer> insert(MatchRecord record) {
        return storage.insert(TABLE, toRow(record));
    }

    public List<MatchRecord> findByEvent(String eventId) {
        List<Map<String, Object>> rows = storage.select(TABLE, Query.where()
                .eq("event_id", eventId)
                .orderBy("created_utc", true));
        List<MatchRecord> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            records.add(toRecord(row));
        }
        return records;
    }

    static Map<String, Object> toRow(MatchRecord record) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("event_id", record.eventId());
        row.put("reddit_id", record.externalId());
        row.put("subreddit", record.source());
        row.put("type", record.kind().value());
        row.put("title", record.title());
        row.put("body", record.body());
        row.put("author", record.author());
        row.put("sentiment", record.sentiment());
        row.put("created_utc", record.observedAt());
        row.put("payload", record.extra());
        return row;
    }

    static MatchRecord toRecord(Map<String, Object> row) {
        return new MatchRecord(
                Rows.string(row, "event_id"),
                Rows.string(row, "reddit_id"),
                Rows.string(row, "subreddit"),
                MatchKind.fromValue(Rows.string(row, "type")),
                Rows.string(row, "title"),
                Rows.string(row, "body"),
                Rows.string(row, "author"),
                Rows.decimal(row, "sentiment", 0.0),
                Rows.instant(row, "created_utc"),
                Rows.json(row, "payload"));
    }
}
