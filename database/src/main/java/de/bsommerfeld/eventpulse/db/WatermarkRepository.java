package de.bsommerfeld.eventpulse.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.eventpulse.core.result.CallResult;
import de.bsommerfeld.eventpulse.core.result.CallStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists named discovery watermarks in {@code worker_state} so that several
 * worker instances, and restarts, resume from the same point.
 */
@Singleton
public class WatermarkRepository {

    private static final Logger LOG = LoggerFactory.getLogger(WatermarkRepository.class);

    static final String TABLE = "worker_state";

    private final StorageGateway storage;

    @Inject
    public WatermarkRepository(StorageGateway storage) {
        this.storage = storage;
    }

    public Optional<Instant> read(String key) {
        List<Map<String, Object>> rows = storage.select(TABLE, Query.where().eq("key", key).limit(1));
        if (rows.isEmpty())
            return Optional.empty();
        Instant value = Rows.instant(rows.get(0), "value");
        if (value == null) {
            LOG.warn("Watermark '{}' holds an unreadable value: {}", key, rows.get(0).get("value"));
        }
        return Optional.ofNullable(value);
    }

    /**
     * Update-then-insert. A concurrent insert by another worker surfaces as
     * {@code DUPLICATE} and is resolved by one more update.
     *
     * @throws StorageException if the value could not be written
     */
    public void write(String key, Instant value, Instant now) {
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("value", value);
        patch.put("updated_at", now);

        List<Query.Filter> byKey = List.of(Query.Filter.eq("key", key));
        CallResult<Integer> updated = storage.update(TABLE, patch, byKey);
        if (updated.isOk() && updated.value() > 0)
            return;

        if (updated.isOk()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("key", key);
            row.putAll(patch);
            CallResult<Integer> inserted = storage.insert(TABLE, row);
            if (inserted.isOk())
                return;
            if (inserted.status() == CallStatus.DUPLICATE) {
                updated = storage.update(TABLE, patch, byKey);
                if (updated.isOk())
                    return;
            } else {
                updated = inserted;
            }
        }
        throw new StorageException("Failed to write watermark '" + key + "' (" + updated.status()
                + "): " + updated.detail());
    }
}
