package de.bsommerfeld.eventpulse.reddit;

import de.bsommerfeld.eventpulse.core.domain.RawItem;
import de.bsommerfeld.eventpulse.core.result.CallStatus;

import java.util.List;

/**
 * Outcome of fetching one target: the collected items on success, the
 * failing status and its detail otherwise. A failed target never carries
 * items.
 */
public record TargetFetch(String target, CallStatus status, List<RawItem> items, String detail) {

    public TargetFetch {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static TargetFetch ok(String target, List<RawItem> items) {
        return new TargetFetch(target, CallStatus.OK, items, null);
    }

    public static TargetFetch failed(String target, CallStatus status, String detail) {
        return new TargetFetch(target, status, List.of(), detail);
    }

    public boolean isOk() {
        return status == CallStatus.OK;
    }
}
