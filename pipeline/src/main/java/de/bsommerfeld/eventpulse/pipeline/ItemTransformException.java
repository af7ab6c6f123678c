package de.bsommerfeld.eventpulse.pipeline;

/**
 * A fetched item is too malformed to become a match record. The caller drops
 * the item and carries on with the rest of the batch.
 */
public class ItemTransformException extends RuntimeException {

    public ItemTransformException(String message) {
        super(message);
    }
}
