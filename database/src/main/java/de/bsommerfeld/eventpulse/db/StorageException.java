package de.bsommerfeld.eventpulse.db;

/**
 * Unchecked failure of a storage read or of a write whose outcome the caller
 * cannot handle locally.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
