package dev.leadtracker.store;

/**
 * I/O failure while reading or persisting tracked state.
 * <p>
 * The in-memory value is not rolled back; treat the affected job as unknown and re-read it.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
