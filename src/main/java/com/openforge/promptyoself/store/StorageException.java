package com.openforge.promptyoself.store;

/**
 * A persistence fault (I/O, constraint violation, lock timeout) surfaced by
 * {@link ReminderStore}.  Never swallowed by the store; callers decide recovery.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
