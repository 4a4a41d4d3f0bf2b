package org.quarry.history.exception;

/**
 * The backing store was unreachable or a statement failed.
 */
public class StorageException extends AbstractQuarryException {
    public StorageException(Throwable cause) {
        super(cause);
    }

    @Override
    public String getError() {
        return QuarryException.STORAGE;
    }

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
