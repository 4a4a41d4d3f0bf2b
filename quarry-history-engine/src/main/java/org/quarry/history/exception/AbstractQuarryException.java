package org.quarry.history.exception;

public abstract class AbstractQuarryException extends RuntimeException {

    public AbstractQuarryException(String message) {
        super(message);
    }

    public AbstractQuarryException(String message, Throwable cause) {
        super(message, cause);
    }

    public AbstractQuarryException(Throwable cause) {
        super(cause);
    }

    public abstract String getError();

}
