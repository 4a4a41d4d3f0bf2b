package org.quarry.history.exception;

/**
 * Raised at startup when the apply-state handlers supplied by the host are inconsistent.
 */
public class ApplyStateException extends AbstractQuarryException {
    public ApplyStateException(String message) {
        super(message);
    }

    @Override
    public String getError() {
        return QuarryException.APPLY_STATE;
    }
}
