package org.quarry.history.exception;

public interface QuarryException {

    String APPLY_STATE = "ApplyState";
    String STORAGE = "Storage";
}
