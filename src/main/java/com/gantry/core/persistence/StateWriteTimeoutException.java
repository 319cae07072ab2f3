package com.gantry.core.persistence;

/**
 * Raised when a strict write cannot acquire its record lock within the configured wait.
 */
public class StateWriteTimeoutException extends StateStoreException {

    public StateWriteTimeoutException(String message) {
        super(message);
    }
}
