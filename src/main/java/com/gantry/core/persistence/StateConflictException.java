package com.gantry.core.persistence;

public class StateConflictException extends StateStoreException {

    public StateConflictException(String message) {
        super(message);
    }
}
