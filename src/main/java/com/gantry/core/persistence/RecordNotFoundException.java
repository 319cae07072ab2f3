package com.gantry.core.persistence;

public class RecordNotFoundException extends StateStoreException {

    public RecordNotFoundException(String message) {
        super(message);
    }
}
