package com.gantry.executor;

public class ExecutorStartException extends RuntimeException {

    public ExecutorStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
