package com.reqminer.core.engine;

/**
 * Base type of the failures raised by the mining engine.
 */
public class MiningException extends RuntimeException {

    public MiningException(String message) {
        super(message);
    }

    public MiningException(String message, Throwable cause) {
        super(message, cause);
    }
}
