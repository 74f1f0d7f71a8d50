package com.reqminer.core.engine;

/**
 * Thrown when a mining request is rejected before anything runs or is persisted.
 */
public class InvalidMiningRequestException extends MiningException {

    public InvalidMiningRequestException(String message) {
        super(message);
    }
}
