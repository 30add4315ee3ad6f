package com.signalarena.common.exception;

/**
 * An outcome report referenced a round that is not in the session history, or a
 * round whose winner does not match the reporting agent.
 */
public class UnknownRoundException extends RuntimeException {

    private final long epoch;

    public UnknownRoundException(long epoch, String message) {
        super("[epoch=" + epoch + "] " + message);
        this.epoch = epoch;
    }

    public long getEpoch() {
        return epoch;
    }
}
