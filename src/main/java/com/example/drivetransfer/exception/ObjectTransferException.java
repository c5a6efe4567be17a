package com.example.drivetransfer.exception;

import lombok.Getter;

/**
 * Failure of a single object's transfer. Local to its worker; never aborts the run.
 */
@Getter
public class ObjectTransferException extends RuntimeException {

    private final String key;

    public ObjectTransferException(String key, Throwable cause) {
        super("Error processing " + key + ": " + cause.getMessage(), cause);
        this.key = key;
    }
}
