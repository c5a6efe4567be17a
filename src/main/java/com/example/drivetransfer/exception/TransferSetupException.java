package com.example.drivetransfer.exception;

/**
 * Fatal error raised before any object is dispatched. Aborts the run.
 */
public class TransferSetupException extends RuntimeException {

    public TransferSetupException(String message) {
        super(message);
    }

    public TransferSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
