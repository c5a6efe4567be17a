package com.example.drivetransfer.exception;

public class MissingCredentialsException extends TransferSetupException {

    public MissingCredentialsException(String message) {
        super(message);
    }

    public MissingCredentialsException(String message, Throwable cause) {
        super(message, cause);
    }
}
