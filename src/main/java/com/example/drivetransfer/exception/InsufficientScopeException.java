package com.example.drivetransfer.exception;

/**
 * Credentials were accepted but lack a required OAuth scope.
 */
public class InsufficientScopeException extends TransferSetupException {

    private static final String SCOPE_MESSAGE = "insufficient authentication scopes";

    public InsufficientScopeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether an HTTP error from a Google API reports missing scopes rather than a plain permission denial.
     */
    public static boolean matches(int statusCode, String message) {
        return statusCode == 403 && message != null && message.toLowerCase().contains(SCOPE_MESSAGE);
    }
}
