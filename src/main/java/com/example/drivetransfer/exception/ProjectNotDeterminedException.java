package com.example.drivetransfer.exception;

public class ProjectNotDeterminedException extends TransferSetupException {

    public ProjectNotDeterminedException(String message) {
        super(message);
    }
}
