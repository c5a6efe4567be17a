package com.example.drivetransfer.model;

public record TransferResult(
        String key,
        TransferOutcome outcome, // null when failed
        Throwable error) {

    public static TransferResult completed(String key, TransferOutcome outcome) {
        return new TransferResult(key, outcome, null);
    }

    public static TransferResult failed(String key, Throwable error) {
        return new TransferResult(key, null, error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
