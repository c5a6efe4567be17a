package com.example.drivetransfer.model;

public enum TransferOutcome {
    TRANSFERRED,
    SKIPPED_EXISTING,
    SKIPPED_PLACEHOLDER
}
