package com.example.drivetransfer.cli;

import java.util.List;

public record SetupFailure(
        Category category,
        List<String> guidance) {

    public enum Category {
        MISSING_CREDENTIALS,
        INSUFFICIENT_SCOPE,
        PROJECT_NOT_DETERMINED
    }
}
