package com.example.drivetransfer.model;

public record DriveEntry(
        String id,
        String name) {
}
