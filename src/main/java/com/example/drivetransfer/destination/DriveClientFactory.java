package com.example.drivetransfer.destination;

@FunctionalInterface
public interface DriveClientFactory {

    /**
     * Builds a new, independent client over the shared credentials.
     */
    DriveClient create();
}
