package com.example.drivetransfer.model;

import java.io.IOException;

@FunctionalInterface
public interface ObjectReader {

    /**
     * Opens a stream over the contents of one source object.
     */
    ObjectPayload open() throws IOException;
}
