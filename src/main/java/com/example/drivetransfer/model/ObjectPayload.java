package com.example.drivetransfer.model;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * An open stream over one source object's bytes. The caller closes it.
 */
public record ObjectPayload(
        InputStream content,
        String contentType // as reported by the read call, may be null
) implements Closeable {

    @Override
    public void close() throws IOException {
        content.close();
    }
}
