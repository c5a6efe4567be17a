package com.example.drivetransfer.model;

/**
 * One object listed from the source bucket.
 * Keys are '/'-delimited; a key ending in '/' is a directory placeholder with no payload.
 */
public record SourceObject(
        String key,
        long size,
        String contentType, // hint from the listing, may be null
        ObjectReader reader) {

    public static final String SEPARATOR = "/";

    public boolean isDirectoryPlaceholder() {
        return key.endsWith(SEPARATOR);
    }
}
