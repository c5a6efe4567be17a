package com.example.drivetransfer.source;

import com.example.drivetransfer.model.SourceObject;

import java.util.List;

/**
 * Read side of the transfer: a flat, keyed object store.
 */
public interface ObjectSource {

    /**
     * Lists every object in the bucket eagerly. Directory placeholders are included;
     * callers decide whether to skip them.
     */
    List<SourceObject> listObjects(String bucket);
}
