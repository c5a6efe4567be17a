package com.example.drivetransfer.destination;

import com.example.drivetransfer.model.DriveEntry;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Write side of the transfer: a hierarchical document store addressed by opaque ids.
 * Instances are not assumed to be safe for concurrent use; build one per worker
 * through {@link DriveClientFactory}.
 */
public interface DriveClient {

    /**
     * Non-trashed folders named exactly {@code name}. A null {@code parentId} drops the parent
     * constraint.
     */
    List<DriveEntry> findFolders(String name, String parentId) throws IOException;

    /**
     * Non-trashed entries of any type named exactly {@code name} under {@code parentId}.
     */
    List<DriveEntry> findEntries(String name, String parentId) throws IOException;

    String createFolder(String name, String parentId) throws IOException;

    /**
     * Uploads {@code length} bytes read from {@code content}. The stream is not closed.
     */
    String createFile(String name, String parentId, String contentType, InputStream content, long length)
            throws IOException;
}
