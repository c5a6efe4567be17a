package com.example.drivetransfer.source;

import com.example.drivetransfer.model.ObjectPayload;
import com.example.drivetransfer.model.SourceObject;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.Channels;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists and reads objects from a Google Cloud Storage bucket.
 */
@RequiredArgsConstructor
@Slf4j
public class GcsObjectSource implements ObjectSource {

    private final Storage storage;

    @Override
    public List<SourceObject> listObjects(String bucket) {
        List<SourceObject> objects = new ArrayList<>();
        for (Blob blob : storage.list(bucket).iterateAll()) {
            long size = blob.getSize() == null ? 0L : blob.getSize();
            objects.add(new SourceObject(blob.getName(), size, blob.getContentType(), () -> open(blob)));
        }

        log.info("Listed {} objects in GCS bucket: {}", objects.size(), bucket);
        return objects;
    }

    private static ObjectPayload open(Blob blob) throws IOException {
        try {
            return new ObjectPayload(Channels.newInputStream(blob.reader()), blob.getContentType());
        } catch (StorageException e) {
            throw new IOException("Failed to download gs://" + blob.getBucket() + "/" + blob.getName(), e);
        }
    }
}
