package com.example.drivetransfer.transfer;

import com.example.drivetransfer.destination.DriveClient;
import com.example.drivetransfer.exception.ObjectTransferException;
import com.example.drivetransfer.model.ObjectPayload;
import com.example.drivetransfer.model.SourceObject;
import com.example.drivetransfer.model.TransferOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;

/**
 * Copies one source object into the destination tree. Each worker owns its {@link DriveClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class ObjectTransferWorker {

    static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final DriveClient driveClient;

    /**
     * Resolves the object's parent folder, skips it if a same-named entry already exists there,
     * and otherwise streams its bytes across. Existence is checked by name only.
     *
     * @throws ObjectTransferException carrying the object key when any remote step fails
     */
    public TransferOutcome transfer(SourceObject object, String rootId, FolderPathCache folderCache) {
        String key = object.key();
        if (object.isDirectoryPlaceholder()) {
            log.debug("Skipping directory placeholder: {}", key);
            return TransferOutcome.SKIPPED_PLACEHOLDER;
        }

        List<String> parts = Arrays.asList(key.split(SourceObject.SEPARATOR, -1));
        String fileName = parts.get(parts.size() - 1);
        List<String> folderPath = parts.subList(0, parts.size() - 1);

        try {
            // 1. Ensure folders exist
            String parentId = folderCache.getOrCreate(driveClient, rootId, folderPath);

            // 2. Existence check
            if (!driveClient.findEntries(fileName, parentId).isEmpty()) {
                log.debug("{} already exists in destination. Skipping.", key);
                return TransferOutcome.SKIPPED_EXISTING;
            }

            // 3. Stream from source to destination
            try (ObjectPayload payload = object.reader().open()) {
                String contentType = resolveContentType(payload, object);
                driveClient.createFile(fileName, parentId, contentType, payload.content(), object.size());
                log.debug("Transferred {} ({} bytes, {})", key, object.size(), contentType);
            }
            return TransferOutcome.TRANSFERRED;
        } catch (Exception e) {
            throw new ObjectTransferException(key, e);
        }
    }

    private static String resolveContentType(ObjectPayload payload, SourceObject object) {
        if (payload.contentType() != null && !payload.contentType().isBlank()) {
            return payload.contentType();
        }
        if (object.contentType() != null && !object.contentType().isBlank()) {
            return object.contentType();
        }
        return DEFAULT_CONTENT_TYPE;
    }
}
