package com.example.drivetransfer.transfer;

import com.example.drivetransfer.destination.DriveClient;
import com.example.drivetransfer.model.DriveEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Resolve-or-create for a single folder segment.
 */
@Component
@Slf4j
public class FolderResolver {

    /**
     * Returns the id of the folder named {@code name} under {@code parentId}, creating it on a miss.
     * When several folders match, the first one listed wins; duplicates are left as they are.
     *
     * @param parentId parent folder id, or null to search without a parent constraint and create at the top level
     */
    public String resolveOrCreate(DriveClient client, String name, String parentId) throws IOException {
        List<DriveEntry> matches = client.findFolders(name, parentId);
        if (!matches.isEmpty()) {
            if (matches.size() > 1) {
                log.warn("Found {} folders named '{}' under {}, using {}", matches.size(), name, parentId,
                        matches.get(0).id());
            }
            return matches.get(0).id();
        }

        String folderId = client.createFolder(name, parentId);
        log.info("Created folder '{}' ({})", name, folderId);
        return folderId;
    }
}
