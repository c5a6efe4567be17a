package com.example.drivetransfer.transfer;

import com.example.drivetransfer.destination.DriveClient;
import lombok.RequiredArgsConstructor;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maps a slash-joined directory path (relative to the run's root folder) to its Drive folder id.
 * One instance is shared by every worker of a run.
 *
 * Entries are written once and never re-verified. Misses are resolved one segment at a time under a
 * single lock, so each prefix costs at most one remote resolve-or-create for the whole run. The lock is
 * held across that remote call, which serializes folder creation; uploads never take it.
 */
@RequiredArgsConstructor
public class FolderPathCache {

    private final FolderResolver folderResolver;

    private final Map<String, String> folderIds = new ConcurrentHashMap<>();

    private final Lock lock = new ReentrantLock();

    /**
     * Walks {@code segments} from {@code rootId}, creating missing folders, and returns the id of the
     * deepest one. An empty list resolves to {@code rootId}.
     */
    public String getOrCreate(DriveClient client, String rootId, List<String> segments) throws IOException {
        String parentId = rootId;
        String path = "";

        for (String segment : segments) {
            path = path.isEmpty() ? segment : path + "/" + segment;

            String cached = folderIds.get(path);
            if (cached != null) {
                parentId = cached;
                continue;
            }

            lock.lock();
            try {
                // Another worker may have resolved it while we waited
                cached = folderIds.get(path);
                if (cached == null) {
                    cached = folderResolver.resolveOrCreate(client, segment, parentId);
                    folderIds.put(path, cached);
                }
            } finally {
                lock.unlock();
            }
            parentId = cached;
        }

        return parentId;
    }

    public int size() {
        return folderIds.size();
    }
}
