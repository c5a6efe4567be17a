package com.example.drivetransfer.destination;

import com.example.drivetransfer.exception.InsufficientScopeException;
import com.example.drivetransfer.model.DriveEntry;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.googleapis.services.AbstractGoogleClientRequest;
import com.google.api.client.http.InputStreamContent;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.model.File;
import com.google.api.services.drive.model.FileList;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;

/**
 * {@link DriveClient} backed by the Drive v3 API.
 */
@RequiredArgsConstructor
@Slf4j
public class GoogleDriveClient implements DriveClient {

    private static final String LIST_FIELDS = "files(id, name)";

    private final Drive drive;

    @Override
    public List<DriveEntry> findFolders(String name, String parentId) throws IOException {
        return list(DriveQueries.folderQuery(name, parentId));
    }

    @Override
    public List<DriveEntry> findEntries(String name, String parentId) throws IOException {
        return list(DriveQueries.entryQuery(name, parentId));
    }

    private List<DriveEntry> list(String query) throws IOException {
        FileList result = execute(drive.files().list()
                .setQ(query)
                .setFields(LIST_FIELDS));

        List<File> files = result.getFiles();
        if (files == null) {
            return Collections.emptyList();
        }
        return files.stream()
                .map(file -> new DriveEntry(file.getId(), file.getName()))
                .toList();
    }

    @Override
    public String createFolder(String name, String parentId) throws IOException {
        File metadata = new File()
                .setName(name)
                .setMimeType(DriveQueries.FOLDER_MIME_TYPE);
        if (parentId != null) {
            metadata.setParents(List.of(parentId));
        }

        File folder = execute(drive.files().create(metadata)
                .setFields("id"));
        log.debug("Created Drive folder '{}' ({}) under {}", name, folder.getId(), parentId);
        return folder.getId();
    }

    @Override
    public String createFile(String name, String parentId, String contentType, InputStream content, long length)
            throws IOException {
        File metadata = new File()
                .setName(name)
                .setParents(List.of(parentId));

        // Media uploads are resumable by default
        InputStreamContent media = new InputStreamContent(contentType, content)
                .setLength(length)
                .setCloseInputStream(false);
        File file = execute(drive.files().create(metadata, media)
                .setFields("id"));
        return file.getId();
    }

    private static <T> T execute(AbstractGoogleClientRequest<T> request) throws IOException {
        try {
            return request.execute();
        } catch (GoogleJsonResponseException e) {
            if (InsufficientScopeException.matches(e.getStatusCode(), e.getMessage())) {
                throw new InsufficientScopeException("Drive credentials lack the required scope", e);
            }
            throw e;
        }
    }
}
