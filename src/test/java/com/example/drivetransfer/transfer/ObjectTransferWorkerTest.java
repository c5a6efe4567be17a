package com.example.drivetransfer.transfer;

import com.example.drivetransfer.destination.DriveClient;
import com.example.drivetransfer.exception.ObjectTransferException;
import com.example.drivetransfer.model.DriveEntry;
import com.example.drivetransfer.model.ObjectPayload;
import com.example.drivetransfer.model.ObjectReader;
import com.example.drivetransfer.model.SourceObject;
import com.example.drivetransfer.model.TransferOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ObjectTransferWorkerTest {

    private static final String ROOT_ID = "root_123";

    @Mock
    private DriveClient driveClient;

    @Mock
    private ObjectReader reader;

    private FolderPathCache folderCache;
    private ObjectTransferWorker worker;

    @BeforeEach
    void setUp() {
        folderCache = new FolderPathCache(new FolderResolver());
        worker = new ObjectTransferWorker(driveClient);
    }

    private static ObjectPayload payload(byte[] bytes, String contentType) {
        return new ObjectPayload(new ByteArrayInputStream(bytes), contentType);
    }

    @Test
    void transfer_SingleFileInFolder() throws Exception {
        // Arrange
        SourceObject object = new SourceObject("folder/file.txt", 5, "text/plain", reader);
        when(driveClient.findFolders("folder", ROOT_ID)).thenReturn(Collections.emptyList());
        when(driveClient.createFolder("folder", ROOT_ID)).thenReturn("folder_123");
        when(driveClient.findEntries("file.txt", "folder_123")).thenReturn(Collections.emptyList());
        ObjectPayload payload = payload("hello".getBytes(), "text/plain");
        when(reader.open()).thenReturn(payload);

        // Act
        TransferOutcome outcome = worker.transfer(object, ROOT_ID, folderCache);

        // Assert
        assertEquals(TransferOutcome.TRANSFERRED, outcome);
        verify(driveClient).createFolder("folder", ROOT_ID);
        verify(driveClient).createFile("file.txt", "folder_123", "text/plain", payload.content(), 5L);
    }

    @Test
    void transfer_TopLevelObjectGoesUnderRoot() throws Exception {
        SourceObject object = new SourceObject("a.txt", 1, null, reader);
        when(driveClient.findEntries("a.txt", ROOT_ID)).thenReturn(Collections.emptyList());
        when(reader.open()).thenReturn(payload(new byte[]{1}, "image/png"));

        assertEquals(TransferOutcome.TRANSFERRED, worker.transfer(object, ROOT_ID, folderCache));

        verify(driveClient, never()).findFolders(anyString(), any());
        verify(driveClient).createFile(eq("a.txt"), eq(ROOT_ID), eq("image/png"), any(InputStream.class), eq(1L));
    }

    @Test
    void transfer_DirectoryPlaceholderMakesNoCalls() {
        SourceObject object = new SourceObject("folder/sub/", 0, null, reader);

        assertEquals(TransferOutcome.SKIPPED_PLACEHOLDER, worker.transfer(object, ROOT_ID, folderCache));

        verifyNoInteractions(driveClient, reader);
    }

    @Test
    void transfer_ExistingFileIsSkipped() throws Exception {
        SourceObject object = new SourceObject("report.csv", 10, "text/csv", reader);
        when(driveClient.findEntries("report.csv", ROOT_ID)).thenReturn(List.of(new DriveEntry("f_1", "report.csv")));

        assertEquals(TransferOutcome.SKIPPED_EXISTING, worker.transfer(object, ROOT_ID, folderCache));

        verifyNoInteractions(reader);
        verify(driveClient, never()).createFile(anyString(), anyString(), anyString(), any(), anyLong());
    }

    @Test
    void transfer_ContentTypeFallsBackToListingHint() throws Exception {
        SourceObject object = new SourceObject("doc.pdf", 3, "application/pdf", reader);
        when(driveClient.findEntries("doc.pdf", ROOT_ID)).thenReturn(Collections.emptyList());
        when(reader.open()).thenReturn(payload(new byte[3], null));

        worker.transfer(object, ROOT_ID, folderCache);

        verify(driveClient).createFile(eq("doc.pdf"), eq(ROOT_ID), eq("application/pdf"), any(), eq(3L));
    }

    @Test
    void transfer_ContentTypeDefaultsToOctetStream() throws Exception {
        SourceObject object = new SourceObject("blob.bin", 3, null, reader);
        when(driveClient.findEntries("blob.bin", ROOT_ID)).thenReturn(Collections.emptyList());
        when(reader.open()).thenReturn(payload(new byte[3], ""));

        worker.transfer(object, ROOT_ID, folderCache);

        verify(driveClient).createFile(eq("blob.bin"), eq(ROOT_ID), eq(ObjectTransferWorker.DEFAULT_CONTENT_TYPE),
                any(), eq(3L));
    }

    @Test
    void transfer_StreamClosedAfterUpload() throws Exception {
        SourceObject object = new SourceObject("big.iso", 4L * 1024 * 1024 * 1024, null, reader);
        InputStream stream = mock(InputStream.class);
        when(driveClient.findEntries("big.iso", ROOT_ID)).thenReturn(Collections.emptyList());
        when(reader.open()).thenReturn(new ObjectPayload(stream, "application/x-iso9660-image"));

        worker.transfer(object, ROOT_ID, folderCache);

        verify(driveClient).createFile("big.iso", ROOT_ID, "application/x-iso9660-image", stream, 4L * 1024 * 1024 * 1024);
        verify(stream).close();
    }

    @Test
    void transfer_DownloadFailureCarriesKey() throws Exception {
        // Arrange
        SourceObject object = new SourceObject("a/broken.txt", 3, null, reader);
        when(driveClient.findFolders("a", ROOT_ID)).thenReturn(List.of(new DriveEntry("a_1", "a")));
        when(driveClient.findEntries("broken.txt", "a_1")).thenReturn(Collections.emptyList());
        IOException cause = new IOException("connection reset");
        when(reader.open()).thenThrow(cause);

        // Act & Assert
        ObjectTransferException exception = assertThrows(ObjectTransferException.class,
                () -> worker.transfer(object, ROOT_ID, folderCache));

        assertEquals("a/broken.txt", exception.getKey());
        assertSame(cause, exception.getCause());
        verify(driveClient, never()).createFile(anyString(), anyString(), anyString(), any(), anyLong());
    }

    @Test
    void transfer_UploadFailureIsNotRetriedAndClosesStream() throws Exception {
        SourceObject object = new SourceObject("x.txt", 1, null, reader);
        InputStream stream = mock(InputStream.class);
        when(driveClient.findEntries("x.txt", ROOT_ID)).thenReturn(Collections.emptyList());
        when(reader.open()).thenReturn(new ObjectPayload(stream, null));
        when(driveClient.createFile(anyString(), anyString(), anyString(), any(), anyLong()))
                .thenThrow(new IOException("503"));

        assertThrows(ObjectTransferException.class, () -> worker.transfer(object, ROOT_ID, folderCache));

        verify(driveClient, times(1)).createFile(anyString(), anyString(), anyString(), any(), anyLong());
        verify(stream).close();
    }
}
