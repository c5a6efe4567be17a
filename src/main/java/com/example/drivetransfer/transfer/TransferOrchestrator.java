package com.example.drivetransfer.transfer;

import com.example.drivetransfer.destination.DriveClient;
import com.example.drivetransfer.destination.DriveClientFactory;
import com.example.drivetransfer.model.SourceObject;
import com.example.drivetransfer.model.TransferOutcome;
import com.example.drivetransfer.model.TransferResult;
import com.example.drivetransfer.model.TransferSummary;
import com.example.drivetransfer.source.ObjectSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

@Service
@RequiredArgsConstructor
@Slf4j
public class TransferOrchestrator {

    private final RemoteServices remoteServices;
    private final FolderResolver folderResolver;

    /**
     * Copies every object of {@code bucket} under a Drive folder named {@code rootFolderName},
     * using {@code concurrency} parallel workers. Per-object failures are logged and counted;
     * they never abort the run. Remote calls carry only per-request HTTP timeouts, the run itself
     * has no deadline.
     */
    public TransferSummary run(String bucket, String rootFolderName, int concurrency)
            throws IOException, InterruptedException {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1, got " + concurrency);
        }
        log.info("Initializing transfer from bucket '{}' to Drive folder '{}' with {} workers...",
                bucket, rootFolderName, concurrency);

        // 1. Setup clients
        ObjectSource source = remoteServices.openSource();
        DriveClientFactory driveClients = remoteServices.openDestination();

        List<SourceObject> objects = source.listObjects(bucket);
        if (objects.isEmpty()) {
            log.info("Bucket {} is empty.", bucket);
            return TransferSummary.empty();
        }

        // 2. Get/create root folder; workers build their own clients
        DriveClient setupClient = driveClients.create();
        String rootId = folderResolver.resolveOrCreate(setupClient, rootFolderName, null);
        log.info("Destination Drive folder ID: {}", rootId);

        FolderPathCache folderCache = new FolderPathCache(folderResolver);

        // 3. Process objects in parallel
        TransferProgress progress = new TransferProgress(objects.size());
        ExecutorService executor = Executors.newFixedThreadPool(concurrency,
                new CustomizableThreadFactory("transfer-worker-"));
        try {
            CompletionService<TransferResult> completions = new ExecutorCompletionService<>(executor);
            Map<Future<TransferResult>, SourceObject> submitted = new HashMap<>();
            for (SourceObject object : objects) {
                submitted.put(completions.submit(() -> transferOne(driveClients, object, rootId, folderCache)),
                        object);
            }

            for (int i = 0; i < objects.size(); i++) {
                progress.record(awaitNext(completions, submitted));
            }
        } finally {
            executor.shutdownNow();
        }

        TransferSummary summary = progress.summary();
        log.info("Transfer complete! {} transferred, {} skipped, {} failed out of {} objects ({} folders cached)",
                summary.getTransferred(), summary.getSkipped(), summary.getFailed(), summary.getTotal(),
                folderCache.size());
        return summary;
    }

    private static TransferResult transferOne(DriveClientFactory driveClients, SourceObject object,
                                              String rootId, FolderPathCache folderCache) {
        try {
            ObjectTransferWorker worker = new ObjectTransferWorker(driveClients.create());
            TransferOutcome outcome = worker.transfer(object, rootId, folderCache);
            return TransferResult.completed(object.key(), outcome);
        } catch (Throwable t) {
            // Errors too (e.g. OutOfMemoryError): one object must never end the run
            log.error("Error processing {}", object.key(), t);
            return TransferResult.failed(object.key(), t);
        }
    }

    private static TransferResult awaitNext(CompletionService<TransferResult> completions,
                                            Map<Future<TransferResult>, SourceObject> submitted)
            throws InterruptedException {
        Future<TransferResult> future = completions.take();
        try {
            return future.get();
        } catch (ExecutionException e) {
            String key = submitted.get(future).key();
            log.error("Error processing {}", key, e.getCause());
            return TransferResult.failed(key, e.getCause());
        }
    }
}
