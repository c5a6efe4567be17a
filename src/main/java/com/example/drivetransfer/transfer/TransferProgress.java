package com.example.drivetransfer.transfer;

import com.example.drivetransfer.model.TransferResult;
import com.example.drivetransfer.model.TransferSummary;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Counts completions in the order they arrive and logs a running progress line.
 * Only the orchestrator's consuming thread calls {@link #record}.
 */
@Slf4j
class TransferProgress {

    private final int total;

    // Log roughly every 5% so large buckets do not flood the console
    private final int logEvery;

    private int completed;
    private int transferred;
    private int skipped;
    private final List<String> failedKeys = new ArrayList<>();

    TransferProgress(int total) {
        this.total = total;
        this.logEvery = Math.max(1, total / 20);
    }

    void record(TransferResult result) {
        completed++;
        if (result.isFailed()) {
            failedKeys.add(result.key());
        } else {
            switch (result.outcome()) {
                case TRANSFERRED -> transferred++;
                case SKIPPED_EXISTING, SKIPPED_PLACEHOLDER -> skipped++;
            }
        }

        if (completed % logEvery == 0 || completed == total) {
            log.info("Transferring files: {}/{} ({}%)", completed, total, percent(completed, total));
        }
    }

    static long percent(int completed, int total) {
        return completed * 100L / total;
    }

    TransferSummary summary() {
        return TransferSummary.builder()
                .total(total)
                .transferred(transferred)
                .skipped(skipped)
                .failed(failedKeys.size())
                .failedKeys(new ArrayList<>(failedKeys))
                .build();
    }
}
