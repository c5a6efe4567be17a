package com.example.drivetransfer.transfer;

import com.example.drivetransfer.model.TransferOutcome;
import com.example.drivetransfer.model.TransferResult;
import com.example.drivetransfer.model.TransferSummary;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransferProgressTest {

    @Test
    void summary_CountsEachOutcome() {
        TransferProgress progress = new TransferProgress(4);

        progress.record(TransferResult.completed("a.txt", TransferOutcome.TRANSFERRED));
        progress.record(TransferResult.failed("b.txt", new IOException("reset")));
        progress.record(TransferResult.completed("c/", TransferOutcome.SKIPPED_PLACEHOLDER));
        progress.record(TransferResult.completed("d.txt", TransferOutcome.SKIPPED_EXISTING));

        TransferSummary summary = progress.summary();
        assertEquals(4, summary.getTotal());
        assertEquals(1, summary.getTransferred());
        assertEquals(2, summary.getSkipped());
        assertEquals(1, summary.getFailed());
        assertEquals(List.of("b.txt"), summary.getFailedKeys());
    }

    @Test
    void percent_LargeBucketDoesNotOverflow() {
        assertEquals(83, TransferProgress.percent(25_000_000, 30_000_000));
        assertEquals(100, TransferProgress.percent(Integer.MAX_VALUE, Integer.MAX_VALUE));
    }
}
