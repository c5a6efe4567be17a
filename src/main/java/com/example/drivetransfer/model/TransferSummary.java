package com.example.drivetransfer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferSummary {

    private int total;

    private int transferred;

    // Existing destination files and directory placeholders
    private int skipped;

    private int failed;

    @Builder.Default
    private List<String> failedKeys = new ArrayList<>();

    public static TransferSummary empty() {
        return TransferSummary.builder().build();
    }
}
