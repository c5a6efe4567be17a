package com.example.drivetransfer.cli;

import com.example.drivetransfer.config.TransferProperties;
import com.example.drivetransfer.exception.TransferSetupException;
import com.example.drivetransfer.model.TransferSummary;
import com.example.drivetransfer.transfer.TransferOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Runs one transfer with the bound {@link TransferProperties} and turns fatal errors into guidance.
 * Per-object failures do not change the exit code.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransferCommand implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_SETUP_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final TransferOrchestrator orchestrator;
    private final TransferProperties properties;
    private final SetupErrorAdvisor setupErrorAdvisor;

    private int exitCode = EXIT_OK;

    @Override
    public void run(String... args) throws Exception {
        if (!StringUtils.hasText(properties.getBucket()) || !StringUtils.hasText(properties.getDriveFolder())) {
            log.error("Usage: --bucket=<bucket name> --drive-folder=<target folder name> "
                    + "[--gcs-sa=<key file>] [--drive-sa=<key file>] [--project=<project id>] [--workers=<n>] "
                    + "[--source-type=GCS|MINIO]");
            exitCode = EXIT_USAGE;
            return;
        }
        if (properties.getWorkers() < 1) {
            log.error("--workers must be at least 1, got {}", properties.getWorkers());
            exitCode = EXIT_USAGE;
            return;
        }

        try {
            TransferSummary summary = orchestrator.run(
                    properties.getBucket(), properties.getDriveFolder(), properties.getWorkers());
            if (summary.getFailed() > 0) {
                log.warn("{} objects failed: {}", summary.getFailed(), summary.getFailedKeys());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } catch (Exception e) {
            Optional<SetupFailure> failure = setupErrorAdvisor.classify(e);
            if (failure.isPresent()) {
                log.debug("Setup failed", e);
                failure.get().guidance().forEach(line -> log.error(line));
            } else if (e instanceof TransferSetupException) {
                log.error("Error: {}", e.getMessage(), e);
            } else {
                throw e;
            }
            exitCode = EXIT_SETUP_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
