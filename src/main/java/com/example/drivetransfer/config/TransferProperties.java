package com.example.drivetransfer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Run configuration, bound once at startup from application.properties and the command line.
 */
@Data
@ConfigurationProperties(prefix = "transfer")
public class TransferProperties {

    public static final int DEFAULT_WORKERS = 10;

    public enum SourceType {
        GCS,
        MINIO
    }

    private String bucket;

    /**
     * Name of the destination root folder in Drive, resolved or created with no parent.
     */
    private String driveFolder;

    // Service account key files; blank means Application Default Credentials
    private String gcsSa;

    private String driveSa;

    private String project;

    private int workers = DEFAULT_WORKERS;

    private SourceType sourceType = SourceType.GCS;

    private final Minio minio = new Minio();

    private final Drive drive = new Drive();

    @Data
    public static class Minio {

        private String endpoint;

        private String accessKey;

        private String secretKey;
    }

    @Data
    public static class Drive {

        private String applicationName = "bucket-drive-transfer";

        private Duration connectTimeout = Duration.ofSeconds(60);

        private Duration readTimeout = Duration.ofSeconds(60);
    }
}
