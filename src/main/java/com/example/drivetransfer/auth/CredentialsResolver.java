package com.example.drivetransfer.auth;

import com.example.drivetransfer.config.TransferProperties;
import com.example.drivetransfer.exception.MissingCredentialsException;
import com.example.drivetransfer.exception.ProjectNotDeterminedException;
import com.example.drivetransfer.exception.TransferSetupException;
import com.google.api.services.drive.DriveScopes;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.ServiceAccountCredentials;
import com.google.cloud.ServiceOptions;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import io.minio.MinioClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Turns the configured key files, project id and MinIO keys into authenticated handles.
 * A key file wins over Application Default Credentials for each service independently.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CredentialsResolver {

    public static final List<String> DRIVE_SCOPES = List.of(DriveScopes.DRIVE);

    private final TransferProperties properties;

    public Storage gcsStorage() {
        GoogleCredentials credentials = StringUtils.hasText(properties.getGcsSa())
                ? loadServiceAccount(properties.getGcsSa())
                : applicationDefault();

        String projectId = resolveProject(credentials);
        log.info("Using GCS project: {}", projectId);
        return StorageOptions.newBuilder()
                .setCredentials(credentials)
                .setProjectId(projectId)
                .build()
                .getService();
    }

    public GoogleCredentials driveCredentials() {
        if (StringUtils.hasText(properties.getDriveSa())) {
            return loadServiceAccount(properties.getDriveSa()).createScoped(DRIVE_SCOPES);
        }

        GoogleCredentials credentials = applicationDefault().createScoped(DRIVE_SCOPES);
        if (StringUtils.hasText(properties.getProject())) {
            credentials = credentials.createWithQuotaProject(properties.getProject());
        }
        return credentials;
    }

    public MinioClient minioClient() {
        TransferProperties.Minio minio = properties.getMinio();
        if (!StringUtils.hasText(minio.getEndpoint())) {
            throw new TransferSetupException("MinIO endpoint is not configured (--minio-endpoint)");
        }
        if (!StringUtils.hasText(minio.getAccessKey()) || !StringUtils.hasText(minio.getSecretKey())) {
            throw new MissingCredentialsException("MinIO access key and secret key are required");
        }
        return MinioClient.builder()
                .endpoint(minio.getEndpoint())
                .credentials(minio.getAccessKey(), minio.getSecretKey())
                .build();
    }

    GoogleCredentials loadServiceAccount(String keyFile) {
        try (InputStream in = Files.newInputStream(Path.of(keyFile))) {
            return ServiceAccountCredentials.fromStream(in);
        } catch (NoSuchFileException e) {
            throw new MissingCredentialsException("Service account key file not found: " + keyFile, e);
        } catch (IOException e) {
            throw new MissingCredentialsException("Service account key file could not be read: " + keyFile, e);
        }
    }

    GoogleCredentials applicationDefault() {
        try {
            return GoogleCredentials.getApplicationDefault();
        } catch (IOException e) {
            throw new MissingCredentialsException("Google Cloud credentials not found", e);
        }
    }

    String resolveProject(GoogleCredentials credentials) {
        if (StringUtils.hasText(properties.getProject())) {
            return properties.getProject();
        }
        if (credentials instanceof ServiceAccountCredentials serviceAccount
                && StringUtils.hasText(serviceAccount.getProjectId())) {
            return serviceAccount.getProjectId();
        }
        String inferred = ServiceOptions.getDefaultProjectId();
        if (!StringUtils.hasText(inferred)) {
            throw new ProjectNotDeterminedException("Project was not passed and could not be determined from the environment");
        }
        return inferred;
    }
}
