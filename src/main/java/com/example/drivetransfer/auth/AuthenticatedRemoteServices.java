package com.example.drivetransfer.auth;

import com.example.drivetransfer.config.TransferProperties;
import com.example.drivetransfer.destination.DriveClientFactory;
import com.example.drivetransfer.destination.GoogleDriveClientFactory;
import com.example.drivetransfer.exception.TransferSetupException;
import com.example.drivetransfer.source.GcsObjectSource;
import com.example.drivetransfer.source.MinioObjectSource;
import com.example.drivetransfer.source.ObjectSource;
import com.example.drivetransfer.transfer.RemoteServices;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.security.GeneralSecurityException;

@Component
@RequiredArgsConstructor
@Slf4j
public class AuthenticatedRemoteServices implements RemoteServices {

    private final CredentialsResolver credentialsResolver;
    private final TransferProperties properties;

    @Override
    public ObjectSource openSource() {
        log.info("Connecting to {} source", properties.getSourceType());
        return switch (properties.getSourceType()) {
            case GCS -> new GcsObjectSource(credentialsResolver.gcsStorage());
            case MINIO -> new MinioObjectSource(credentialsResolver.minioClient());
        };
    }

    @Override
    public DriveClientFactory openDestination() {
        try {
            return new GoogleDriveClientFactory(
                    GoogleNetHttpTransport.newTrustedTransport(),
                    credentialsResolver.driveCredentials(),
                    properties.getDrive());
        } catch (GeneralSecurityException | IOException e) {
            throw new TransferSetupException("Failed to initialize the Drive HTTP transport", e);
        }
    }
}
