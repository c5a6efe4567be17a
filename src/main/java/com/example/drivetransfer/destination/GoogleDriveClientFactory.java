package com.example.drivetransfer.destination;

import com.example.drivetransfer.config.TransferProperties;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.drive.Drive;
import com.google.auth.Credentials;
import com.google.auth.http.HttpCredentialsAdapter;
import lombok.RequiredArgsConstructor;

/**
 * Builds one {@link Drive} service per call over a shared, thread-safe credentials object.
 * Every request gets the configured connect and read timeouts.
 */
@RequiredArgsConstructor
public class GoogleDriveClientFactory implements DriveClientFactory {

    private final HttpTransport transport;

    private final Credentials credentials;

    private final TransferProperties.Drive settings;

    @Override
    public DriveClient create() {
        HttpCredentialsAdapter credentialsAdapter = new HttpCredentialsAdapter(credentials);
        int connectTimeout = Math.toIntExact(settings.getConnectTimeout().toMillis());
        int readTimeout = Math.toIntExact(settings.getReadTimeout().toMillis());

        HttpRequestInitializer initializer = request -> {
            credentialsAdapter.initialize(request);
            request.setConnectTimeout(connectTimeout);
            request.setReadTimeout(readTimeout);
        };

        Drive drive = new Drive.Builder(transport, GsonFactory.getDefaultInstance(), initializer)
                .setApplicationName(settings.getApplicationName())
                .build();
        return new GoogleDriveClient(drive);
    }
}
