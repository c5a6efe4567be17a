package com.example.drivetransfer.source;

import com.example.drivetransfer.model.ObjectPayload;
import com.example.drivetransfer.model.SourceObject;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.ListObjectsArgs;
import io.minio.MinioClient;
import io.minio.Result;
import io.minio.messages.Item;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists and reads objects from any S3-compatible store through the MinIO client.
 */
@RequiredArgsConstructor
@Slf4j
public class MinioObjectSource implements ObjectSource {

    private final MinioClient minioClient;

    @Override
    public List<SourceObject> listObjects(String bucket) {
        List<SourceObject> objects = new ArrayList<>();
        try {
            Iterable<Result<Item>> results = minioClient.listObjects(
                    ListObjectsArgs.builder()
                            .bucket(bucket)
                            .recursive(true)
                            .build());

            for (Result<Item> result : results) {
                Item item = result.get();
                String key = item.objectName();
                // The listing carries no content type; the read call reports it
                objects.add(new SourceObject(key, item.size(), null, () -> open(bucket, key)));
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to list objects in bucket " + bucket, e);
        }

        log.info("Listed {} objects in MinIO bucket: {}", objects.size(), bucket);
        return objects;
    }

    private ObjectPayload open(String bucket, String key) throws IOException {
        try {
            GetObjectResponse response = minioClient.getObject(
                    GetObjectArgs.builder()
                            .bucket(bucket)
                            .object(key)
                            .build());
            return new ObjectPayload(response, response.headers().get("Content-Type"));
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Failed to read object " + key + " from bucket " + bucket, e);
        }
    }
}
