package com.yizhaoqi.kb.storage;

import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.MinioClient;
import io.minio.RemoveObjectArgs;
import io.minio.errors.ErrorResponseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * MinIO-backed {@link BlobStorage}. Locators are {@code s3://bucket/object}, {@code minio://bucket/object},
 * {@code bucket/object}, or a bare object name in the default bucket.
 */
@Component
public class MinioBlobStorage implements BlobStorage {

    private static final Logger logger = LoggerFactory.getLogger(MinioBlobStorage.class);

    private final MinioClient minioClient;

    @Value("${minio.bucket-name:knowledge-documents}")
    private String defaultBucket;

    public MinioBlobStorage(MinioClient minioClient) {
        this.minioClient = minioClient;
    }

    @Override
    public byte[] fetchBytes(String locator) throws IOException {
        ObjectLocation location = resolve(locator);
        logger.info("Downloading object from storage: bucket={}, object={}", location.bucket(), location.object());
        try (GetObjectResponse response = minioClient.getObject(GetObjectArgs.builder()
                .bucket(location.bucket())
                .object(location.object())
                .build())) {
            return response.readAllBytes();
        } catch (ErrorResponseException e) {
            String code = e.errorResponse() != null ? e.errorResponse().code() : null;
            if ("NoSuchKey".equals(code) || "NoSuchBucket".equals(code)) {
                throw new IOException("File not found in storage: " + locator, e);
            }
            throw new IOException("Storage error for " + locator + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Storage error for " + locator + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void deleteBlob(String locator) {
        try {
            ObjectLocation location = resolve(locator);
            minioClient.removeObject(RemoveObjectArgs.builder()
                    .bucket(location.bucket())
                    .object(location.object())
                    .build());
            logger.info("Removed object from storage: {}", locator);
        } catch (Exception e) {
            logger.error("Failed to remove object from storage: {}", locator, e);
        }
    }

    ObjectLocation resolve(String locator) throws IOException {
        if (locator == null || locator.trim().isEmpty()) {
            throw new IOException("Empty storage locator");
        }
        String path = locator.trim();
        int schemeEnd = path.indexOf("://");
        if (schemeEnd >= 0) {
            String scheme = path.substring(0, schemeEnd).toLowerCase();
            if (!scheme.equals("s3") && !scheme.equals("minio")) {
                throw new IOException("Unsupported storage locator: " + locator);
            }
            path = path.substring(schemeEnd + 3);
            int slash = path.indexOf('/');
            if (slash <= 0 || slash == path.length() - 1) {
                throw new IOException("Storage locator must name a bucket and an object: " + locator);
            }
            return new ObjectLocation(path.substring(0, slash), path.substring(slash + 1));
        }
        if (path.startsWith("/")) {
            path = path.substring(1);
        }
        int slash = path.indexOf('/');
        if (slash > 0 && path.substring(0, slash).equals(defaultBucket)) {
            return new ObjectLocation(defaultBucket, path.substring(slash + 1));
        }
        return new ObjectLocation(defaultBucket, path);
    }

    record ObjectLocation(String bucket, String object) {
    }
}
