/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * {@link BlobStore} backed by Amazon S3.
 */
public class S3BlobStore implements BlobStore {

    private static final Logger logger = LoggerFactory.getLogger(S3BlobStore.class);

    private static final int FORBIDDEN = 403;
    private static final int NOT_FOUND = 404;

    private final S3Client s3Client;

    public S3BlobStore(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    @Override
    public void put(String bucket, String key, byte[] payload) {
        logger.debug("Uploading {} bytes to s3://{}/{}", payload.length, bucket, key);
        try {
            s3Client.putObject(
                    PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentLength((long) payload.length)
                            .build(),
                    RequestBody.fromBytes(payload));
        } catch (SdkException e) {
            throw StoreIOException.upload(bucket, key, e);
        }
    }

    @Override
    public byte[] get(String bucket, String key) {
        logger.debug("Downloading s3://{}/{}", bucket, key);
        try {
            return s3Client.getObjectAsBytes(GetObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .build())
                    .asByteArray();
        } catch (SdkException e) {
            throw StoreIOException.download(bucket, key, e);
        }
    }

    @Override
    public void delete(String bucket, String key) {
        logger.debug("Deleting s3://{}/{}", bucket, key);
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
        } catch (SdkException e) {
            throw StoreIOException.delete(bucket, key, e);
        }
    }

    @Override
    public boolean exists(String bucket) {
        try {
            s3Client.headBucket(HeadBucketRequest.builder()
                    .bucket(bucket)
                    .build());
            return true;
        } catch (NoSuchBucketException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == NOT_FOUND || e.statusCode() == FORBIDDEN) {
                logger.debug("Bucket {} is not accessible: {}", bucket, e.getMessage());
                return false;
            }
            throw StoreIOException.bucketCheck(bucket, e);
        } catch (SdkException e) {
            throw StoreIOException.bucketCheck(bucket, e);
        }
    }
}
