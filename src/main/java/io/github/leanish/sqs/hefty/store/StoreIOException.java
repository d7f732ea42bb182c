/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.store;

import io.github.leanish.sqs.hefty.HeftyException;

/**
 * Thrown when a call to the blob store fails.
 */
public class StoreIOException extends HeftyException {

    public StoreIOException(String message, Throwable cause) {
        super(message, cause);
    }

    public static StoreIOException upload(String bucket, String key, Throwable cause) {
        return new StoreIOException("Unable to upload hefty message to s3://" + bucket + "/" + key, cause);
    }

    public static StoreIOException download(String bucket, String key, Throwable cause) {
        return new StoreIOException("Unable to get hefty message from s3://" + bucket + "/" + key, cause);
    }

    public static StoreIOException delete(String bucket, String key, Throwable cause) {
        return new StoreIOException("Could not delete s3 object s3://" + bucket + "/" + key, cause);
    }

    public static StoreIOException bucketCheck(String bucket, Throwable cause) {
        return new StoreIOException("Unable to check bucket " + bucket, cause);
    }
}
