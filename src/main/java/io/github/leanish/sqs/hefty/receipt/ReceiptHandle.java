/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.receipt;

/**
 * Receipt handle decoded from the value handed to consumers.
 * Handles of messages that were not offloaded carry empty bucket and key.
 */
public record ReceiptHandle(boolean offloaded, String nativeHandle, String bucket, String key) {

    public static ReceiptHandle nativeHandle(String handle) {
        return new ReceiptHandle(false, handle, "", "");
    }

    public static ReceiptHandle offloaded(String handle, String bucket, String key) {
        return new ReceiptHandle(true, handle, bucket, key);
    }
}
