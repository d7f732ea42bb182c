/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.store;

/**
 * Object storage holding offloaded payloads.
 * Implementations report failures as {@link StoreIOException} and never retry on their own.
 */
public interface BlobStore {

    void put(String bucket, String key, byte[] payload);

    byte[] get(String bucket, String key);

    void delete(String bucket, String key);

    boolean exists(String bucket);
}
