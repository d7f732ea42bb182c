/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import io.github.leanish.sqs.hefty.store.BlobStore;
import io.github.leanish.sqs.hefty.store.StoreIOException;

class InMemoryBlobStore implements BlobStore {

    private final Set<String> buckets = new HashSet<>();
    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private boolean failUploads;
    private boolean failDeletes;

    InMemoryBlobStore(String... buckets) {
        this.buckets.addAll(Set.of(buckets));
    }

    void failUploads() {
        this.failUploads = true;
    }

    void failDeletes() {
        this.failDeletes = true;
    }

    Map<String, byte[]> objects() {
        return objects;
    }

    byte[] object(String bucket, String key) {
        return objects.get(bucket + "/" + key);
    }

    @Override
    public void put(String bucket, String key, byte[] payload) {
        if (failUploads) {
            throw StoreIOException.upload(bucket, key, new IllegalStateException("Access Denied"));
        }
        objects.put(bucket + "/" + key, payload.clone());
    }

    @Override
    public byte[] get(String bucket, String key) {
        byte[] payload = objects.get(bucket + "/" + key);
        if (payload == null) {
            throw StoreIOException.download(bucket, key, new IllegalStateException("NoSuchKey"));
        }
        return payload.clone();
    }

    @Override
    public void delete(String bucket, String key) {
        if (failDeletes) {
            throw StoreIOException.delete(bucket, key, new IllegalStateException("Access Denied"));
        }
        objects.remove(bucket + "/" + key);
    }

    @Override
    public boolean exists(String bucket) {
        return buckets.contains(bucket);
    }
}
