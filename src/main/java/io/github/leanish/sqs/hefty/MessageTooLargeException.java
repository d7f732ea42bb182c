/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty;

/**
 * Thrown when a message exceeds the largest size the client is willing to offload.
 */
public class MessageTooLargeException extends HeftyException {

    private final long size;
    private final long maxSize;

    private MessageTooLargeException(long size, long maxSize) {
        super("Message size of " + size + " bytes greater than allowed message size of " + maxSize + " bytes");
        this.size = size;
        this.maxSize = maxSize;
    }

    public static MessageTooLargeException of(long size, long maxSize) {
        return new MessageTooLargeException(size, maxSize);
    }

    public long size() {
        return size;
    }

    public long maxSize() {
        return maxSize;
    }
}
