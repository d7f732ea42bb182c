/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.payload;

import io.github.leanish.sqs.hefty.digest.MessageDigests;

/**
 * Serialized form of an offloaded message, as stored in S3.
 *
 * <p>{@code bytes[bodyOffset, attributeOffset)} holds the UTF-8 body and {@code bytes[attributeOffset, end)}
 * the canonical attribute encoding, so hashing each range yields the digests SQS would report.
 *
 * <p>Transient carrier between serialization and upload: {@code bytes} is neither copied nor compared by
 * content, so instances are not meant to be stored, compared or used as keys.
 */
public record SerializedPayload(byte[] bytes, int bodyOffset, int attributeOffset) {

    public SerializedPayload {
        if (bodyOffset < 0 || bodyOffset > attributeOffset || attributeOffset > bytes.length) {
            throw new IllegalArgumentException(
                    "Invalid offsets body=" + bodyOffset + " attributes=" + attributeOffset + " length=" + bytes.length);
        }
    }

    public String bodyDigest() {
        return MessageDigests.digest(bytes, bodyOffset, attributeOffset);
    }

    public String attributeDigest() {
        if (attributeOffset == bytes.length) {
            return "";
        }
        return MessageDigests.digest(bytes, attributeOffset, bytes.length);
    }
}
