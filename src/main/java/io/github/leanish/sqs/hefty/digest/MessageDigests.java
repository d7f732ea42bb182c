/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.digest;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import io.github.leanish.sqs.hefty.messages.MessageAttribute;

/**
 * Reproduces the digests SQS reports for a message body and its attributes.
 */
public class MessageDigests {

    private static final Md5Digestor MD5 = new Md5Digestor();

    private MessageDigests() {
    }

    public static String bodyDigest(String body) {
        return MD5.checksum(body.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Digest of the attribute set, or an empty string when there are no attributes
     * (SQS omits {@code MD5OfMessageAttributes} in that case).
     */
    public static String attributeDigest(Map<String, MessageAttribute> attributes) {
        if (attributes.isEmpty()) {
            return "";
        }
        return MD5.checksum(CanonicalAttributes.encode(attributes));
    }

    public static String digest(byte[] bytes, int from, int to) {
        return MD5.checksum(bytes, from, to);
    }
}
