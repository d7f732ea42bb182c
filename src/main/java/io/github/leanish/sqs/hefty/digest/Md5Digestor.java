/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.digest;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import com.google.errorprone.annotations.Immutable;

/**
 * MD5 digest rendered as lower-case hex, the representation SQS uses for its message digests.
 */
@Immutable
public class Md5Digestor {

    private static final HexFormat HEX = HexFormat.of();

    public String checksum(byte[] payload) {
        return checksum(payload, 0, payload.length);
    }

    public String checksum(byte[] payload, int from, int to) {
        if (from < 0 || from > to || to > payload.length) {
            throw new IndexOutOfBoundsException(
                    "Invalid digest range [" + from + ", " + to + ") for " + payload.length + " bytes");
        }
        MessageDigest digest = digest();
        digest.update(payload, from, to - from);
        return HEX.formatHex(digest.digest());
    }

    private MessageDigest digest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new UnavailableAlgorithmException("MD5 digest is not available", e);
        }
    }
}
