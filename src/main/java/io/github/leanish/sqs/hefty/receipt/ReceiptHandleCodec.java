/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.receipt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import com.google.errorprone.annotations.Immutable;

/**
 * Carries the S3 location of an offloaded message inside the receipt handle given to consumers,
 * so deleting the message can also delete its payload.
 *
 * <p>Wire form: {@code base64("hefty-message|<nativeHandle>|<bucket>|<key>")}.
 */
@Immutable
public class ReceiptHandleCodec {

    static final String MARKER = "hefty-message";
    static final String DELIMITER = "|";
    static final int EXPECTED_TOKEN_COUNT = 4;

    private static final String MARKER_PREFIX = MARKER + DELIMITER;
    private static final Base64.Encoder ENCODER = Base64.getEncoder();
    private static final Base64.Decoder DECODER = Base64.getDecoder();

    public String wrap(String nativeHandle, String bucket, String key) {
        String composite = String.join(DELIMITER, MARKER, nativeHandle, bucket, key);
        return ENCODER.encodeToString(composite.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes a handle produced by {@link #wrap}. Anything else is returned as a native handle, unchanged.
     */
    public ReceiptHandle unwrap(String handle) {
        String decoded;
        try {
            decoded = new String(DECODER.decode(handle), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // native SQS handles are not required to be valid base64
            return ReceiptHandle.nativeHandle(handle);
        }
        if (!decoded.startsWith(MARKER_PREFIX)) {
            return ReceiptHandle.nativeHandle(handle);
        }

        String[] tokens = decoded.split("\\" + DELIMITER, -1);
        if (tokens.length != EXPECTED_TOKEN_COUNT) {
            throw MalformedReceiptHandleException.unexpectedTokenCount(EXPECTED_TOKEN_COUNT, tokens.length);
        }
        return ReceiptHandle.offloaded(tokens[1], tokens[2], tokens[3]);
    }
}
