/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.payload;

import io.github.leanish.sqs.hefty.HeftyException;

/**
 * Thrown when an offloaded payload read back from S3 cannot be parsed.
 */
public class MalformedPayloadException extends HeftyException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }

    public static MalformedPayloadException truncated(String section, int needed, int remaining) {
        return new MalformedPayloadException(
                "Truncated payload: " + section + " needs " + needed + " bytes but only " + remaining + " remain");
    }

    public static MalformedPayloadException negativeLength(String section, int length) {
        return new MalformedPayloadException("Negative length for " + section + ": " + length);
    }

    public static MalformedPayloadException unsupportedVersion(int version) {
        return new MalformedPayloadException("Unsupported payload format version: " + version);
    }

    public static MalformedPayloadException trailingBytes(int count) {
        return new MalformedPayloadException("Payload has " + count + " unexpected trailing bytes");
    }
}
