/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.messages;

import java.nio.charset.StandardCharsets;

import org.jspecify.annotations.Nullable;

import software.amazon.awssdk.core.SdkBytes;

/**
 * Service-neutral message attribute, convertible to the SQS and SNS SDK attribute types.
 */
public record MessageAttribute(String dataType, @Nullable String stringValue, @Nullable SdkBytes binaryValue) {

    private static final byte[] EMPTY = new byte[0];

    public static MessageAttribute string(String value) {
        return new MessageAttribute(AttributeDataType.STRING.token(), value, null);
    }

    public static MessageAttribute number(String value) {
        return new MessageAttribute(AttributeDataType.NUMBER.token(), value, null);
    }

    public static MessageAttribute binary(byte[] value) {
        return new MessageAttribute(AttributeDataType.BINARY.token(), null, SdkBytes.fromByteArray(value));
    }

    public AttributeDataType type() {
        return AttributeDataType.fromDataType(dataType);
    }

    /**
     * Value bytes as the queue service accounts them: UTF-8 for string-like types, raw bytes for binary.
     */
    public byte[] valueBytes() {
        if (type().isBinary()) {
            return binaryValue == null ? EMPTY : binaryValue.asByteArray();
        }
        return stringValue == null ? EMPTY : stringValue.getBytes(StandardCharsets.UTF_8);
    }
}
