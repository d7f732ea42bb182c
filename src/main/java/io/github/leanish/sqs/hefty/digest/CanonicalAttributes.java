/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.digest;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

import io.github.leanish.sqs.hefty.messages.AttributeDataType;
import io.github.leanish.sqs.hefty.messages.MessageAttribute;

/**
 * Byte encoding of a message attribute set as SQS hashes it for {@code MD5OfMessageAttributes}.
 *
 * <p>Attributes are sorted by name; each one is written as
 * {@code nameLength name dataTypeLength dataType transportType valueLength value},
 * lengths being 4-byte big-endian integers and the transport type a single byte
 * ({@code 1} for String and Number, {@code 2} for Binary).
 */
public class CanonicalAttributes {

    private CanonicalAttributes() {
    }

    public static byte[] encode(Map<String, MessageAttribute> attributes) {
        try (ByteArrayOutputStream bytes = new ByteArrayOutputStream();
                DataOutputStream output = new DataOutputStream(bytes)) {
            write(output, attributes);
            output.flush();
            return bytes.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(DataOutputStream output, Map<String, MessageAttribute> attributes) throws IOException {
        for (Map.Entry<String, MessageAttribute> entry : new TreeMap<>(attributes).entrySet()) {
            MessageAttribute attribute = entry.getValue();
            AttributeDataType type = attribute.type();
            writeLengthPrefixed(output, entry.getKey().getBytes(StandardCharsets.UTF_8));
            writeLengthPrefixed(output, attribute.dataType().getBytes(StandardCharsets.UTF_8));
            output.writeByte(type.transportType());
            writeLengthPrefixed(output, attribute.valueBytes());
        }
    }

    private static void writeLengthPrefixed(DataOutputStream output, byte[] value) throws IOException {
        output.writeInt(value.length);
        output.write(value);
    }
}
