/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.payload;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.errorprone.annotations.Immutable;

import io.github.leanish.sqs.hefty.digest.CanonicalAttributes;
import io.github.leanish.sqs.hefty.messages.AttributeDataType;
import io.github.leanish.sqs.hefty.messages.HeftyMessage;
import io.github.leanish.sqs.hefty.messages.MessageAttribute;
import io.github.leanish.sqs.hefty.messages.UnsupportedAttributeTypeException;
import software.amazon.awssdk.core.SdkBytes;

/**
 * Serializes a whole message, body and attributes, into the single object stored in S3.
 *
 * <p>Layout, integers being 4-byte big-endian:
 * <pre>
 * formatVersion bodyLength attributeCount
 * body
 * attributes in canonical digest order (see {@link CanonicalAttributes})
 * </pre>
 */
@Immutable
public class HeftyPayloadCodec {

    static final int FORMAT_VERSION = 1;
    static final int HEADER_LENGTH = 3 * Integer.BYTES;

    private static final byte STRING_TRANSPORT = AttributeDataType.STRING.transportType();
    private static final byte BINARY_TRANSPORT = AttributeDataType.BINARY.transportType();

    public SerializedPayload serialize(HeftyMessage message) {
        byte[] body = message.body().getBytes(StandardCharsets.UTF_8);
        try (ByteArrayOutputStream bytes = new ByteArrayOutputStream(HEADER_LENGTH + body.length);
                DataOutputStream output = new DataOutputStream(bytes)) {
            output.writeInt(FORMAT_VERSION);
            output.writeInt(body.length);
            output.writeInt(message.attributes().size());
            output.write(body);
            CanonicalAttributes.write(output, message.attributes());
            output.flush();
            return new SerializedPayload(bytes.toByteArray(), HEADER_LENGTH, HEADER_LENGTH + body.length);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public HeftyMessage deserialize(byte[] payload) {
        ByteBuffer buffer = ByteBuffer.wrap(payload);
        int version = readInt(buffer, "format version");
        if (version != FORMAT_VERSION) {
            throw MalformedPayloadException.unsupportedVersion(version);
        }
        int bodyLength = readLength(buffer, "body");
        int attributeCount = readLength(buffer, "attribute count");
        String body = new String(readBytes(buffer, bodyLength, "body"), StandardCharsets.UTF_8);

        Map<String, MessageAttribute> attributes = new LinkedHashMap<>();
        for (int index = 0; index < attributeCount; index++) {
            String name = readString(buffer, "attribute name");
            String dataType = readString(buffer, "attribute data type");
            byte transportType = readByte(buffer);
            byte[] value = readBytes(buffer, readLength(buffer, "attribute value"), "attribute value");
            MessageAttribute attribute = toAttribute(name, dataType, transportType, value);
            if (attributes.put(name, attribute) != null) {
                throw new MalformedPayloadException("Duplicate attribute in payload: " + name);
            }
        }
        if (buffer.hasRemaining()) {
            throw MalformedPayloadException.trailingBytes(buffer.remaining());
        }
        return new HeftyMessage(body, attributes);
    }

    private static MessageAttribute toAttribute(String name, String dataType, byte transportType, byte[] value) {
        AttributeDataType type;
        try {
            type = AttributeDataType.fromDataType(dataType);
        } catch (UnsupportedAttributeTypeException e) {
            throw new MalformedPayloadException("Unsupported data type for attribute " + name + ": " + dataType, e);
        }
        if (transportType != STRING_TRANSPORT && transportType != BINARY_TRANSPORT) {
            throw new MalformedPayloadException("Unknown transport type " + transportType + " for attribute " + name);
        }
        if (transportType != type.transportType()) {
            throw new MalformedPayloadException(
                    "Transport type " + transportType + " does not match data type " + dataType + " for attribute " + name);
        }
        if (type.isBinary()) {
            return new MessageAttribute(dataType, null, SdkBytes.fromByteArray(value));
        }
        return new MessageAttribute(dataType, new String(value, StandardCharsets.UTF_8), null);
    }

    private static String readString(ByteBuffer buffer, String section) {
        return new String(readBytes(buffer, readLength(buffer, section), section), StandardCharsets.UTF_8);
    }

    private static int readLength(ByteBuffer buffer, String section) {
        int length = readInt(buffer, section);
        if (length < 0) {
            throw MalformedPayloadException.negativeLength(section, length);
        }
        return length;
    }

    private static int readInt(ByteBuffer buffer, String section) {
        if (buffer.remaining() < Integer.BYTES) {
            throw MalformedPayloadException.truncated(section, Integer.BYTES, buffer.remaining());
        }
        return buffer.getInt();
    }

    private static byte readByte(ByteBuffer buffer) {
        if (!buffer.hasRemaining()) {
            throw MalformedPayloadException.truncated("attribute transport type", 1, 0);
        }
        return buffer.get();
    }

    private static byte[] readBytes(ByteBuffer buffer, int length, String section) {
        if (buffer.remaining() < length) {
            throw MalformedPayloadException.truncated(section, length, buffer.remaining());
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }
}
