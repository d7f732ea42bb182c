/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.messages;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Computes message sizes with the accounting SQS and SNS apply against their size limits:
 * the body plus, for every attribute, its name, its data type and its value.
 */
public class MessageSizeCalculator {

    private MessageSizeCalculator() {
    }

    public static long size(HeftyMessage message) {
        return size(message.body(), message.attributes());
    }

    public static long size(String body, Map<String, MessageAttribute> attributes) {
        long size = utf8Length(body);
        for (Map.Entry<String, MessageAttribute> entry : attributes.entrySet()) {
            MessageAttribute attribute = entry.getValue();
            // resolves the type first so unknown data types fail before anything is counted
            AttributeDataType type = attribute.type();
            size += utf8Length(entry.getKey());
            size += utf8Length(attribute.dataType());
            if (type.isBinary()) {
                size += attribute.binaryValue() == null ? 0 : attribute.binaryValue().asByteBuffer().remaining();
            } else {
                size += utf8Length(attribute.stringValue());
            }
        }
        return size;
    }

    private static long utf8Length(String value) {
        if (value == null) {
            return 0;
        }
        return value.getBytes(StandardCharsets.UTF_8).length;
    }
}
