/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.messages;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between {@link MessageAttribute} and the SQS and SNS SDK attribute types.
 */
public class MessageAttributes {

    private MessageAttributes() {
    }

    public static Map<String, MessageAttribute> fromSqs(
            Map<String, software.amazon.awssdk.services.sqs.model.MessageAttributeValue> attributes) {
        Map<String, MessageAttribute> converted = new LinkedHashMap<>();
        attributes.forEach((name, value) -> converted.put(
                name,
                new MessageAttribute(value.dataType(), value.stringValue(), value.binaryValue())));
        return converted;
    }

    public static Map<String, software.amazon.awssdk.services.sqs.model.MessageAttributeValue> toSqs(
            Map<String, MessageAttribute> attributes) {
        Map<String, software.amazon.awssdk.services.sqs.model.MessageAttributeValue> converted = new LinkedHashMap<>();
        attributes.forEach((name, value) -> converted.put(
                name,
                software.amazon.awssdk.services.sqs.model.MessageAttributeValue.builder()
                        .dataType(value.dataType())
                        .stringValue(value.stringValue())
                        .binaryValue(value.binaryValue())
                        .build()));
        return converted;
    }

    public static Map<String, MessageAttribute> fromSns(
            Map<String, software.amazon.awssdk.services.sns.model.MessageAttributeValue> attributes) {
        Map<String, MessageAttribute> converted = new LinkedHashMap<>();
        attributes.forEach((name, value) -> converted.put(
                name,
                new MessageAttribute(value.dataType(), value.stringValue(), value.binaryValue())));
        return converted;
    }

    public static Map<String, software.amazon.awssdk.services.sns.model.MessageAttributeValue> toSns(
            Map<String, MessageAttribute> attributes) {
        Map<String, software.amazon.awssdk.services.sns.model.MessageAttributeValue> converted = new LinkedHashMap<>();
        attributes.forEach((name, value) -> converted.put(
                name,
                software.amazon.awssdk.services.sns.model.MessageAttributeValue.builder()
                        .dataType(value.dataType())
                        .stringValue(value.stringValue())
                        .binaryValue(value.binaryValue())
                        .build()));
        return converted;
    }

    public static software.amazon.awssdk.services.sqs.model.MessageAttributeValue sqsStringAttribute(String value) {
        return software.amazon.awssdk.services.sqs.model.MessageAttributeValue.builder()
                .dataType(AttributeDataType.STRING.token())
                .stringValue(value)
                .build();
    }

    public static software.amazon.awssdk.services.sns.model.MessageAttributeValue snsStringAttribute(String value) {
        return software.amazon.awssdk.services.sns.model.MessageAttributeValue.builder()
                .dataType(AttributeDataType.STRING.token())
                .stringValue(value)
                .build();
    }
}
