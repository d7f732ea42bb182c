/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.messages;

/**
 * Base data types accepted by SQS and SNS message attributes.
 * A data type may carry a custom suffix, e.g. {@code Number.float} or {@code Binary.png}.
 */
public enum AttributeDataType {
    STRING("String", (byte) 1),
    NUMBER("Number", (byte) 1),
    BINARY("Binary", (byte) 2);

    private final String token;
    private final byte transportType;

    AttributeDataType(String token, byte transportType) {
        this.token = token;
        this.transportType = transportType;
    }

    public String token() {
        return token;
    }

    /**
     * Transport type marker used by the SQS attribute digest: 1 for string values, 2 for binary values.
     */
    public byte transportType() {
        return transportType;
    }

    public boolean isBinary() {
        return this == BINARY;
    }

    public static AttributeDataType fromDataType(String dataType) {
        if (dataType == null) {
            throw UnsupportedAttributeTypeException.of(null);
        }
        int separator = dataType.indexOf('.');
        String leadingToken = separator < 0 ? dataType : dataType.substring(0, separator);
        for (AttributeDataType type : values()) {
            if (type.token.equals(leadingToken)) {
                return type;
            }
        }
        throw UnsupportedAttributeTypeException.of(dataType);
    }
}
