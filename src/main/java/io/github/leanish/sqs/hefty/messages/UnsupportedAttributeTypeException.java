/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.messages;

import org.jspecify.annotations.Nullable;

import io.github.leanish.sqs.hefty.HeftyException;

/**
 * Thrown when a message attribute declares a data type other than String, Number or Binary.
 */
public class UnsupportedAttributeTypeException extends HeftyException {

    private final @Nullable String dataType;

    private UnsupportedAttributeTypeException(@Nullable String dataType) {
        super("Encountered unexpected data type for message attribute: " + dataType);
        this.dataType = dataType;
    }

    public static UnsupportedAttributeTypeException of(@Nullable String dataType) {
        return new UnsupportedAttributeTypeException(dataType);
    }

    public @Nullable String dataType() {
        return dataType;
    }
}
