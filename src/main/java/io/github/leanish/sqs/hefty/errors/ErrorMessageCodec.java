/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.errors;

import java.io.UncheckedIOException;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.leanish.sqs.hefty.reference.ReferenceMessage;

/**
 * Serializes and detects {@link ErrorMessage} bodies.
 */
public class ErrorMessageCodec {

    static final String JSON_PREFIX = "{\"identifier\":\"" + ErrorMessage.IDENTIFIER + "\",";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ErrorMessageCodec() {
    }

    public static ErrorMessage create(Throwable error, @Nullable ReferenceMessage referenceMessage) {
        return ErrorMessage.of(String.valueOf(error.getMessage()), referenceMessage);
    }

    public static String toJson(ErrorMessage errorMessage) {
        try {
            return MAPPER.writeValueAsString(errorMessage);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ErrorMessage fromJson(String json) {
        ErrorMessage errorMessage;
        try {
            errorMessage = MAPPER.readValue(json, ErrorMessage.class);
        } catch (JsonProcessingException e) {
            throw new MalformedErrorMessageException("Unable to unmarshal error message", e);
        }
        if (errorMessage == null || !ErrorMessage.IDENTIFIER.equals(errorMessage.identifier())) {
            throw new MalformedErrorMessageException("Body is not a hefty error message");
        }
        return errorMessage;
    }

    public static boolean isErrorMessage(@Nullable String text) {
        return text != null && text.startsWith(JSON_PREFIX);
    }
}
