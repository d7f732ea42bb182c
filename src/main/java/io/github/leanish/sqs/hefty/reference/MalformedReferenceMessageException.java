/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.reference;

import io.github.leanish.sqs.hefty.HeftyException;

/**
 * Thrown when a message flagged as a reference message cannot be parsed.
 */
public class MalformedReferenceMessageException extends HeftyException {

    public MalformedReferenceMessageException(String message) {
        super(message);
    }

    public MalformedReferenceMessageException(String message, Throwable cause) {
        super(message, cause);
    }

    public static MalformedReferenceMessageException invalidJson(Throwable cause) {
        return new MalformedReferenceMessageException("Unable to unmarshal reference message", cause);
    }

    public static MalformedReferenceMessageException unexpectedIdentifier(String identifier) {
        return new MalformedReferenceMessageException("Unexpected reference message identifier: " + identifier);
    }

    public static MalformedReferenceMessageException missingField(String field) {
        return new MalformedReferenceMessageException("Reference message is missing required field: " + field);
    }
}
