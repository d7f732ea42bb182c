/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.errors;

import io.github.leanish.sqs.hefty.HeftyException;

/**
 * Thrown when a body flagged as an error message cannot be parsed.
 */
public class MalformedErrorMessageException extends HeftyException {

    public MalformedErrorMessageException(String message) {
        super(message);
    }

    public MalformedErrorMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
