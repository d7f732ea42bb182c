/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.reference;

import io.github.leanish.sqs.hefty.HeftyException;

/**
 * Thrown when a queue URL or topic ARN cannot be parsed into a destination name.
 */
public class InvalidDestinationIdentifierException extends HeftyException {

    public InvalidDestinationIdentifierException(String message) {
        super(message);
    }

    public static InvalidDestinationIdentifierException missing(String description) {
        return new InvalidDestinationIdentifierException(description + " is null");
    }

    public static InvalidDestinationIdentifierException unexpectedTokenCount(
            String description,
            String separator,
            int expected,
            int actual) {
        return new InvalidDestinationIdentifierException(
                "Expected " + expected + " tokens when splitting " + description + " by '" + separator
                        + "' but received " + actual);
    }

    public static InvalidDestinationIdentifierException emptyName(String description, String destination) {
        return new InvalidDestinationIdentifierException("Empty destination name in " + description + ": " + destination);
    }
}
