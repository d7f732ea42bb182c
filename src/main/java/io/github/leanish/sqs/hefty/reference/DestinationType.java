/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.reference;

import java.util.regex.Pattern;

/**
 * Identifier conventions of the destinations a reference message can be sent to.
 */
public enum DestinationType {
    /** {@code https://sqs.us-west-2.amazonaws.com/123456789012/MyQueue} */
    QUEUE_URL("queueUrl", "/", 5, 4),
    /** {@code arn:aws:sns:us-west-2:123456789012:MyTopic} */
    TOPIC_ARN("topicArn", ":", 6, 5);

    private final String description;
    private final String separator;
    private final int expectedTokenCount;
    private final int nameTokenIndex;

    DestinationType(String description, String separator, int expectedTokenCount, int nameTokenIndex) {
        this.description = description;
        this.separator = separator;
        this.expectedTokenCount = expectedTokenCount;
        this.nameTokenIndex = nameTokenIndex;
    }

    /**
     * Extracts the queue or topic name from a destination identifier.
     */
    public String destinationName(String destination) {
        if (destination == null) {
            throw InvalidDestinationIdentifierException.missing(description);
        }
        String[] tokens = destination.split(Pattern.quote(separator), -1);
        if (tokens.length != expectedTokenCount) {
            throw InvalidDestinationIdentifierException.unexpectedTokenCount(
                    description, separator, expectedTokenCount, tokens.length);
        }
        String name = tokens[nameTokenIndex];
        if (name.isEmpty()) {
            throw InvalidDestinationIdentifierException.emptyName(description, destination);
        }
        return name;
    }
}
