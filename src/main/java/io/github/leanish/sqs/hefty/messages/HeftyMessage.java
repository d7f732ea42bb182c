/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.messages;

import java.util.Map;

/**
 * A message body together with its attributes, as the producer handed it to the client.
 */
public record HeftyMessage(String body, Map<String, MessageAttribute> attributes) {

    public HeftyMessage {
        attributes = Map.copyOf(attributes);
    }

    public static HeftyMessage of(String body) {
        return new HeftyMessage(body, Map.of());
    }
}
