/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.reference;

/**
 * How a reference message is framed for the channel that carries it.
 */
public enum TransportEnvelope {
    /** The reference JSON is the message body (SQS). */
    DIRECT,
    /**
     * The reference JSON is the {@code default} entry of an SNS JSON message structure,
     * so every subscriber receives the plain reference JSON.
     */
    PUB_SUB
}
