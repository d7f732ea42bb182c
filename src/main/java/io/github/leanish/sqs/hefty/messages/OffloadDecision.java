/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.messages;

/**
 * Outcome of classifying a message by size.
 */
public enum OffloadDecision {
    /** Fits the queue natively; sent untouched. */
    SEND_INLINE,
    /** Stored in S3; a reference message is sent instead. */
    SEND_OFFLOADED,
    /** Larger than the offload ceiling; never sent. */
    REJECT
}
