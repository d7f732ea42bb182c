/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.queue;

import io.github.leanish.sqs.hefty.HeftyException;

/**
 * Thrown when a call to SQS or SNS fails.
 */
public class QueueIOException extends HeftyException {

    public QueueIOException(String message, Throwable cause) {
        super(message, cause);
    }

    public static QueueIOException of(String operation, Throwable cause) {
        return new QueueIOException(operation + " failed: " + cause.getMessage(), cause);
    }
}
