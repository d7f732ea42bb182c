/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.digest;

import io.github.leanish.sqs.hefty.HeftyException;

/**
 * Thrown when a digest algorithm is unavailable at runtime.
 */
public class UnavailableAlgorithmException extends HeftyException {

    public UnavailableAlgorithmException(String message, Throwable cause) {
        super(message, cause);
    }
}
