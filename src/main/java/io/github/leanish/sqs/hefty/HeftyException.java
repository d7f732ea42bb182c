/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty;

/**
 * Base type for every failure raised by the hefty client and its codecs.
 */
public class HeftyException extends RuntimeException {

    public HeftyException(String message) {
        super(message);
    }

    public HeftyException(String message, Throwable cause) {
        super(message, cause);
    }

    static HeftyException bucketNotAccessible(String bucketName) {
        return new HeftyException("Bucket " + bucketName + " does not exist or is not accessible");
    }
}
