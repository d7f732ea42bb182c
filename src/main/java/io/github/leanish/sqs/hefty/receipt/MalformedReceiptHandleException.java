/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.receipt;

import io.github.leanish.sqs.hefty.HeftyException;

/**
 * Thrown when a receipt handle carries the hefty marker but not the expected fields.
 */
public class MalformedReceiptHandleException extends HeftyException {

    private MalformedReceiptHandleException(String message) {
        super(message);
    }

    public static MalformedReceiptHandleException unexpectedTokenCount(int expected, int actual) {
        return new MalformedReceiptHandleException(
                "Expected number of tokens (" + expected + ") not available in receipt handle, found " + actual);
    }
}
