/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.errors;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.github.leanish.sqs.hefty.reference.ReferenceMessage;

/**
 * Reports an offload failure through a message body, together with the reference message involved, if known.
 */
@JsonPropertyOrder({"identifier", "error", "reference_msg"})
public record ErrorMessage(
        @JsonProperty("identifier") String identifier,
        @JsonProperty("error") String error,
        @JsonProperty("reference_msg") @Nullable ReferenceMessage referenceMessage) {

    /** Distinguishes error messages from any other message body. */
    public static final String IDENTIFIER = "b58c8bae78504da3a2e32cceeb77d342";

    public static ErrorMessage of(String error, @Nullable ReferenceMessage referenceMessage) {
        return new ErrorMessage(IDENTIFIER, error, referenceMessage);
    }
}
