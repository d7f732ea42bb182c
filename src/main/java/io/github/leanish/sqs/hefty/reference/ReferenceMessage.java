/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.reference;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Sent through the queue in place of a message whose payload lives in S3.
 */
@JsonPropertyOrder({
        "identifier",
        "s3_region",
        "s3_bucket",
        "s3_key",
        "md5_digest_msg_body",
        "md5_digest_msg_attr"})
public record ReferenceMessage(
        @JsonProperty("identifier") String identifier,
        @JsonProperty("s3_region") String s3Region,
        @JsonProperty("s3_bucket") String s3Bucket,
        @JsonProperty("s3_key") String s3Key,
        @JsonProperty("md5_digest_msg_body") String bodyDigest,
        @JsonProperty("md5_digest_msg_attr") String attributeDigest) {

    /** Distinguishes reference messages from any other message body. */
    public static final String IDENTIFIER = "d3131a62e0224688b77a506fd333dac4";

    public static ReferenceMessage of(
            String s3Region,
            String s3Bucket,
            String s3Key,
            String bodyDigest,
            String attributeDigest) {
        return new ReferenceMessage(IDENTIFIER, s3Region, s3Bucket, s3Key, bodyDigest, attributeDigest);
    }
}
