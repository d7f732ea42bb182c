/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty;

import io.github.leanish.sqs.hefty.messages.SizeThresholds;
import lombok.With;

/**
 * Immutable settings shared by {@link HeftySqsClient} and {@link HeftySnsClient}.
 *
 * @param bucketName S3 bucket receiving offloaded payloads; must already exist
 * @param region region reported in reference messages; blank to use the queue or topic client's region
 * @param inlineLimitBytes messages up to this size are sent inline
 * @param maxLimitBytes messages above this size are rejected
 * @param alwaysOffload offload every message regardless of its size
 */
@With
public record HeftyClientConfiguration(
        String bucketName,
        String region,
        long inlineLimitBytes,
        long maxLimitBytes,
        boolean alwaysOffload) {

    public HeftyClientConfiguration {
        if (bucketName == null || bucketName.isBlank()) {
            throw new IllegalArgumentException("bucketName must not be blank");
        }
        if (region == null) {
            region = "";
        }
        // validates the limits eagerly
        new SizeThresholds(inlineLimitBytes, maxLimitBytes, alwaysOffload);
    }

    public static HeftyClientConfiguration forBucket(String bucketName) {
        return new HeftyClientConfiguration(
                bucketName,
                "",
                SizeThresholds.DEFAULT_INLINE_LIMIT_BYTES,
                SizeThresholds.DEFAULT_MAX_LIMIT_BYTES,
                false);
    }

    public SizeThresholds thresholds() {
        return new SizeThresholds(inlineLimitBytes, maxLimitBytes, alwaysOffload);
    }
}
