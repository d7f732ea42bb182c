/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.messages;

import com.google.errorprone.annotations.Immutable;

/**
 * Size limits deciding between inline delivery, offloading and rejection.
 *
 * @param inlineLimitBytes largest message the queue accepts natively
 * @param maxLimitBytes largest message that will ever be offloaded
 * @param alwaysOffload offload every message up to {@code maxLimitBytes}, regardless of its size
 */
@Immutable
public record SizeThresholds(long inlineLimitBytes, long maxLimitBytes, boolean alwaysOffload) {

    public static final long DEFAULT_INLINE_LIMIT_BYTES = 262_144;
    public static final long DEFAULT_MAX_LIMIT_BYTES = 26_214_400;

    public SizeThresholds {
        if (inlineLimitBytes < 0) {
            throw new IllegalArgumentException("inlineLimitBytes must not be negative: " + inlineLimitBytes);
        }
        if (maxLimitBytes < inlineLimitBytes) {
            throw new IllegalArgumentException(
                    "maxLimitBytes (" + maxLimitBytes + ") must not be lower than inlineLimitBytes (" + inlineLimitBytes + ")");
        }
    }

    public static SizeThresholds defaults() {
        return new SizeThresholds(DEFAULT_INLINE_LIMIT_BYTES, DEFAULT_MAX_LIMIT_BYTES, false);
    }

    public OffloadDecision classify(long size) {
        if (size > maxLimitBytes) {
            return OffloadDecision.REJECT;
        }
        if (alwaysOffload || size > inlineLimitBytes) {
            return OffloadDecision.SEND_OFFLOADED;
        }
        return OffloadDecision.SEND_INLINE;
    }
}
