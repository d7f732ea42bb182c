/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.queue;

import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

/**
 * {@link TopicClient} backed by the AWS SDK v2 {@link SnsClient}.
 */
public class SnsTopicClient implements TopicClient {

    private final SnsClient snsClient;

    public SnsTopicClient(SnsClient snsClient) {
        this.snsClient = snsClient;
    }

    @Override
    public PublishResponse publish(PublishRequest request) {
        try {
            return snsClient.publish(request);
        } catch (SdkException e) {
            throw QueueIOException.of("Publish", e);
        }
    }
}
