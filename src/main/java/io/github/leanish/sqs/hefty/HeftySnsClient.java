/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty;

import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import io.github.leanish.sqs.hefty.messages.HeftyAttributes;
import io.github.leanish.sqs.hefty.messages.HeftyMessage;
import io.github.leanish.sqs.hefty.messages.MessageAttributes;
import io.github.leanish.sqs.hefty.messages.OffloadDecision;
import io.github.leanish.sqs.hefty.queue.SnsTopicClient;
import io.github.leanish.sqs.hefty.queue.TopicClient;
import io.github.leanish.sqs.hefty.reference.DestinationType;
import io.github.leanish.sqs.hefty.reference.ReferenceMessage;
import io.github.leanish.sqs.hefty.reference.ReferenceMessageCodec;
import io.github.leanish.sqs.hefty.store.BlobStore;
import io.github.leanish.sqs.hefty.store.S3BlobStore;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

/**
 * SNS client that offloads messages larger than the SNS limit to S3 and publishes a reference message instead.
 *
 * <p>The reference message is published as the {@code default} entry of a JSON message structure, so every
 * subscriber receives the plain reference JSON. SQS subscriptions should use raw message delivery so that
 * {@link HeftySqsClient} can resolve the payload on receive.
 */
public class HeftySnsClient {

    private static final String JSON_MESSAGE_STRUCTURE = "json";

    private final TopicClient topicClient;
    private final MessageOffloader offloader;
    private final ReferenceMessageCodec referenceCodec = ReferenceMessageCodec.pubSub();

    /**
     * @throws HeftyException when the configured bucket does not exist or is not accessible
     */
    public HeftySnsClient(TopicClient topicClient, BlobStore blobStore, HeftyClientConfiguration configuration) {
        if (!blobStore.exists(configuration.bucketName())) {
            throw HeftyException.bucketNotAccessible(configuration.bucketName());
        }
        this.topicClient = topicClient;
        this.offloader = new MessageOffloader(blobStore, configuration);
    }

    public static HeftySnsClient create(SnsClient snsClient, S3Client s3Client, HeftyClientConfiguration configuration) {
        HeftyClientConfiguration effective = configuration;
        if (configuration.region().isBlank()) {
            Region region = snsClient.serviceClientConfiguration().region();
            effective = configuration.withRegion(region == null ? "" : region.id());
        }
        return new HeftySnsClient(new SnsTopicClient(snsClient), new S3BlobStore(s3Client), effective);
    }

    /**
     * Publishes the message inline or offloads it to S3.
     *
     * @throws MessageTooLargeException when the message exceeds the configured ceiling
     */
    public PublishResponse publish(PublishRequest request) {
        if (StringUtils.isEmpty(request.message())) {
            return topicClient.publish(request);
        }

        HeftyMessage message = new HeftyMessage(
                request.message(),
                MessageAttributes.fromSns(request.messageAttributes()));
        if (offloader.classify(message) == OffloadDecision.SEND_INLINE) {
            return topicClient.publish(request);
        }

        ReferenceMessage referenceMessage = offloader.offload(
                message,
                request.topicArn(),
                DestinationType.TOPIC_ARN,
                referenceCodec);
        return topicClient.publish(request.toBuilder()
                .message(referenceCodec.toTransport(referenceMessage))
                .messageStructure(JSON_MESSAGE_STRUCTURE)
                .messageAttributes(Map.of(
                        HeftyAttributes.CLIENT_VERSION,
                        MessageAttributes.snsStringAttribute(HeftyAttributes.CLIENT_VERSION_VALUE)))
                .build());
    }
}
