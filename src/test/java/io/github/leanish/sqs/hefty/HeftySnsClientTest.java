/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import io.github.leanish.sqs.hefty.digest.MessageDigests;
import io.github.leanish.sqs.hefty.messages.HeftyAttributes;
import io.github.leanish.sqs.hefty.messages.HeftyMessage;
import io.github.leanish.sqs.hefty.messages.MessageAttributes;
import io.github.leanish.sqs.hefty.payload.HeftyPayloadCodec;
import io.github.leanish.sqs.hefty.queue.TopicClient;
import io.github.leanish.sqs.hefty.reference.InvalidDestinationIdentifierException;
import io.github.leanish.sqs.hefty.reference.ReferenceMessage;
import io.github.leanish.sqs.hefty.reference.ReferenceMessageCodec;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

class HeftySnsClientTest {

    private static final String BUCKET = "hefty-bucket";
    private static final String TOPIC_ARN = "arn:aws:sns:us-west-2:765908583888:MyTopic";
    private static final HeftyClientConfiguration CONFIGURATION = HeftyClientConfiguration.forBucket(BUCKET)
            .withRegion("us-west-2");

    private final TopicClient topicClient = Mockito.mock(TopicClient.class);
    private final InMemoryBlobStore blobStore = new InMemoryBlobStore(BUCKET);

    @BeforeEach
    void setUp() {
        when(topicClient.publish(any(PublishRequest.class)))
                .thenReturn(PublishResponse.builder()
                        .messageId("id-1")
                        .build());
    }

    @Test
    void constructor_bucketMissing() {
        assertThatThrownBy(() -> new HeftySnsClient(
                topicClient,
                new InMemoryBlobStore(),
                CONFIGURATION))
                .isInstanceOf(HeftyException.class)
                .hasMessage("Bucket hefty-bucket does not exist or is not accessible");
    }

    @Test
    void publish_inline() {
        HeftySnsClient client = new HeftySnsClient(topicClient, blobStore, CONFIGURATION);
        PublishRequest request = PublishRequest.builder()
                .topicArn(TOPIC_ARN)
                .message("hi")
                .build();

        client.publish(request);

        verify(topicClient).publish(request);
        assertThat(blobStore.objects())
                .isEmpty();
    }

    @Test
    void publish_offloaded() {
        HeftySnsClient client = new HeftySnsClient(topicClient, blobStore, CONFIGURATION);
        String message = "x".repeat(300_000);
        Map<String, MessageAttributeValue> attributes = Map.of(
                "shopId", MessageAttributes.snsStringAttribute("shop-1"));

        PublishResponse response = client.publish(PublishRequest.builder()
                .topicArn(TOPIC_ARN)
                .message(message)
                .messageAttributes(attributes)
                .build());

        ArgumentCaptor<PublishRequest> captor = ArgumentCaptor.forClass(PublishRequest.class);
        verify(topicClient).publish(captor.capture());
        PublishRequest published = captor.getValue();
        assertThat(response.messageId())
                .isEqualTo("id-1");
        assertThat(published.topicArn())
                .isEqualTo(TOPIC_ARN);
        assertThat(published.messageStructure())
                .isEqualTo("json");
        assertThat(published.messageAttributes())
                .containsOnlyKeys(HeftyAttributes.CLIENT_VERSION);

        ReferenceMessage referenceMessage = ReferenceMessageCodec.pubSub().fromTransport(published.message());
        assertThat(referenceMessage.s3Key())
                .startsWith("MyTopic/");
        assertThat(referenceMessage.bodyDigest())
                .isEqualTo(MessageDigests.bodyDigest(message));

        HeftyMessage stored = new HeftyPayloadCodec().deserialize(blobStore.object(BUCKET, referenceMessage.s3Key()));
        assertThat(stored)
                .isEqualTo(new HeftyMessage(message, MessageAttributes.fromSns(attributes)));
    }

    @Test
    void publish_tooLarge() {
        HeftySnsClient client = new HeftySnsClient(
                topicClient,
                blobStore,
                CONFIGURATION.withInlineLimitBytes(10).withMaxLimitBytes(20));
        PublishRequest request = PublishRequest.builder()
                .topicArn(TOPIC_ARN)
                .message("x".repeat(21))
                .build();

        assertThatThrownBy(() -> client.publish(request))
                .isInstanceOf(MessageTooLargeException.class)
                .hasMessage("Message size of 21 bytes greater than allowed message size of 20 bytes");
        verifyNoInteractions(topicClient);
    }

    @Test
    void publish_invalidTopicArn() {
        HeftySnsClient client = new HeftySnsClient(topicClient, blobStore, CONFIGURATION.withAlwaysOffload(true));
        PublishRequest request = PublishRequest.builder()
                .topicArn("arn:aws:sns:MyTopic")
                .message("hi")
                .build();

        assertThatThrownBy(() -> client.publish(request))
                .isInstanceOf(InvalidDestinationIdentifierException.class)
                .hasMessage("Expected 6 tokens when splitting topicArn by ':' but received 4");
        verifyNoInteractions(topicClient);
        assertThat(blobStore.objects())
                .isEmpty();
    }
}
