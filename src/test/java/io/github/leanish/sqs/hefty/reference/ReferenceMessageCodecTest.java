/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.reference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ReferenceMessageCodecTest {

    private static final String QUEUE_URL = "https://sqs.us-west-2.amazonaws.com/765908583888/MyTestQueue";
    private static final String TOPIC_ARN = "arn:aws:sns:us-west-2:765908583888:MyTopic";
    private static final String CANONICAL_JSON = "{\"identifier\":\"d3131a62e0224688b77a506fd333dac4\","
            + "\"s3_region\":\"us-west-2\","
            + "\"s3_bucket\":\"bucket-1\","
            + "\"s3_key\":\"MyTestQueue/0d9b1f6e-5c1a-4c1f-9d59-1f5d1c9e1a11\","
            + "\"md5_digest_msg_body\":\"49f68a5c8493ec2c0bf489821c21fc3b\","
            + "\"md5_digest_msg_attr\":\"\"}";

    private final ReferenceMessageCodec codec = ReferenceMessageCodec.direct();

    @Test
    void build_queueUrl() {
        ReferenceMessage referenceMessage = codec.build(
                QUEUE_URL,
                DestinationType.QUEUE_URL,
                "bucket-1",
                "us-west-2",
                "body-md5",
                "attr-md5");

        assertThat(referenceMessage.identifier())
                .isEqualTo(ReferenceMessage.IDENTIFIER);
        assertThat(referenceMessage.s3Bucket())
                .isEqualTo("bucket-1");
        assertThat(referenceMessage.s3Region())
                .isEqualTo("us-west-2");
        assertThat(referenceMessage.bodyDigest())
                .isEqualTo("body-md5");
        assertThat(referenceMessage.attributeDigest())
                .isEqualTo("attr-md5");
        assertThat(referenceMessage.s3Key())
                .startsWith("MyTestQueue/");
        assertThat(UUID.fromString(referenceMessage.s3Key().substring("MyTestQueue/".length())))
                .isNotNull();
    }

    @Test
    void build_topicArn() {
        ReferenceMessage referenceMessage = codec.build(
                TOPIC_ARN,
                DestinationType.TOPIC_ARN,
                "bucket-1",
                "us-west-2",
                "body-md5",
                "");

        assertThat(referenceMessage.s3Key())
                .startsWith("MyTopic/");
    }

    @Test
    void build_keysNeverRepeat() {
        ReferenceMessage first = codec.build(QUEUE_URL, DestinationType.QUEUE_URL, "b", "r", "d", "");
        ReferenceMessage second = codec.build(QUEUE_URL, DestinationType.QUEUE_URL, "b", "r", "d", "");

        assertThat(first.s3Key())
                .isNotEqualTo(second.s3Key());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "https://sqs.us-west-2.amazonaws.com/MyTestQueue",
            "https://sqs.us-west-2.amazonaws.com/765908583888/MyTestQueue/extra",
            "MyTestQueue"})
    void build_invalidQueueUrl(String queueUrl) {
        assertThatThrownBy(() -> codec.build(queueUrl, DestinationType.QUEUE_URL, "b", "r", "d", ""))
                .isInstanceOf(InvalidDestinationIdentifierException.class)
                .hasMessageStartingWith("Expected 5 tokens when splitting queueUrl by '/' but received ");
    }

    @Test
    void build_invalidTopicArn() {
        assertThatThrownBy(() -> codec.build("arn:aws:sns:MyTopic", DestinationType.TOPIC_ARN, "b", "r", "d", ""))
                .isInstanceOf(InvalidDestinationIdentifierException.class)
                .hasMessage("Expected 6 tokens when splitting topicArn by ':' but received 4");
    }

    @Test
    void build_missingDestination() {
        assertThatThrownBy(() -> codec.build(null, DestinationType.QUEUE_URL, "b", "r", "d", ""))
                .isInstanceOf(InvalidDestinationIdentifierException.class)
                .hasMessage("queueUrl is null");
    }

    @Test
    void build_emptyDestinationName() {
        assertThatThrownBy(() -> codec.build(
                "https://sqs.us-west-2.amazonaws.com/765908583888/",
                DestinationType.QUEUE_URL,
                "b",
                "r",
                "d",
                ""))
                .isInstanceOf(InvalidDestinationIdentifierException.class)
                .hasMessage("Empty destination name in queueUrl: https://sqs.us-west-2.amazonaws.com/765908583888/");
    }

    @Test
    void toJson_canonicalForm() {
        ReferenceMessage referenceMessage = ReferenceMessage.of(
                "us-west-2",
                "bucket-1",
                "MyTestQueue/0d9b1f6e-5c1a-4c1f-9d59-1f5d1c9e1a11",
                "49f68a5c8493ec2c0bf489821c21fc3b",
                "");

        assertThat(codec.toJson(referenceMessage))
                .isEqualTo(CANONICAL_JSON);
    }

    @Test
    void fromJson_roundTripIsCanonical() {
        ReferenceMessage parsed = codec.fromJson(CANONICAL_JSON);

        assertThat(parsed.s3Key())
                .isEqualTo("MyTestQueue/0d9b1f6e-5c1a-4c1f-9d59-1f5d1c9e1a11");
        assertThat(codec.toJson(parsed))
                .isEqualTo(CANONICAL_JSON);
    }

    @Test
    void fromJson_acceptsIndentedJson() {
        String indented = "{\n\t\"identifier\": \"d3131a62e0224688b77a506fd333dac4\",\n"
                + "\t\"s3_region\": \"us-west-2\",\n"
                + "\t\"s3_bucket\": \"bucket-1\",\n"
                + "\t\"s3_key\": \"MyTestQueue/key\",\n"
                + "\t\"md5_digest_msg_body\": \"abc\",\n"
                + "\t\"md5_digest_msg_attr\": \"\"\n}";

        assertThat(codec.fromJson(indented))
                .isEqualTo(ReferenceMessage.of("us-west-2", "bucket-1", "MyTestQueue/key", "abc", ""));
    }

    @Test
    void fromJson_invalidJson() {
        assertThatThrownBy(() -> codec.fromJson("not-json"))
                .isInstanceOf(MalformedReferenceMessageException.class)
                .hasMessage("Unable to unmarshal reference message");
    }

    @Test
    void fromJson_unexpectedIdentifier() {
        String json = CANONICAL_JSON.replace(ReferenceMessage.IDENTIFIER, "other");

        assertThatThrownBy(() -> codec.fromJson(json))
                .isInstanceOf(MalformedReferenceMessageException.class)
                .hasMessage("Unexpected reference message identifier: other");
    }

    @Test
    void fromJson_missingKey() {
        String json = "{\"identifier\":\"d3131a62e0224688b77a506fd333dac4\",\"s3_bucket\":\"bucket-1\"}";

        assertThatThrownBy(() -> codec.fromJson(json))
                .isInstanceOf(MalformedReferenceMessageException.class)
                .hasMessage("Reference message is missing required field: s3_key");
    }

    @Test
    void isReferenceMessage_happyCase() {
        assertThat(ReferenceMessageCodec.isReferenceMessage(CANONICAL_JSON))
                .isTrue();
        assertThat(ReferenceMessageCodec.isReferenceMessage("{\"value\":42}"))
                .isFalse();
        assertThat(ReferenceMessageCodec.isReferenceMessage(" " + CANONICAL_JSON))
                .isFalse();
        assertThat(ReferenceMessageCodec.isReferenceMessage(null))
                .isFalse();
    }

    @Test
    void pubSub_wrapsInDefaultEntry() {
        ReferenceMessageCodec pubSub = ReferenceMessageCodec.pubSub();
        ReferenceMessage referenceMessage = pubSub.fromJson(CANONICAL_JSON);

        String transport = pubSub.toTransport(referenceMessage);

        assertThat(transport)
                .startsWith("{\"default\":\"{\\\"identifier\\\":");
        assertThat(pubSub.fromTransport(transport))
                .isEqualTo(referenceMessage);
        assertThat(ReferenceMessageCodec.isReferenceMessage(transport))
                .isFalse();
    }

    @Test
    void pubSub_missingDefaultEntry() {
        assertThatThrownBy(() -> ReferenceMessageCodec.pubSub().fromTransport("{\"other\":\"x\"}"))
                .isInstanceOf(MalformedReferenceMessageException.class)
                .hasMessage("Reference message is missing required field: default");
    }

    @Test
    void direct_transportIsPlainJson() {
        ReferenceMessage referenceMessage = codec.fromJson(CANONICAL_JSON);

        assertThat(codec.toTransport(referenceMessage))
                .isEqualTo(CANONICAL_JSON);
        assertThat(ReferenceMessageCodec.forEnvelope(TransportEnvelope.DIRECT))
                .isSameAs(codec);
        assertThat(ReferenceMessageCodec.forEnvelope(TransportEnvelope.PUB_SUB).envelope())
                .isEqualTo(TransportEnvelope.PUB_SUB);
    }
}
