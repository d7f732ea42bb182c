/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.reference;

import java.io.UncheckedIOException;
import java.util.Map;
import java.util.UUID;

import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Builds, serializes and detects reference messages.
 *
 * <p>The serialized form is compact JSON with a fixed key order, so every reference message starts with
 * the same identifier prefix and can be told apart from ordinary bodies without parsing them.
 */
public class ReferenceMessageCodec {

    static final String JSON_PREFIX = "{\"identifier\":\"" + ReferenceMessage.IDENTIFIER + "\",";
    static final String PUB_SUB_DEFAULT_KEY = "default";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ReferenceMessageCodec DIRECT = new ReferenceMessageCodec(TransportEnvelope.DIRECT);
    private static final ReferenceMessageCodec PUB_SUB = new ReferenceMessageCodec(TransportEnvelope.PUB_SUB);

    private final TransportEnvelope envelope;

    private ReferenceMessageCodec(TransportEnvelope envelope) {
        this.envelope = envelope;
    }

    public static ReferenceMessageCodec direct() {
        return DIRECT;
    }

    public static ReferenceMessageCodec pubSub() {
        return PUB_SUB;
    }

    public static ReferenceMessageCodec forEnvelope(TransportEnvelope envelope) {
        return envelope == TransportEnvelope.DIRECT ? DIRECT : PUB_SUB;
    }

    public TransportEnvelope envelope() {
        return envelope;
    }

    /**
     * Creates the reference message for a payload about to be uploaded.
     * The S3 key is the destination name followed by a random UUID, so concurrent sends never share a key.
     */
    public ReferenceMessage build(
            @Nullable String destination,
            DestinationType destinationType,
            String bucket,
            String region,
            String bodyDigest,
            String attributeDigest) {
        String destinationName = destinationType.destinationName(destination);
        String key = destinationName + "/" + UUID.randomUUID();
        return ReferenceMessage.of(region, bucket, key, bodyDigest, attributeDigest);
    }

    public String toJson(ReferenceMessage referenceMessage) {
        try {
            return MAPPER.writeValueAsString(referenceMessage);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public ReferenceMessage fromJson(String json) {
        if (json == null) {
            throw MalformedReferenceMessageException.missingField("body");
        }
        ReferenceMessage referenceMessage;
        try {
            referenceMessage = MAPPER.readValue(json, ReferenceMessage.class);
        } catch (JsonProcessingException e) {
            throw MalformedReferenceMessageException.invalidJson(e);
        }
        if (referenceMessage == null) {
            throw MalformedReferenceMessageException.missingField("identifier");
        }
        if (!ReferenceMessage.IDENTIFIER.equals(referenceMessage.identifier())) {
            throw MalformedReferenceMessageException.unexpectedIdentifier(referenceMessage.identifier());
        }
        if (StringUtils.isBlank(referenceMessage.s3Bucket())) {
            throw MalformedReferenceMessageException.missingField("s3_bucket");
        }
        if (StringUtils.isBlank(referenceMessage.s3Key())) {
            throw MalformedReferenceMessageException.missingField("s3_key");
        }
        return referenceMessage;
    }

    /**
     * Frames the reference message for its channel according to this codec's {@link TransportEnvelope}.
     */
    public String toTransport(ReferenceMessage referenceMessage) {
        String json = toJson(referenceMessage);
        if (envelope == TransportEnvelope.DIRECT) {
            return json;
        }
        try {
            return MAPPER.writeValueAsString(Map.of(PUB_SUB_DEFAULT_KEY, json));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public ReferenceMessage fromTransport(String body) {
        if (envelope == TransportEnvelope.DIRECT) {
            return fromJson(body);
        }
        JsonNode structure;
        try {
            structure = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw MalformedReferenceMessageException.invalidJson(e);
        }
        JsonNode defaultMessage = structure == null ? null : structure.get(PUB_SUB_DEFAULT_KEY);
        if (defaultMessage == null || !defaultMessage.isTextual()) {
            throw MalformedReferenceMessageException.missingField(PUB_SUB_DEFAULT_KEY);
        }
        return fromJson(defaultMessage.textValue());
    }

    /**
     * Cheap prefix check; does not validate the rest of the message.
     */
    public static boolean isReferenceMessage(@Nullable String text) {
        return text != null && text.startsWith(JSON_PREFIX);
    }
}
