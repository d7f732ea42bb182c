/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.leanish.sqs.hefty.messages.HeftyMessage;
import io.github.leanish.sqs.hefty.messages.MessageSizeCalculator;
import io.github.leanish.sqs.hefty.messages.OffloadDecision;
import io.github.leanish.sqs.hefty.messages.SizeThresholds;
import io.github.leanish.sqs.hefty.payload.HeftyPayloadCodec;
import io.github.leanish.sqs.hefty.payload.SerializedPayload;
import io.github.leanish.sqs.hefty.reference.DestinationType;
import io.github.leanish.sqs.hefty.reference.ReferenceMessage;
import io.github.leanish.sqs.hefty.reference.ReferenceMessageCodec;
import io.github.leanish.sqs.hefty.store.BlobStore;

/**
 * Send-side steps shared by the SQS and SNS clients: classify, serialize, digest, upload.
 */
class MessageOffloader {

    private static final Logger logger = LoggerFactory.getLogger(MessageOffloader.class);

    private final BlobStore blobStore;
    private final String bucketName;
    private final String region;
    private final SizeThresholds thresholds;
    private final HeftyPayloadCodec payloadCodec = new HeftyPayloadCodec();

    MessageOffloader(BlobStore blobStore, HeftyClientConfiguration configuration) {
        this.blobStore = blobStore;
        this.bucketName = configuration.bucketName();
        this.region = configuration.region();
        this.thresholds = configuration.thresholds();
    }

    /**
     * @throws MessageTooLargeException when the message exceeds the offload ceiling
     */
    OffloadDecision classify(HeftyMessage message) {
        long size = MessageSizeCalculator.size(message);
        OffloadDecision decision = thresholds.classify(size);
        if (decision == OffloadDecision.REJECT) {
            throw MessageTooLargeException.of(size, thresholds.maxLimitBytes());
        }
        logger.debug("Message of {} bytes classified as {}", size, decision);
        return decision;
    }

    /**
     * Uploads the message to S3 and returns the reference message to send in its place.
     * If sending the reference fails afterwards, the uploaded object is left behind.
     */
    ReferenceMessage offload(
            HeftyMessage message,
            @Nullable String destination,
            DestinationType destinationType,
            ReferenceMessageCodec referenceCodec) {
        SerializedPayload payload = payloadCodec.serialize(message);
        ReferenceMessage referenceMessage = referenceCodec.build(
                destination,
                destinationType,
                bucketName,
                region,
                payload.bodyDigest(),
                payload.attributeDigest());

        blobStore.put(referenceMessage.s3Bucket(), referenceMessage.s3Key(), payload.bytes());
        logger.debug("Offloaded {} bytes to s3://{}/{}",
                payload.bytes().length, referenceMessage.s3Bucket(), referenceMessage.s3Key());
        return referenceMessage;
    }
}
