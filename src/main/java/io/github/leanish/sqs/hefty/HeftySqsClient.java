/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.leanish.sqs.hefty.digest.MessageDigests;
import io.github.leanish.sqs.hefty.errors.ErrorMessageCodec;
import io.github.leanish.sqs.hefty.messages.HeftyAttributes;
import io.github.leanish.sqs.hefty.messages.HeftyMessage;
import io.github.leanish.sqs.hefty.messages.MessageAttributes;
import io.github.leanish.sqs.hefty.messages.OffloadDecision;
import io.github.leanish.sqs.hefty.payload.HeftyPayloadCodec;
import io.github.leanish.sqs.hefty.queue.QueueClient;
import io.github.leanish.sqs.hefty.queue.SqsQueueClient;
import io.github.leanish.sqs.hefty.receipt.ReceiptHandle;
import io.github.leanish.sqs.hefty.receipt.ReceiptHandleCodec;
import io.github.leanish.sqs.hefty.reference.DestinationType;
import io.github.leanish.sqs.hefty.reference.ReferenceMessage;
import io.github.leanish.sqs.hefty.reference.ReferenceMessageCodec;
import io.github.leanish.sqs.hefty.store.BlobStore;
import io.github.leanish.sqs.hefty.store.S3BlobStore;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityBatchRequest;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityBatchRequestEntry;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityBatchResponse;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityRequest;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityResponse;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchRequestEntry;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageResponse;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlResponse;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

/**
 * SQS client that transparently offloads messages larger than the SQS limit to S3.
 *
 * <p>Messages going through {@link #sendMessage} are classified by size: small ones are sent as they are,
 * large ones are uploaded to S3 and replaced by a reference message. {@link #receiveMessage} downloads
 * offloaded payloads and hands back the original body, attributes and digests, with a receipt handle that
 * {@link #deleteMessage}, {@link #changeMessageVisibility} and their batch variants understand.
 * Batch sends are not offloaded.
 */
public class HeftySqsClient {

    private static final Logger logger = LoggerFactory.getLogger(HeftySqsClient.class);

    private static final String ALL_ATTRIBUTES = "All";
    private static final String ALL_ATTRIBUTES_WILDCARD = ".*";

    private final QueueClient queueClient;
    private final BlobStore blobStore;
    private final MessageOffloader offloader;
    private final ReferenceMessageCodec referenceCodec = ReferenceMessageCodec.direct();
    private final ReceiptHandleCodec receiptHandleCodec = new ReceiptHandleCodec();
    private final HeftyPayloadCodec payloadCodec = new HeftyPayloadCodec();

    /**
     * @throws HeftyException when the configured bucket does not exist or is not accessible
     */
    public HeftySqsClient(QueueClient queueClient, BlobStore blobStore, HeftyClientConfiguration configuration) {
        if (!blobStore.exists(configuration.bucketName())) {
            throw HeftyException.bucketNotAccessible(configuration.bucketName());
        }
        this.queueClient = queueClient;
        this.blobStore = blobStore;
        this.offloader = new MessageOffloader(blobStore, configuration);
    }

    public static HeftySqsClient create(SqsClient sqsClient, S3Client s3Client, HeftyClientConfiguration configuration) {
        HeftyClientConfiguration effective = configuration;
        if (configuration.region().isBlank()) {
            Region region = sqsClient.serviceClientConfiguration().region();
            effective = configuration.withRegion(region == null ? "" : region.id());
        }
        return new HeftySqsClient(new SqsQueueClient(sqsClient), new S3BlobStore(s3Client), effective);
    }

    /**
     * Sends the message inline or offloads it to S3. Offloaded sends report the digests of the original
     * message in {@code md5OfMessageBody} and {@code md5OfMessageAttributes}.
     *
     * @throws MessageTooLargeException when the message exceeds the configured ceiling
     */
    public SendMessageResponse sendMessage(SendMessageRequest request) {
        if (StringUtils.isEmpty(request.messageBody())) {
            // invalid input is left for SQS to reject
            return queueClient.sendMessage(request);
        }

        HeftyMessage message = new HeftyMessage(
                request.messageBody(),
                MessageAttributes.fromSqs(request.messageAttributes()));
        if (offloader.classify(message) == OffloadDecision.SEND_INLINE) {
            return queueClient.sendMessage(request);
        }

        ReferenceMessage referenceMessage = offloader.offload(
                message,
                request.queueUrl(),
                DestinationType.QUEUE_URL,
                referenceCodec);
        SendMessageRequest referenceRequest = request.toBuilder()
                .messageBody(referenceCodec.toTransport(referenceMessage))
                .messageAttributes(Map.of(
                        HeftyAttributes.CLIENT_VERSION,
                        MessageAttributes.sqsStringAttribute(HeftyAttributes.CLIENT_VERSION_VALUE)))
                .build();

        SendMessageResponse response = queueClient.sendMessage(referenceRequest);
        return response.toBuilder()
                .md5OfMessageBody(referenceMessage.bodyDigest())
                .md5OfMessageAttributes(StringUtils.defaultIfEmpty(referenceMessage.attributeDigest(), null))
                .build();
    }

    /**
     * Receives messages and resolves offloaded ones from S3.
     * Fails as a whole when any offloaded message cannot be resolved.
     */
    public ReceiveMessageResponse receiveMessage(ReceiveMessageRequest request) {
        ReceiveMessageResponse response = queueClient.receiveMessage(ensureMarkerRequested(request));
        if (response.messages().isEmpty()) {
            return response;
        }

        List<Message> resolved = response.messages()
                .stream()
                .map(this::resolveMessage)
                .toList();
        return response.toBuilder()
                .messages(resolved)
                .build();
    }

    /**
     * Receives messages like {@link #receiveMessage}, but replaces every offloaded message that cannot be
     * resolved with a message whose body is an error message (see {@link ErrorMessageCodec}) instead of
     * failing the whole call. Failures of the receive call itself still propagate.
     */
    public ReceiveMessageResponse receiveMessageWithErrorMarkers(ReceiveMessageRequest request) {
        ReceiveMessageResponse response = queueClient.receiveMessage(ensureMarkerRequested(request));
        if (response.messages().isEmpty()) {
            return response;
        }

        List<Message> resolved = new ArrayList<>(response.messages().size());
        for (Message message : response.messages()) {
            resolved.add(resolveOrMark(message));
        }
        return response.toBuilder()
                .messages(resolved)
                .build();
    }

    /**
     * Deletes the message and, for offloaded messages, its payload in S3 first.
     */
    public DeleteMessageResponse deleteMessage(DeleteMessageRequest request) {
        if (request.receiptHandle() == null) {
            return queueClient.deleteMessage(request);
        }

        ReceiptHandle receiptHandle = receiptHandleCodec.unwrap(request.receiptHandle());
        if (!receiptHandle.offloaded()) {
            return queueClient.deleteMessage(request);
        }

        blobStore.delete(receiptHandle.bucket(), receiptHandle.key());
        return queueClient.deleteMessage(request.toBuilder()
                .receiptHandle(receiptHandle.nativeHandle())
                .build());
    }

    /**
     * Deletes a batch of messages. Payloads of offloaded entries are deleted from S3 before the batch is
     * forwarded; a failed S3 delete aborts the call and no entry is deleted from the queue.
     */
    public DeleteMessageBatchResponse deleteMessageBatch(DeleteMessageBatchRequest request) {
        List<DeleteMessageBatchRequestEntry> entries = new ArrayList<>(request.entries().size());
        for (DeleteMessageBatchRequestEntry entry : request.entries()) {
            if (entry.receiptHandle() == null) {
                entries.add(entry);
                continue;
            }
            ReceiptHandle receiptHandle = receiptHandleCodec.unwrap(entry.receiptHandle());
            if (receiptHandle.offloaded()) {
                blobStore.delete(receiptHandle.bucket(), receiptHandle.key());
            }
            entries.add(entry.toBuilder()
                    .receiptHandle(receiptHandle.nativeHandle())
                    .build());
        }
        return queueClient.deleteMessageBatch(request.toBuilder()
                .entries(entries)
                .build());
    }

    public ChangeMessageVisibilityResponse changeMessageVisibility(ChangeMessageVisibilityRequest request) {
        if (request.receiptHandle() == null) {
            return queueClient.changeMessageVisibility(request);
        }
        ReceiptHandle receiptHandle = receiptHandleCodec.unwrap(request.receiptHandle());
        return queueClient.changeMessageVisibility(request.toBuilder()
                .receiptHandle(receiptHandle.nativeHandle())
                .build());
    }

    public ChangeMessageVisibilityBatchResponse changeMessageVisibilityBatch(
            ChangeMessageVisibilityBatchRequest request) {
        List<ChangeMessageVisibilityBatchRequestEntry> entries = new ArrayList<>(request.entries().size());
        for (ChangeMessageVisibilityBatchRequestEntry entry : request.entries()) {
            if (entry.receiptHandle() == null) {
                entries.add(entry);
                continue;
            }
            entries.add(entry.toBuilder()
                    .receiptHandle(receiptHandleCodec.unwrap(entry.receiptHandle()).nativeHandle())
                    .build());
        }
        return queueClient.changeMessageVisibilityBatch(request.toBuilder()
                .entries(entries)
                .build());
    }

    /**
     * Forwarded untouched: batch sends are never offloaded.
     */
    public SendMessageBatchResponse sendMessageBatch(SendMessageBatchRequest request) {
        return queueClient.sendMessageBatch(request);
    }

    public GetQueueUrlResponse getQueueUrl(GetQueueUrlRequest request) {
        return queueClient.getQueueUrl(request);
    }

    private ReceiveMessageRequest ensureMarkerRequested(ReceiveMessageRequest request) {
        List<String> attributeNames = request.messageAttributeNames();
        if (attributeNames.contains(ALL_ATTRIBUTES)
                || attributeNames.contains(ALL_ATTRIBUTES_WILDCARD)
                || attributeNames.contains(HeftyAttributes.CLIENT_VERSION)) {
            return request;
        }

        List<String> requested = new ArrayList<>(attributeNames);
        requested.add(HeftyAttributes.CLIENT_VERSION);
        return request.toBuilder()
                .messageAttributeNames(requested)
                .build();
    }

    private static boolean isOffloaded(Message message) {
        return message.messageAttributes().containsKey(HeftyAttributes.CLIENT_VERSION)
                || ReferenceMessageCodec.isReferenceMessage(message.body());
    }

    private Message resolveMessage(Message message) {
        if (!isOffloaded(message)) {
            return message;
        }
        return resolve(message, referenceCodec.fromTransport(message.body()));
    }

    private Message resolve(Message message, ReferenceMessage referenceMessage) {
        byte[] payload = blobStore.get(referenceMessage.s3Bucket(), referenceMessage.s3Key());
        HeftyMessage original = payloadCodec.deserialize(payload);

        return message.toBuilder()
                .body(original.body())
                .messageAttributes(MessageAttributes.toSqs(original.attributes()))
                .md5OfBody(referenceMessage.bodyDigest())
                .md5OfMessageAttributes(StringUtils.defaultIfEmpty(referenceMessage.attributeDigest(), null))
                .receiptHandle(receiptHandleCodec.wrap(
                        message.receiptHandle(),
                        referenceMessage.s3Bucket(),
                        referenceMessage.s3Key()))
                .build();
    }

    private Message resolveOrMark(Message message) {
        if (!isOffloaded(message)) {
            return message;
        }

        @Nullable
        ReferenceMessage referenceMessage = null;
        try {
            referenceMessage = referenceCodec.fromTransport(message.body());
            return resolve(message, referenceMessage);
        } catch (HeftyException e) {
            logger.warn("Unable to resolve offloaded message {}, delivering an error message instead",
                    message.messageId(), e);
            return errorMarker(message, referenceMessage, e);
        }
    }

    private Message errorMarker(Message message, @Nullable ReferenceMessage referenceMessage, HeftyException error) {
        String body = ErrorMessageCodec.toJson(ErrorMessageCodec.create(error, referenceMessage));
        String receiptHandle = message.receiptHandle();
        if (referenceMessage != null) {
            receiptHandle = receiptHandleCodec.wrap(
                    message.receiptHandle(),
                    referenceMessage.s3Bucket(),
                    referenceMessage.s3Key());
        }
        return message.toBuilder()
                .body(body)
                .md5OfBody(MessageDigests.bodyDigest(body))
                .receiptHandle(receiptHandle)
                .build();
    }
}
