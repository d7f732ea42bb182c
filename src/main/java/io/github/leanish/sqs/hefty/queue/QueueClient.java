/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.queue;

import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityBatchRequest;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityBatchResponse;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityRequest;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityResponse;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageResponse;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlResponse;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

/**
 * The SQS operations the hefty client relies on.
 * Implementations report failures as {@link QueueIOException} and never retry on their own.
 */
public interface QueueClient {

    SendMessageResponse sendMessage(SendMessageRequest request);

    ReceiveMessageResponse receiveMessage(ReceiveMessageRequest request);

    DeleteMessageResponse deleteMessage(DeleteMessageRequest request);

    DeleteMessageBatchResponse deleteMessageBatch(DeleteMessageBatchRequest request);

    SendMessageBatchResponse sendMessageBatch(SendMessageBatchRequest request);

    ChangeMessageVisibilityResponse changeMessageVisibility(ChangeMessageVisibilityRequest request);

    ChangeMessageVisibilityBatchResponse changeMessageVisibilityBatch(ChangeMessageVisibilityBatchRequest request);

    GetQueueUrlResponse getQueueUrl(GetQueueUrlRequest request);
}
