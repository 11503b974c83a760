package com.chat.relay.service.dispatch;

import com.chat.relay.service.format.Batch;

/**
 * Performs a single delivery attempt of one batch.
 *
 * Implementations never sleep or retry: waiting and retry policy belong to
 * {@link DispatchWorker}.
 */
public interface WebhookSender {

    /**
     * Sends the batch once and classifies the response.
     *
     * @param batch the batch to deliver
     * @return the outcome of the attempt, never null
     */
    DispatchOutcome send(Batch batch);
}
