/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arc.core.ack;

import com.arc.core.PendingAckTable;
import com.arc.core.PendingAckTable.PendingAck;
import com.arc.core.exception.ChannelClosedException;
import com.arc.core.redelivery.RedeliveryRouter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.function.BooleanSupplier;

/**
 * Applies ack, nack and reject calls of the application to the pending table of a
 * channel and emits the matching frame intent.
 * <p>
 * Removal and emission happen under the channel lock so intents reach the transport in
 * the order their settlements took effect. Requeued deliveries are handed to the
 * {@link RedeliveryRouter} after the lock is released.
 * <p>
 * The application settles with channel tags; frames carry the broker's tags. Copies the
 * client redelivered itself were already settled with the broker by the requeueing call,
 * so settling only such copies emits nothing.
 */
@Slf4j
public class AcknowledgmentEngine {

    private final int channelId;

    private final Lock lock;

    private final BooleanSupplier open;

    private final PendingAckTable pendingAcks;

    private final AckFrameSender sender;

    private final RedeliveryRouter redeliveryRouter;

    public AcknowledgmentEngine(int channelId, Lock lock, BooleanSupplier open, PendingAckTable pendingAcks,
                                AckFrameSender sender, RedeliveryRouter redeliveryRouter) {
        this.channelId = channelId;
        this.lock = lock;
        this.open = open;
        this.pendingAcks = pendingAcks;
        this.sender = sender;
        this.redeliveryRouter = redeliveryRouter;
    }

    public Settlement ack(long deliveryTag, boolean multiple) {
        return settle(deliveryTag, multiple, AckOutcome.ack());
    }

    public Settlement nack(long deliveryTag, boolean multiple, boolean requeue) {
        return settle(deliveryTag, multiple, AckOutcome.nack(requeue));
    }

    public Settlement reject(long deliveryTag, boolean requeue) {
        return settle(deliveryTag, false, AckOutcome.reject(requeue));
    }

    /**
     * Settles one delivery, or every pending delivery up to the tag when multiple is set
     *
     * @throws ChannelClosedException if the channel is closed
     * @throws com.arc.core.exception.UnknownDeliveryTagException if a single tag is not pending
     * @throws com.arc.core.exception.AckModeMismatchException if the tag was settled on dispatch
     * @throws com.arc.core.exception.PreconditionFailedException if a cumulative tag was never issued
     */
    public Settlement settle(long deliveryTag, boolean multiple, AckOutcome outcome) {
        if (multiple && outcome.getKind() == AckOutcome.Kind.REJECT) {
            throw new IllegalArgumentException("basic.reject settles a single delivery");
        }
        Settlement settlement;
        lock.lock();
        try {
            if (!open.getAsBoolean()) {
                throw new ChannelClosedException("Channel " + channelId + " is closed");
            }
            List<PendingAck> settled = pendingAcks.remove(deliveryTag, multiple);
            settled.forEach(pendingAck -> pendingAck.transitionTo(outcome.terminalState()));
            AckIntent intent = toIntent(deliveryTag, multiple, outcome, settled);
            if (intent != null) {
                intent.sendTo(sender);
            }
            settlement = new Settlement(intent, settled);
        } finally {
            lock.unlock();
        }
        log.debug("Channel {} settled {} delivery(ies) with {} at deliveryTag: {}, multiple: {}",
            channelId, settlement.size(), outcome, deliveryTag, multiple);
        if (settlement.size() > 0) {
            if (outcome.isRequeue()) {
                redeliveryRouter.requeue(settlement.getSettled());
            } else if (outcome.getKind() != AckOutcome.Kind.ACK) {
                log.debug("Discarded {} delivery(ies) up to deliveryTag: {}", settlement.size(), deliveryTag);
            }
        }
        return settlement;
    }

    /**
     * Translates a settlement in channel tags into one frame in broker tags.
     * Broker tags grow with channel tags among the deliveries that came from frames, so the
     * highest broker tag settled covers exactly the broker's share of a cumulative settlement.
     *
     * @return the intent, or null when every settled delivery was a client redelivery
     */
    private AckIntent toIntent(long deliveryTag, boolean multiple, AckOutcome outcome, List<PendingAck> settled) {
        long brokerDeliveryTag = 0;
        for (PendingAck pendingAck : settled) {
            brokerDeliveryTag = Math.max(brokerDeliveryTag, pendingAck.getDelivery().getBrokerDeliveryTag());
        }
        if (brokerDeliveryTag == 0) {
            log.debug("Channel {} settlement at deliveryTag: {} has no broker counterpart", channelId, deliveryTag);
            return null;
        }
        if (multiple && deliveryTag == 0) {
            brokerDeliveryTag = 0;
        }
        return new AckIntent(channelId, outcome, brokerDeliveryTag, multiple);
    }
}
