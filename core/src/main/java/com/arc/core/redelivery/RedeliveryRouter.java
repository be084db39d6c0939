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
package com.arc.core.redelivery;

import com.arc.core.ChannelEventListener;
import com.arc.core.Consumer;
import com.arc.core.ConsumerRegistry;
import com.arc.core.Delivery;
import com.arc.core.DeliveryDispatcher;
import com.arc.core.DeliveryTagAllocator;
import com.arc.core.PendingAckTable.PendingAck;
import com.arc.core.exception.NoActiveConsumerException;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.function.BooleanSupplier;

/**
 * Offers requeued messages again to the consumers of their queue.
 * <p>
 * Consumers are taken round-robin from {@link ConsumerRegistry#candidatesFor(String)}, so the
 * consumer that rejected a message is not necessarily the one that sees it next. Every
 * redelivery carries a fresh delivery tag and the redelivered flag. Messages requeued while a
 * queue has no consumer are held until one subscribes.
 */
@Slf4j
public class RedeliveryRouter {

    private final int channelId;

    private final Lock lock;

    private final BooleanSupplier open;

    private final ConsumerRegistry consumerRegistry;

    private final DeliveryTagAllocator tagAllocator;

    private final DeliveryDispatcher dispatcher;

    private final ChannelEventListener listener;

    // Map: queueName -> LogicalQueue
    private final Map<String, LogicalQueue> queues = new HashMap<>();

    public RedeliveryRouter(int channelId, Lock lock, BooleanSupplier open, ConsumerRegistry consumerRegistry,
                            DeliveryTagAllocator tagAllocator, DeliveryDispatcher dispatcher,
                            ChannelEventListener listener) {
        this.channelId = channelId;
        this.lock = lock;
        this.open = open;
        this.consumerRegistry = consumerRegistry;
        this.tagAllocator = tagAllocator;
        this.dispatcher = dispatcher;
        this.listener = listener;
    }

    /**
     * Returns settled deliveries to their queues and redelivers them where a consumer is available.
     * A queue without consumers keeps its messages and is reported as pending redelivery.
     */
    public void requeue(List<PendingAck> pendingAcks) {
        Set<String> touched = new LinkedHashSet<>();
        lock.lock();
        try {
            if (!open.getAsBoolean()) {
                log.debug("Channel {} closed, not requeueing {} deliveries", channelId, pendingAcks.size());
                return;
            }
            for (PendingAck pendingAck : pendingAcks) {
                queueFor(pendingAck.getQueueName()).offer(pendingAck.getDelivery());
                touched.add(pendingAck.getQueueName());
            }
        } finally {
            lock.unlock();
        }
        for (String queueName : touched) {
            try {
                redeliver(queueName);
            } catch (NoActiveConsumerException e) {
                int held = heldCount(queueName);
                log.debug("Redelivery pending on channel {}: {}", channelId, e.getMessage());
                listener.onRedeliveryPending(channelId, queueName, held);
            }
        }
    }

    /**
     * Offers every held message of a queue to its consumers
     *
     * @return the number of messages redelivered
     * @throws NoActiveConsumerException if messages remain held because the queue has no consumer
     */
    public int redeliver(String queueName) {
        int redelivered = 0;
        lock.lock();
        try {
            LogicalQueue queue = queues.get(queueName);
            if (queue == null) {
                return 0;
            }
            while (!queue.isEmpty() && open.getAsBoolean()) {
                List<Consumer> candidates = consumerRegistry.candidatesFor(queueName);
                if (candidates.isEmpty()) {
                    throw new NoActiveConsumerException("Queue '" + queueName + "' holds " + queue.size()
                        + " message(s) for redelivery but has no active consumer");
                }
                Consumer consumer = queue.nextCandidate(candidates);
                Delivery delivery = queue.poll().redeliver(tagAllocator.next(), consumer.getConsumerTag());
                dispatcher.dispatch(delivery);
                redelivered++;
            }
        } finally {
            lock.unlock();
        }
        if (redelivered > 0) {
            log.debug("Redelivered {} message(s) from queue {} on channel {}", redelivered, queueName, channelId);
        }
        return redelivered;
    }

    public int heldCount(String queueName) {
        lock.lock();
        try {
            LogicalQueue queue = queues.get(queueName);
            return queue == null ? 0 : queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discards every held message, used when the channel closes
     *
     * @return the number of messages discarded
     */
    public int clear() {
        lock.lock();
        try {
            int discarded = queues.values().stream().mapToInt(LogicalQueue::clear).sum();
            queues.clear();
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    private LogicalQueue queueFor(String queueName) {
        return queues.computeIfAbsent(queueName, LogicalQueue::new);
    }
}
