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
package com.arc.core;

import com.arc.core.PendingAckTable.PendingAck;
import com.arc.core.exception.ChannelClosedException;
import com.arc.core.exception.UnknownConsumerException;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.BooleanSupplier;

/**
 * Hands deliveries to consumer handlers.
 * <p>
 * Every consumer is pinned to one single-threaded executor of the channel's group when it
 * registers, so its handler sees deliveries one at a time in tag order while handlers of
 * different consumers may run in parallel. Handlers never run on the thread that decoded
 * the frame, and never while the channel lock is held.
 */
@Slf4j
public class DeliveryDispatcher {

    private final int channelId;

    private final Lock lock;

    private final BooleanSupplier open;

    private final ConsumerRegistry consumerRegistry;

    private final PendingAckTable pendingAcks;

    private final DeliveryTagAllocator tagAllocator;

    private final int dispatchThreads;

    private volatile EventExecutorGroup executorGroup;

    public DeliveryDispatcher(int channelId, Lock lock, BooleanSupplier open, ConsumerRegistry consumerRegistry,
                              PendingAckTable pendingAcks, DeliveryTagAllocator tagAllocator, int dispatchThreads) {
        this.channelId = channelId;
        this.lock = lock;
        this.open = open;
        this.consumerRegistry = consumerRegistry;
        this.pendingAcks = pendingAcks;
        this.tagAllocator = tagAllocator;
        this.dispatchThreads = dispatchThreads;
    }

    /**
     * Starts a fresh executor group
     */
    public void start() {
        executorGroup = new DefaultEventExecutorGroup(dispatchThreads,
            new DefaultThreadFactory("arc-channel-" + channelId + "-dispatch", true));
        log.debug("Dispatcher of channel {} started with {} threads", channelId, dispatchThreads);
    }

    /**
     * Executor a newly registered consumer is pinned to
     */
    public EventExecutor nextExecutor() {
        EventExecutorGroup group = executorGroup;
        if (group == null) {
            throw new IllegalStateException("Dispatcher of channel " + channelId + " is not started");
        }
        return group.next();
    }

    /**
     * Dispatches a delivery decoded from a broker frame under a fresh channel-local tag
     *
     * @param brokerDeliveryTag the tag carried by the frame
     * @return the dispatched delivery
     * @throws UnknownConsumerException if no consumer is registered under the tag
     * @throws AmqpException if the broker tag does not follow the previous one
     */
    public Delivery dispatch(String consumerTag, long brokerDeliveryTag, boolean redelivered, byte[] body) {
        lock.lock();
        try {
            ensureOpen();
            tagAllocator.observe(brokerDeliveryTag);
            Consumer consumer = lookup(consumerTag, brokerDeliveryTag);
            Delivery delivery = new Delivery(tagAllocator.next(), brokerDeliveryTag, consumerTag, body, redelivered);
            deliver(consumer, delivery);
            return delivery;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Dispatches a delivery whose tag has already been allocated
     *
     * @throws UnknownConsumerException if no consumer is registered under the delivery's tag
     */
    public void dispatch(Delivery delivery) {
        lock.lock();
        try {
            ensureOpen();
            deliver(lookup(delivery.getConsumerTag(), delivery.getDeliveryTag()), delivery);
        } finally {
            lock.unlock();
        }
    }

    private Consumer lookup(String consumerTag, long deliveryTag) {
        Consumer consumer = consumerRegistry.lookup(consumerTag);
        if (consumer == null) {
            throw new UnknownConsumerException("No consumer '" + consumerTag
                + "' on channel " + channelId + " for delivery " + deliveryTag);
        }
        return consumer;
    }

    private void deliver(Consumer consumer, Delivery delivery) {
        // recorded before the handler can possibly run, so it may settle synchronously
        pendingAcks.record(delivery, consumer);
        PendingAck pendingAck = pendingAcks.get(delivery.getDeliveryTag());
        consumer.incrementMessageCount();
        // submitted under the lock to keep per-consumer order equal to tag order
        consumer.getExecutor().execute(() -> invoke(consumer, delivery, pendingAck));
        log.debug("Dispatched delivery {} to consumer {}", delivery.getDeliveryTag(), consumer.getConsumerTag());
    }

    /**
     * Shuts the executor group down; deliveries already submitted still run to completion.
     */
    public Future<?> shutdown(long quietPeriodMillis, long timeoutMillis) {
        EventExecutorGroup group = executorGroup;
        executorGroup = null;
        if (group == null) {
            return null;
        }
        return group.shutdownGracefully(quietPeriodMillis, timeoutMillis, TimeUnit.MILLISECONDS);
    }

    private void invoke(Consumer consumer, Delivery delivery, PendingAck pendingAck) {
        if (pendingAck != null) {
            pendingAck.transitionTo(DeliveryState.DISPATCHED);
        }
        try {
            consumer.getHandler().handleDelivery(delivery);
        } catch (Exception e) {
            log.error("Consumer {} failed to handle delivery {}", consumer.getConsumerTag(), delivery.getDeliveryTag(), e);
        }
    }

    private void ensureOpen() {
        if (!open.getAsBoolean()) {
            throw new ChannelClosedException("Channel " + channelId + " is closed");
        }
    }
}
