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
import com.arc.core.ack.AckFrameSender;
import com.arc.core.ack.AcknowledgmentEngine;
import com.arc.core.ack.Settlement;
import com.arc.core.config.ChannelSettings;
import com.arc.core.exception.ChannelClosedException;
import com.arc.core.exception.NoActiveConsumerException;
import com.arc.core.exception.UnknownConsumerException;
import com.arc.core.redelivery.RedeliveryRouter;
import io.netty.util.concurrent.EventExecutor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.qpid.server.protocol.v0_8.FieldTable;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A logical AMQP session: tracks the deliveries it receives, dispatches them to its
 * consumers and settles them on behalf of the application.
 * <p>
 * One lock per channel guards the consumer registry, the pending table and the held
 * redeliveries. It is held only while those structures change, never while a handler runs.
 */
@Slf4j
public class AmqpChannel {

    private final AmqpConnection connection;

    @Getter
    private final int channelId;

    private final ChannelSettings settings;

    private final ChannelEventListener listener;

    private final ReentrantLock lock = new ReentrantLock();

    private volatile boolean open;

    @Getter
    private final DeliveryTagAllocator tagAllocator = new DeliveryTagAllocator();

    private final PendingAckTable pendingAcks = new PendingAckTable(tagAllocator);

    private final ConsumerRegistry consumerRegistry;

    private final DeliveryDispatcher dispatcher;

    private final RedeliveryRouter redeliveryRouter;

    private final AcknowledgmentEngine acknowledgmentEngine;

    AmqpChannel(AmqpConnection connection, int channelId, AckFrameSender sender,
                ChannelSettings settings, ChannelEventListener listener) {
        this.connection = connection;
        this.channelId = channelId;
        this.settings = settings;
        this.listener = listener;
        this.consumerRegistry = new ConsumerRegistry(settings.getConsumerTagPrefix(), this::nextExecutor, this);
        this.dispatcher = new DeliveryDispatcher(channelId, lock, this::isOpen, consumerRegistry, pendingAcks,
            tagAllocator, settings.getDispatchThreads());
        this.redeliveryRouter = new RedeliveryRouter(channelId, lock, this::isOpen, consumerRegistry,
            tagAllocator, dispatcher, listener);
        this.acknowledgmentEngine = new AcknowledgmentEngine(channelId, lock, this::isOpen, pendingAcks,
            sender, redeliveryRouter);
    }

    /**
     * Opens the channel; tags start again at 1.
     */
    void open() {
        lock.lock();
        try {
            if (open) {
                return;
            }
            tagAllocator.reset();
            pendingAcks.reset();
            dispatcher.start();
            open = true;
        } finally {
            lock.unlock();
        }
        log.info("Channel {} opened", channelId);
    }

    /**
     * Reopens a closed channel under the same id, resetting its delivery tags.
     *
     * @throws IllegalStateException if the channel is open
     */
    public void reopen() {
        if (open) {
            throw new IllegalStateException("Channel " + channelId + " is open");
        }
        if (connection != null) {
            connection.attach(this);
        }
        open();
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * Subscribes a consumer to a queue with a generated tag
     *
     * @param options recognized consume options; no ack mode means automatic
     */
    public Consumer subscribe(String queueName, Set<ConsumeOption> options, DeliveryHandler handler) {
        return subscribe(queueName, null, options, null, handler);
    }

    /**
     * Subscribes a consumer to a queue. Messages held for redelivery on the queue are
     * offered to the new consumer right away.
     *
     * @param consumerTag the tag, or null to generate one
     * @param arguments consumer arguments, may be null
     * @throws ChannelClosedException if the channel is closed
     * @throws com.arc.core.exception.DuplicateConsumerTagException if the tag is in use
     * @throws com.arc.core.exception.ExclusiveConsumeConflictException if queue exclusivity would break
     * @throws IllegalArgumentException if both ack modes are requested
     */
    public Consumer subscribe(String queueName, String consumerTag, Set<ConsumeOption> options,
                              Map<String, Object> arguments, DeliveryHandler handler) {
        if (queueName == null || handler == null) {
            throw new IllegalArgumentException("queue name and handler are required");
        }
        AckMode ackMode = ConsumeOption.ackModeOf(options);
        boolean exclusive = ConsumeOption.isExclusive(options);
        Consumer consumer;
        lock.lock();
        try {
            ensureOpen();
            consumer = consumerRegistry.register(consumerTag, ackMode, exclusive, queueName,
                FieldTable.convertToFieldTable(arguments), handler);
        } finally {
            lock.unlock();
        }
        log.info("Consumer {} subscribed to queue {} on channel {} (ackMode={}, exclusive={})",
            consumer.getConsumerTag(), queueName, channelId, ackMode, exclusive);
        try {
            redeliveryRouter.redeliver(queueName);
        } catch (NoActiveConsumerException e) {
            log.debug("Held messages of queue {} still pending: {}", queueName, e.getMessage());
        }
        return consumer;
    }

    public void cancel(Consumer consumer) {
        cancel(consumer.getConsumerTag());
    }

    /**
     * Cancels a consumer, no-op if it is not registered. Deliveries the consumer has not
     * settled stay pending and may still be settled.
     */
    public void cancel(String consumerTag) {
        Consumer removed;
        lock.lock();
        try {
            removed = consumerRegistry.unregister(consumerTag);
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            log.info("Consumer {} cancelled on channel {}", consumerTag, channelId);
        }
    }

    public Settlement ack(long deliveryTag) {
        return ack(deliveryTag, false);
    }

    public Settlement ack(long deliveryTag, boolean multiple) {
        return acknowledgmentEngine.ack(deliveryTag, multiple);
    }

    /**
     * Negatively acknowledges a single delivery and requeues it
     */
    public Settlement nack(long deliveryTag) {
        return nack(deliveryTag, false, true);
    }

    public Settlement nack(long deliveryTag, boolean multiple, boolean requeue) {
        return acknowledgmentEngine.nack(deliveryTag, multiple, requeue);
    }

    public Settlement reject(long deliveryTag, boolean requeue) {
        return acknowledgmentEngine.reject(deliveryTag, requeue);
    }

    /**
     * Called by the connection for every basic.deliver of this channel. The delivery is
     * handed to its consumer under a channel-local tag; the broker's tag is kept for the
     * settlement frames.
     */
    public void onDeliveryFrame(String consumerTag, long brokerDeliveryTag, boolean redelivered, byte[] body) {
        process(() -> dispatcher.dispatch(consumerTag, brokerDeliveryTag, redelivered, body),
            consumerTag, brokerDeliveryTag, redelivered, body);
    }

    private void process(Runnable action, String consumerTag, long brokerDeliveryTag, boolean redelivered, byte[] body) {
        try {
            action.run();
        } catch (UnknownConsumerException ex) {
            log.warn("channel {} dropped broker delivery {}: {}", channelId, brokerDeliveryTag, ex.getMessage());
            listener.onUnknownConsumer(channelId, new Delivery(0, brokerDeliveryTag, consumerTag, body, redelivered));
        } catch (ChannelClosedException ex) {
            log.debug("channel {} closed, dropped broker delivery {}", channelId, brokerDeliveryTag);
        } catch (AmqpException ex) {
            log.error("channel {} failed on broker delivery {}: {}", channelId, brokerDeliveryTag, ex.getMessage());
            closeChannel(ex.getErrorCode(), ex.getMessage());
            throw ex;
        }
    }

    /**
     * Closes the channel: every delivery still pending is abandoned and reported, consumers
     * are cancelled and held redeliveries are dropped. Handlers already running finish.
     */
    public void close() {
        List<PendingAck> abandoned;
        int discarded;
        lock.lock();
        try {
            if (!open) {
                return;
            }
            open = false;
            abandoned = pendingAcks.drainAll();
            consumerRegistry.clear();
            discarded = redeliveryRouter.clear();
        } finally {
            lock.unlock();
        }
        for (PendingAck pendingAck : abandoned) {
            pendingAck.transitionTo(DeliveryState.ABANDONED);
            log.warn("Delivery {} of consumer {} abandoned on close of channel {}",
                pendingAck.getDeliveryTag(), pendingAck.getConsumerTag(), channelId);
            listener.onAbandoned(channelId, pendingAck);
        }
        if (discarded > 0) {
            log.info("Discarded {} message(s) held for redelivery on channel {}", discarded, channelId);
        }
        dispatcher.shutdown(settings.getShutdownQuietPeriodMillis(), settings.getShutdownTimeoutMillis());
        if (connection != null) {
            connection.detach(this);
        }
        log.info("Channel {} closed, {} delivery(ies) abandoned", channelId, abandoned.size());
    }

    public void closeChannel(int cause, final String message) {
        log.info("Closing channel {}: code={}, text={}", channelId, cause, message);
        close();
    }

    public int pendingAckCount() {
        lock.lock();
        try {
            return pendingAcks.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isPending(long deliveryTag) {
        lock.lock();
        try {
            return pendingAcks.isPending(deliveryTag);
        } finally {
            lock.unlock();
        }
    }

    public List<Consumer> candidatesFor(String queueName) {
        lock.lock();
        try {
            return consumerRegistry.candidatesFor(queueName);
        } finally {
            lock.unlock();
        }
    }

    public Consumer getConsumer(String consumerTag) {
        lock.lock();
        try {
            return consumerRegistry.lookup(consumerTag);
        } finally {
            lock.unlock();
        }
    }

    public int heldForRedelivery(String queueName) {
        return redeliveryRouter.heldCount(queueName);
    }

    private EventExecutor nextExecutor() {
        return dispatcher.nextExecutor();
    }

    private void ensureOpen() {
        if (!open) {
            throw new ChannelClosedException("Channel " + channelId + " is closed");
        }
    }
}
