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

import io.netty.util.concurrent.EventExecutor;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import org.apache.qpid.server.protocol.v0_8.FieldTable;

import java.lang.ref.WeakReference;

/**
 * A subscription of a channel to one queue.
 * Deliveries for it are handed to its handler on its pinned executor.
 */
@Getter
@ToString(of = {"consumerTag", "queueName", "ackMode", "exclusive", "active"})
public class Consumer {

    /**
     * Unique identifier for this consumer within the channel
     */
    private final String consumerTag;

    /**
     * Name of the queue this consumer is consuming from
     */
    private final String queueName;

    /**
     * Whether deliveries are settled on dispatch or by the application
     */
    private final AckMode ackMode;

    /**
     * Whether this consumer has exclusive access to the queue
     */
    private final boolean exclusive;

    /**
     * Additional consumer arguments, may be null
     */
    private final FieldTable arguments;

    private final DeliveryHandler handler;

    /**
     * Single-threaded executor running every handler invocation of this consumer
     */
    @Getter(AccessLevel.PACKAGE)
    private final EventExecutor executor;

    @Getter(AccessLevel.NONE)
    private final WeakReference<AmqpChannel> channel;

    /**
     * Timestamp when the consumer was created
     */
    private final long createdAt;

    /**
     * Whether this consumer is active (not cancelled)
     */
    private volatile boolean active = true;

    /**
     * Number of messages delivered to this consumer
     */
    private volatile long messageCount = 0;

    public Consumer(String consumerTag, String queueName, AckMode ackMode, boolean exclusive,
                    FieldTable arguments, DeliveryHandler handler, EventExecutor executor, AmqpChannel channel) {
        this.consumerTag = consumerTag;
        this.queueName = queueName;
        this.ackMode = ackMode;
        this.exclusive = exclusive;
        this.arguments = arguments;
        this.handler = handler;
        this.executor = executor;
        this.channel = new WeakReference<>(channel);
        this.createdAt = System.currentTimeMillis();
    }

    public boolean usesAutomaticAckMode() {
        return ackMode == AckMode.AUTOMATIC;
    }

    public boolean usesManualAckMode() {
        return ackMode == AckMode.MANUAL;
    }

    /**
     * @return the owning channel, or null once it has been garbage collected
     */
    public AmqpChannel getChannel() {
        return channel.get();
    }

    /**
     * Marks this consumer as cancelled (inactive)
     */
    public void cancel() {
        this.active = false;
    }

    /**
     * Increments the message count for this consumer, called under the channel lock
     */
    void incrementMessageCount() {
        this.messageCount++;
    }
}
