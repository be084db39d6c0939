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

import com.arc.core.exception.DuplicateConsumerTagException;
import com.arc.core.exception.ExclusiveConsumeConflictException;
import io.netty.util.concurrent.EventExecutor;
import lombok.extern.slf4j.Slf4j;
import org.apache.qpid.server.protocol.v0_8.AMQShortString;
import org.apache.qpid.server.protocol.v0_8.FieldTable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Consumers subscribed on one channel, in registration order.
 * Not thread-safe: every call is made under the owning channel's lock.
 */
@Slf4j
public class ConsumerRegistry {

    // Map: consumerTag -> Consumer
    private final Map<String, Consumer> consumers = new LinkedHashMap<>();

    private final String consumerTagPrefix;

    private final Supplier<EventExecutor> executors;

    private final AmqpChannel channel;

    public ConsumerRegistry(String consumerTagPrefix, Supplier<EventExecutor> executors, AmqpChannel channel) {
        this.consumerTagPrefix = consumerTagPrefix;
        this.executors = executors;
        this.channel = channel;
    }

    /**
     * Registers a consumer
     *
     * @param consumerTag the tag, or null to generate one
     * @return the registered consumer
     * @throws DuplicateConsumerTagException if the tag is already active on the channel
     * @throws ExclusiveConsumeConflictException if the subscription breaks queue exclusivity
     * @throws IllegalArgumentException if the tag does not fit an AMQP short string
     */
    public Consumer register(String consumerTag, AckMode ackMode, boolean exclusive, String queueName,
                             FieldTable arguments, DeliveryHandler handler) {
        String tag = consumerTag == null || consumerTag.isEmpty() ? generateTag() : consumerTag;
        AMQShortString.valueOf(tag);
        if (consumers.containsKey(tag)) {
            throw new DuplicateConsumerTagException("Consumer tag '" + tag + "' already in use");
        }
        for (Consumer existing : consumers.values()) {
            if (!existing.getQueueName().equals(queueName)) {
                continue;
            }
            if (existing.isExclusive()) {
                throw new ExclusiveConsumeConflictException(
                    "Queue '" + queueName + "' has exclusive consumer " + existing.getConsumerTag());
            }
            if (exclusive) {
                throw new ExclusiveConsumeConflictException(
                    "Cannot consume exclusively from queue '" + queueName + "', it already has consumers");
            }
        }
        Consumer consumer = new Consumer(tag, queueName, ackMode, exclusive, arguments, handler, executors.get(), channel);
        consumers.put(tag, consumer);
        log.debug("Added consumer {} to registry, total consumers: {}", tag, consumers.size());
        return consumer;
    }

    /**
     * Removes a consumer, no-op if absent
     *
     * @return the removed consumer, or null if not found
     */
    public Consumer unregister(String consumerTag) {
        Consumer consumer = consumers.remove(consumerTag);
        if (consumer != null) {
            consumer.cancel();
            log.debug("Removed consumer {} from registry, total consumers: {}", consumerTag, consumers.size());
        }
        return consumer;
    }

    public Consumer lookup(String consumerTag) {
        return consumers.get(consumerTag);
    }

    /**
     * Active consumers of a queue in registration order; the exclusive holder alone if there is one.
     */
    public List<Consumer> candidatesFor(String queueName) {
        List<Consumer> candidates = new ArrayList<>();
        for (Consumer consumer : consumers.values()) {
            if (!consumer.isActive() || !consumer.getQueueName().equals(queueName)) {
                continue;
            }
            if (consumer.isExclusive()) {
                return Collections.singletonList(consumer);
            }
            candidates.add(consumer);
        }
        return candidates;
    }

    public Collection<Consumer> consumers() {
        return new ArrayList<>(consumers.values());
    }

    public int size() {
        return consumers.size();
    }

    /**
     * Cancels and removes every consumer
     *
     * @return the removed consumers
     */
    public List<Consumer> clear() {
        List<Consumer> removed = new ArrayList<>(consumers.values());
        removed.forEach(Consumer::cancel);
        consumers.clear();
        return removed;
    }

    private String generateTag() {
        String tag;
        do {
            tag = consumerTagPrefix + UUID.randomUUID();
        } while (consumers.containsKey(tag));
        return tag;
    }
}
