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

import com.arc.core.exception.AckModeMismatchException;
import com.arc.core.exception.PreconditionFailedException;
import com.arc.core.exception.UnknownDeliveryTagException;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Manages unacknowledged deliveries for a channel using delivery tags.
 * Only deliveries to manual-ack consumers are tracked; tags settled on dispatch
 * are remembered as compact ranges so that settling them later can be told apart
 * from settling a tag that was never delivered.
 * Not thread-safe: every call is made under the owning channel's lock.
 */
@Slf4j
public class PendingAckTable {

    private final NavigableMap<Long, PendingAck> unacknowledged = new TreeMap<>();

    // Map: first tag -> last tag of each run of tags settled on dispatch
    private final NavigableMap<Long, Long> settledOnDispatch = new TreeMap<>();

    private final DeliveryTagAllocator tagAllocator;

    public PendingAckTable(DeliveryTagAllocator tagAllocator) {
        this.tagAllocator = tagAllocator;
    }

    /**
     * Tracks a delivery that is about to be dispatched
     *
     * @return true if an entry was created, false if the consumer settles on dispatch
     */
    public boolean record(Delivery delivery, Consumer consumer) {
        long deliveryTag = delivery.getDeliveryTag();
        if (consumer.usesAutomaticAckMode()) {
            markSettledOnDispatch(deliveryTag);
            return false;
        }
        unacknowledged.put(deliveryTag, new PendingAck(delivery, consumer.getQueueName()));
        log.debug("Added unacknowledged delivery with deliveryTag: {}", deliveryTag);
        return true;
    }

    /**
     * Removes the entries selected by a settlement
     *
     * @param deliveryTag the delivery tag to settle
     * @param multiple if true, settles all deliveries up to and including this tag; tag 0 selects all
     * @return the removed entries in ascending tag order
     * @throws UnknownDeliveryTagException if a single tag is not pending
     * @throws AckModeMismatchException if the tag was settled on dispatch
     * @throws PreconditionFailedException if a cumulative tag was never issued
     */
    public List<PendingAck> remove(long deliveryTag, boolean multiple) {
        if (multiple) {
            if (deliveryTag == 0) {
                return drainAll();
            }
            if (deliveryTag > tagAllocator.current()) {
                throw new PreconditionFailedException("Delivery tag " + deliveryTag
                    + " is beyond the last issued tag " + tagAllocator.current());
            }
            if (isSettledOnDispatch(deliveryTag)) {
                throw ackModeMismatch(deliveryTag);
            }
            NavigableMap<Long, PendingAck> selected = unacknowledged.headMap(deliveryTag, true);
            List<PendingAck> removed = new ArrayList<>(selected.values());
            selected.clear();
            log.debug("Removed {} deliveries up to deliveryTag: {}", removed.size(), deliveryTag);
            return removed;
        }
        PendingAck removed = unacknowledged.remove(deliveryTag);
        if (removed == null) {
            if (isSettledOnDispatch(deliveryTag)) {
                throw ackModeMismatch(deliveryTag);
            }
            throw new UnknownDeliveryTagException("Unknown delivery tag " + deliveryTag);
        }
        log.debug("Removed single delivery with deliveryTag: {}", deliveryTag);
        return Collections.singletonList(removed);
    }

    /**
     * Removes every entry, typically when the channel closes
     */
    public List<PendingAck> drainAll() {
        List<PendingAck> removed = new ArrayList<>(unacknowledged.values());
        unacknowledged.clear();
        log.debug("Drained {} unacknowledged deliveries", removed.size());
        return removed;
    }

    public PendingAck get(long deliveryTag) {
        return unacknowledged.get(deliveryTag);
    }

    public boolean isPending(long deliveryTag) {
        return unacknowledged.containsKey(deliveryTag);
    }

    public boolean isSettledOnDispatch(long deliveryTag) {
        Map.Entry<Long, Long> range = settledOnDispatch.floorEntry(deliveryTag);
        return range != null && deliveryTag <= range.getValue();
    }

    /**
     * Gets the number of unacknowledged deliveries
     */
    public int size() {
        return unacknowledged.size();
    }

    /**
     * Forgets all state, used when the channel is reset
     */
    public void reset() {
        unacknowledged.clear();
        settledOnDispatch.clear();
    }

    private void markSettledOnDispatch(long deliveryTag) {
        Map.Entry<Long, Long> previous = settledOnDispatch.floorEntry(deliveryTag);
        if (previous != null && deliveryTag <= previous.getValue()) {
            return;
        }
        long start = deliveryTag;
        long end = deliveryTag;
        if (previous != null && previous.getValue() == deliveryTag - 1) {
            start = previous.getKey();
        }
        Long nextEnd = settledOnDispatch.remove(deliveryTag + 1);
        if (nextEnd != null) {
            end = nextEnd;
        }
        settledOnDispatch.put(start, end);
    }

    private static AckModeMismatchException ackModeMismatch(long deliveryTag) {
        return new AckModeMismatchException("Delivery tag " + deliveryTag
            + " belongs to an automatic-ack consumer and was settled on dispatch");
    }

    /**
     * A delivery awaiting acknowledgment
     */
    @Getter
    @ToString(of = {"delivery", "queueName", "state"})
    public static class PendingAck {

        private final Delivery delivery;

        private final String queueName;

        private final long enqueuedAt;

        private volatile DeliveryState state = DeliveryState.RECEIVED;

        PendingAck(Delivery delivery, String queueName) {
            this.delivery = delivery;
            this.queueName = queueName;
            this.enqueuedAt = System.currentTimeMillis();
        }

        public long getDeliveryTag() {
            return delivery.getDeliveryTag();
        }

        public String getConsumerTag() {
            return delivery.getConsumerTag();
        }

        /**
         * Moves the entry along its lifecycle; a terminal state is never left.
         *
         * @return true if the state changed
         */
        public synchronized boolean transitionTo(DeliveryState next) {
            if (state.isTerminal()) {
                return false;
            }
            this.state = next;
            return true;
        }
    }
}
