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
import com.arc.core.exception.AckModeMismatchException;
import com.arc.core.exception.PreconditionFailedException;
import com.arc.core.exception.UnknownDeliveryTagException;
import io.netty.util.concurrent.ImmediateEventExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PendingAckTableTest {

    private DeliveryTagAllocator allocator;

    private PendingAckTable table;

    private Consumer manual;

    private Consumer automatic;

    @BeforeEach
    void setUp() {
        allocator = new DeliveryTagAllocator();
        table = new PendingAckTable(allocator);
        manual = new Consumer("ctag-manual", "queue", AckMode.MANUAL, false, null,
            delivery -> { }, ImmediateEventExecutor.INSTANCE, null);
        automatic = new Consumer("ctag-auto", "other-queue", AckMode.AUTOMATIC, false, null,
            delivery -> { }, ImmediateEventExecutor.INSTANCE, null);
    }

    private long deliver(Consumer consumer) {
        long tag = allocator.next();
        table.record(new Delivery(tag, consumer.getConsumerTag(), new byte[]{1}, false), consumer);
        return tag;
    }

    private static List<Long> tags(List<PendingAck> entries) {
        return entries.stream().map(PendingAck::getDeliveryTag).collect(Collectors.toList());
    }

    @Test
    void testRecordManualDelivery() {
        long tag = deliver(manual);

        assertEquals(1, table.size());
        assertTrue(table.isPending(tag));
        PendingAck pendingAck = table.get(tag);
        assertEquals("ctag-manual", pendingAck.getConsumerTag());
        assertEquals("queue", pendingAck.getQueueName());
        assertEquals(DeliveryState.RECEIVED, pendingAck.getState());
        assertTrue(pendingAck.getEnqueuedAt() <= System.currentTimeMillis());
    }

    @Test
    void testAutomaticDeliveryIsNeverPending() {
        long tag = deliver(automatic);

        assertEquals(0, table.size());
        assertFalse(table.isPending(tag));
        assertTrue(table.isSettledOnDispatch(tag));
    }

    @Test
    void testRemoveSingleDelivery() {
        long tag1 = deliver(manual);
        long tag2 = deliver(manual);

        List<PendingAck> removed = table.remove(tag1, false);

        assertEquals(List.of(tag1), tags(removed));
        assertEquals(1, table.size());
        assertTrue(table.isPending(tag2));
    }

    @Test
    void testRemoveUnknownDeliveryTag() {
        deliver(manual);

        assertThrows(UnknownDeliveryTagException.class, () -> table.remove(999, false));
    }

    @Test
    void testRemoveTwiceFails() {
        long tag = deliver(manual);
        table.remove(tag, false);

        assertThrows(UnknownDeliveryTagException.class, () -> table.remove(tag, false));
    }

    @Test
    void testRemoveMultipleSelectsTagsUpToAndIncluding() {
        long tag1 = deliver(manual);
        long tag2 = deliver(manual);
        long tag3 = deliver(manual);
        long tag4 = deliver(manual);
        table.remove(tag2, false);

        List<PendingAck> removed = table.remove(tag3, true);

        assertEquals(List.of(tag1, tag3), tags(removed));
        assertEquals(1, table.size());
        assertTrue(table.isPending(tag4));
    }

    @Test
    void testRemoveMultipleWithNothingPendingIsEmpty() {
        long tag = deliver(manual);
        table.remove(tag, false);

        assertTrue(table.remove(tag, true).isEmpty());
    }

    @Test
    void testRemoveMultipleBeyondLastIssuedTag() {
        deliver(manual);

        assertThrows(PreconditionFailedException.class, () -> table.remove(2, true));
        assertEquals(1, table.size());
    }

    @Test
    void testRemoveMultipleWithZeroSelectsEverything() {
        deliver(manual);
        deliver(manual);

        assertEquals(2, table.remove(0, true).size());
        assertEquals(0, table.size());
    }

    @Test
    void testSettlingAutomaticDeliveryIsAckModeMismatch() {
        long autoTag = deliver(automatic);
        deliver(manual);

        assertThrows(AckModeMismatchException.class, () -> table.remove(autoTag, false));
        assertThrows(AckModeMismatchException.class, () -> table.remove(autoTag, true));
        assertEquals(1, table.size());
    }

    @Test
    void testSettledOnDispatchRangesMerge() {
        long first = deliver(automatic);
        long second = deliver(automatic);
        long manualTag = deliver(manual);
        long third = deliver(automatic);

        assertTrue(table.isSettledOnDispatch(first));
        assertTrue(table.isSettledOnDispatch(second));
        assertFalse(table.isSettledOnDispatch(manualTag));
        assertTrue(table.isSettledOnDispatch(third));
        assertFalse(table.isSettledOnDispatch(third + 1));
    }

    @Test
    void testDrainAll() {
        for (int i = 0; i < 5; i++) {
            deliver(manual);
        }

        List<PendingAck> drained = table.drainAll();

        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), tags(drained));
        assertEquals(0, table.size());
    }

    @Test
    void testResetForgetsSettledOnDispatch() {
        long tag = deliver(automatic);
        deliver(manual);

        table.reset();

        assertEquals(0, table.size());
        assertFalse(table.isSettledOnDispatch(tag));
    }

    @Test
    void testTerminalStateIsNeverLeft() {
        long tag = deliver(manual);
        PendingAck pendingAck = table.get(tag);

        assertTrue(pendingAck.transitionTo(DeliveryState.ACKED));
        assertFalse(pendingAck.transitionTo(DeliveryState.DISPATCHED));
        assertEquals(DeliveryState.ACKED, pendingAck.getState());
    }
}
