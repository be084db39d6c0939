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

import com.arc.core.exception.ChannelClosedException;
import com.arc.core.exception.UnknownConsumerException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryDispatcherTest {

    private final ReentrantLock lock = new ReentrantLock();

    private final AtomicBoolean open = new AtomicBoolean(true);

    private DeliveryTagAllocator allocator;

    private PendingAckTable pendingAcks;

    private ConsumerRegistry registry;

    private DeliveryDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        allocator = new DeliveryTagAllocator();
        pendingAcks = new PendingAckTable(allocator);
        registry = new ConsumerRegistry("amq.ctag-", () -> dispatcher.nextExecutor(), null);
        dispatcher = new DeliveryDispatcher(1, lock, open::get, registry, pendingAcks, allocator, 2);
        dispatcher.start();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        dispatcher.shutdown(0, 1000).await(2, TimeUnit.SECONDS);
    }

    private Consumer register(String tag, AckMode ackMode, DeliveryHandler handler) {
        lock.lock();
        try {
            return registry.register(tag, ackMode, false, "queue", null, handler);
        } finally {
            lock.unlock();
        }
    }

    @Test
    void testHandlerRunsOffTheDispatchingThread() throws InterruptedException {
        AtomicReference<Thread> handlerThread = new AtomicReference<>();
        CountDownLatch handled = new CountDownLatch(1);
        register("ctag-1", AckMode.AUTOMATIC, delivery -> {
            handlerThread.set(Thread.currentThread());
            handled.countDown();
        });

        Delivery delivery = dispatcher.dispatch("ctag-1", 1, false, new byte[]{1});

        assertTrue(handled.await(5, TimeUnit.SECONDS));
        assertNotSame(Thread.currentThread(), handlerThread.get());
        assertEquals(1, delivery.getDeliveryTag());
        assertEquals(1, registry.lookup("ctag-1").getMessageCount());
    }

    @Test
    void testDeliveriesToOneConsumerArriveInOrder() throws InterruptedException {
        int total = 200;
        List<Long> seen = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch handled = new CountDownLatch(total);
        register("ctag-1", AckMode.MANUAL, delivery -> {
            seen.add(delivery.getDeliveryTag());
            handled.countDown();
        });

        for (long tag = 1; tag <= total; tag++) {
            dispatcher.dispatch("ctag-1", tag, false, new byte[0]);
        }

        assertTrue(handled.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < total; i++) {
            assertEquals(i + 1, seen.get(i));
        }
    }

    @Test
    void testManualDeliveryIsPendingBeforeHandlerRuns() throws InterruptedException {
        AtomicBoolean pendingInHandler = new AtomicBoolean();
        AtomicReference<DeliveryState> stateInHandler = new AtomicReference<>();
        CountDownLatch handled = new CountDownLatch(1);
        register("ctag-1", AckMode.MANUAL, delivery -> {
            lock.lock();
            try {
                pendingInHandler.set(pendingAcks.isPending(delivery.getDeliveryTag()));
                stateInHandler.set(pendingAcks.get(delivery.getDeliveryTag()).getState());
            } finally {
                lock.unlock();
            }
            handled.countDown();
        });

        dispatcher.dispatch("ctag-1", 1, false, new byte[0]);

        assertTrue(handled.await(5, TimeUnit.SECONDS));
        assertTrue(pendingInHandler.get());
        assertEquals(DeliveryState.DISPATCHED, stateInHandler.get());
    }

    @Test
    void testFrameTagIsKeptBesideChannelTag() {
        register("ctag-1", AckMode.MANUAL, delivery -> { });

        Delivery first = dispatcher.dispatch("ctag-1", 17, false, new byte[0]);
        Delivery second = dispatcher.dispatch("ctag-1", 18, true, new byte[0]);

        assertEquals(1, first.getDeliveryTag());
        assertEquals(17, first.getBrokerDeliveryTag());
        assertEquals(2, second.getDeliveryTag());
        assertEquals(18, second.getBrokerDeliveryTag());
        assertTrue(second.isRedelivered());
        assertTrue(pendingAcks.isPending(2));
    }

    @Test
    void testUnknownConsumer() {
        UnknownConsumerException ex = assertThrows(UnknownConsumerException.class,
            () -> dispatcher.dispatch("missing", 1, false, new byte[0]));

        assertEquals(AmqpException.Codes.NOT_FOUND, ex.getErrorCode());
        assertEquals(0, pendingAcks.size());
        assertEquals(0, allocator.current());
    }

    @Test
    void testHandlerFailureDoesNotStopLaterDeliveries() throws InterruptedException {
        CountDownLatch second = new CountDownLatch(1);
        register("ctag-1", AckMode.AUTOMATIC, delivery -> {
            if (delivery.getDeliveryTag() == 1) {
                throw new IllegalStateException("boom");
            }
            second.countDown();
        });

        dispatcher.dispatch("ctag-1", 1, false, new byte[0]);
        dispatcher.dispatch("ctag-1", 2, false, new byte[0]);

        assertTrue(second.await(5, TimeUnit.SECONDS));
    }

    @Test
    void testCancelledConsumerFinishesInFlightDelivery() throws InterruptedException {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        register("ctag-1", AckMode.MANUAL, delivery -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            finished.countDown();
        });

        dispatcher.dispatch("ctag-1", 1, false, new byte[0]);
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        lock.lock();
        try {
            registry.unregister("ctag-1");
        } finally {
            lock.unlock();
        }
        release.countDown();

        assertTrue(finished.await(5, TimeUnit.SECONDS));
        assertTrue(pendingAcks.isPending(1));
        assertThrows(UnknownConsumerException.class, () -> dispatcher.dispatch("ctag-1", 2, false, new byte[0]));
    }

    @Test
    void testClosedChannelRefusesDeliveries() {
        register("ctag-1", AckMode.AUTOMATIC, delivery -> { });
        open.set(false);

        assertThrows(ChannelClosedException.class, () -> dispatcher.dispatch("ctag-1", 1, false, new byte[0]));
    }

    @Test
    void testTagThatDoesNotIncreaseIsRefused() {
        register("ctag-1", AckMode.AUTOMATIC, delivery -> { });
        dispatcher.dispatch("ctag-1", 3, false, new byte[0]);

        assertThrows(AmqpException.class, () -> dispatcher.dispatch("ctag-1", 3, false, new byte[0]));
    }
}
