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

import com.arc.core.ack.AckFrameSender;
import com.arc.core.config.ChannelSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AmqpConnectionTest {

    @Mock
    private AckFrameSender sender;

    private AmqpConnection connection;

    @BeforeEach
    void setUp() {
        connection = new AmqpConnection(sender, ChannelSettings.builder().dispatchThreads(1).build());
    }

    @AfterEach
    void tearDown() {
        connection.close();
    }

    @Test
    void testChannelIdRange() {
        assertThrows(IllegalArgumentException.class, () -> connection.openChannel(0));
        assertThrows(IllegalArgumentException.class, () -> connection.openChannel(65536));
        assertEquals(65535, connection.openChannel(65535).getChannelId());
    }

    @Test
    void testChannelIdInUse() {
        connection.openChannel(1);

        assertThrows(IllegalStateException.class, () -> connection.openChannel(1));
    }

    @Test
    void testDeliveryOnUnknownChannelIsConnectionError() {
        AmqpException ex = assertThrows(AmqpException.class,
            () -> connection.onDeliveryFrame(9, "ctag", 1, false, new byte[0]));

        assertEquals(AmqpException.Codes.CHANNEL_ERROR, ex.getErrorCode());
        assertTrue(ex.shouldCloseConnection());
    }

    @Test
    void testChannelsHaveIndependentTags() throws InterruptedException {
        BlockingQueue<Delivery> received = new LinkedBlockingQueue<>();
        AmqpChannel one = connection.openChannel(1);
        AmqpChannel two = connection.openChannel(2);
        one.subscribe("q", "ctag", EnumSet.of(ConsumeOption.MANUAL_ACK_MODE), null, received::add);
        two.subscribe("q", "ctag", EnumSet.of(ConsumeOption.MANUAL_ACK_MODE), null, received::add);

        connection.onDeliveryFrame(1, "ctag", 1, false, "one".getBytes());
        connection.onDeliveryFrame(2, "ctag", 1, false, "two".getBytes());
        assertNotNull(received.poll(5, TimeUnit.SECONDS));
        assertNotNull(received.poll(5, TimeUnit.SECONDS));

        two.ack(1);
        verify(sender).emitAck(2, 1, false);
        assertTrue(one.isPending(1));
        assertFalse(two.isPending(1));
    }

    @Test
    void testClosedChannelIdMayBeOpenedAgain() {
        AmqpChannel first = connection.openChannel(1);
        connection.closeChannel(first);

        assertNull(connection.getChannel(1));
        AmqpChannel second = connection.openChannel(1);
        assertNotSame(first, second);
        assertSame(second, connection.getChannel(1));
    }

    @Test
    void testCloseClosesEveryChannel() {
        AmqpChannel one = connection.openChannel(1);
        AmqpChannel two = connection.openChannel(2);

        connection.close();

        assertFalse(one.isOpen());
        assertFalse(two.isOpen());
        assertTrue(connection.getChannels().isEmpty());
    }
}
