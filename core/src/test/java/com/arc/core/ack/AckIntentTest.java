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

import com.arc.core.DeliveryState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@ExtendWith(MockitoExtension.class)
class AckIntentTest {

    @Mock
    private AckFrameSender sender;

    @Test
    void testAckIntentEmitsBasicAck() {
        new AckIntent(1, AckOutcome.ack(), 9, true).sendTo(sender);

        verify(sender).emitAck(1, 9, true);
        verifyNoMoreInteractions(sender);
    }

    @Test
    void testNackIntentCarriesRequeue() {
        new AckIntent(2, AckOutcome.nack(true), 3, false).sendTo(sender);

        verify(sender).emitNack(2, 3, false, true);
        verifyNoMoreInteractions(sender);
    }

    @Test
    void testRejectIntentIgnoresMultiple() {
        new AckIntent(3, AckOutcome.reject(false), 4, false).sendTo(sender);

        verify(sender).emitReject(3, 4, false);
        verifyNoMoreInteractions(sender);
    }

    @Test
    void testOutcomeTerminalStates() {
        assertEquals(DeliveryState.ACKED, AckOutcome.ack().terminalState());
        assertEquals(DeliveryState.NACKED, AckOutcome.nack(false).terminalState());
        assertEquals(DeliveryState.REJECTED, AckOutcome.reject(true).terminalState());
        assertFalse(AckOutcome.ack().isRequeue());
        assertTrue(AckOutcome.nack(true).isRequeue());
        assertEquals(AckOutcome.reject(true), AckOutcome.reject(true));
        assertNotEquals(AckOutcome.nack(true), AckOutcome.nack(false));
    }
}
