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

/**
 * Observable outcomes of a channel that are not errors to any caller.
 */
public interface ChannelEventListener {

    ChannelEventListener NO_OP = new ChannelEventListener() {
    };

    /**
     * A delivery was still awaiting acknowledgment when its channel closed.
     */
    default void onAbandoned(int channelId, PendingAckTable.PendingAck pendingAck) {
    }

    /**
     * Requeued messages are held because the queue currently has no consumer.
     *
     * @param held number of messages waiting in the queue
     */
    default void onRedeliveryPending(int channelId, String queueName, int held) {
    }

    /**
     * The broker delivered a message for a consumer tag that is not registered. The
     * delivery carries only the broker's tag; no channel tag was issued for it.
     */
    default void onUnknownConsumer(int channelId, Delivery delivery) {
    }
}
