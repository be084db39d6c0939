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

/**
 * Transport collaborator turning settlement intents into basic.ack, basic.nack
 * and basic.reject frames. Implementations must not block and must keep the
 * order in which intents are handed to them.
 */
public interface AckFrameSender {

    /**
     * Acknowledges a delivery or multiple deliveries
     *
     * @param channelId the channel the deliveries arrived on
     * @param deliveryTag the delivery tag to acknowledge
     * @param multiple if true, acknowledges all deliveries up to and including this tag
     */
    void emitAck(int channelId, long deliveryTag, boolean multiple);

    /**
     * Negatively acknowledges a delivery or multiple deliveries
     *
     * @param channelId the channel the deliveries arrived on
     * @param deliveryTag the delivery tag to nack
     * @param multiple if true, nacks all deliveries up to and including this tag
     * @param requeue if true, the messages should be requeued
     */
    void emitNack(int channelId, long deliveryTag, boolean multiple, boolean requeue);

    /**
     * Rejects a delivery
     *
     * @param channelId the channel the delivery arrived on
     * @param deliveryTag the delivery tag to reject
     * @param requeue if true, the message should be requeued
     */
    void emitReject(int channelId, long deliveryTag, boolean requeue);
}
