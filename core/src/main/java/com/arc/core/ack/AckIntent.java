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

import lombok.Value;

/**
 * One outbound settlement frame, produced once per settle call however many
 * deliveries it covers.
 */
@Value
public class AckIntent {

    int channelId;

    AckOutcome outcome;

    /**
     * Broker tag of the frame
     */
    long deliveryTag;

    boolean multiple;

    /**
     * Hands this intent to the transport.
     */
    public void sendTo(AckFrameSender sender) {
        switch (outcome.getKind()) {
            case ACK:
                sender.emitAck(channelId, deliveryTag, multiple);
                break;
            case NACK:
                sender.emitNack(channelId, deliveryTag, multiple, outcome.isRequeue());
                break;
            case REJECT:
                sender.emitReject(channelId, deliveryTag, outcome.isRequeue());
                break;
            default:
                throw new IllegalStateException("Unknown outcome " + outcome.getKind());
        }
    }
}
