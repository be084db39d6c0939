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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues the delivery tags of one channel. Tags start at 1 and strictly increase
 * until the channel is reset. Every delivery, from a frame or redelivered by the client,
 * takes its tag here; the tags on broker frames are only checked for order.
 */
public class DeliveryTagAllocator {

    private final AtomicLong deliveryTagSequence = new AtomicLong(0);

    private final AtomicLong lastBrokerDeliveryTag = new AtomicLong(0);

    /**
     * Generates a new delivery tag in ascending order
     *
     * @return the next delivery tag
     */
    public long next() {
        return deliveryTagSequence.incrementAndGet();
    }

    /**
     * Checks the tag the broker put on an inbound delivery. Broker tags live apart from
     * the channel's own sequence, so client redeliveries never collide with them.
     *
     * @param brokerDeliveryTag the tag carried by the frame
     * @throws AmqpException if the tag does not exceed every broker tag seen on the channel
     */
    public void observe(long brokerDeliveryTag) {
        while (true) {
            long last = lastBrokerDeliveryTag.get();
            if (brokerDeliveryTag <= last) {
                throw new AmqpException(AmqpException.Codes.PRECONDITION_FAILED,
                    "Broker delivery tag " + brokerDeliveryTag + " does not follow " + last);
            }
            if (lastBrokerDeliveryTag.compareAndSet(last, brokerDeliveryTag)) {
                return;
            }
        }
    }

    /**
     * @return the last tag issued, 0 if none
     */
    public long current() {
        return deliveryTagSequence.get();
    }

    /**
     * @return the last broker tag observed, 0 if none
     */
    public long lastBrokerDeliveryTag() {
        return lastBrokerDeliveryTag.get();
    }

    public void reset() {
        deliveryTagSequence.set(0);
        lastBrokerDeliveryTag.set(0);
    }
}
