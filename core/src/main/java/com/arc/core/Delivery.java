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

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.util.Arrays;
import java.util.Objects;

/**
 * A message handed to a consumer. Immutable; the body is copied on the way in and out.
 * <p>
 * {@code deliveryTag} is the channel-local tag the application settles with.
 * {@code brokerDeliveryTag} is the tag the broker gave the frame, used on outbound
 * settlement frames; it is 0 for copies the client redelivered itself, which have no
 * counterpart on the broker.
 */
@Getter
@ToString(exclude = "body")
public final class Delivery {

    private final long deliveryTag;

    private final long brokerDeliveryTag;

    private final String consumerTag;

    @Getter(AccessLevel.NONE)
    private final byte[] body;

    private final boolean redelivered;

    public Delivery(long deliveryTag, long brokerDeliveryTag, String consumerTag, byte[] body, boolean redelivered) {
        this.deliveryTag = deliveryTag;
        this.brokerDeliveryTag = brokerDeliveryTag;
        this.consumerTag = consumerTag;
        this.body = body == null ? new byte[0] : body.clone();
        this.redelivered = redelivered;
    }

    /**
     * A delivery whose local tag is the broker's tag
     */
    public Delivery(long deliveryTag, String consumerTag, byte[] body, boolean redelivered) {
        this(deliveryTag, deliveryTag, consumerTag, body, redelivered);
    }

    public byte[] getBody() {
        return body.clone();
    }

    public int getBodySize() {
        return body.length;
    }

    /**
     * Whether the broker still knows this delivery under {@link #getBrokerDeliveryTag()}
     */
    public boolean hasBrokerDeliveryTag() {
        return brokerDeliveryTag > 0;
    }

    /**
     * Copy of this delivery offered again under a new tag to a possibly different consumer.
     * The redelivered flag is always set on the copy, and the copy has no broker tag.
     */
    public Delivery redeliver(long newDeliveryTag, String newConsumerTag) {
        return new Delivery(newDeliveryTag, 0, newConsumerTag, body, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Delivery)) {
            return false;
        }
        Delivery other = (Delivery) o;
        return deliveryTag == other.deliveryTag
            && brokerDeliveryTag == other.brokerDeliveryTag
            && redelivered == other.redelivered
            && Objects.equals(consumerTag, other.consumerTag)
            && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(deliveryTag);
        result = 31 * result + Long.hashCode(brokerDeliveryTag);
        result = 31 * result + Objects.hashCode(consumerTag);
        result = 31 * result + Arrays.hashCode(body);
        return 31 * result + (redelivered ? 1 : 0);
    }
}
