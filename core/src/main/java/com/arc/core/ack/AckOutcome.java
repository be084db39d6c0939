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
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * How the application settles a delivery: ack, nack or reject, the latter two
 * with or without requeue.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class AckOutcome {

    public enum Kind {
        ACK,
        NACK,
        REJECT
    }

    private static final AckOutcome ACK = new AckOutcome(Kind.ACK, false);

    private final Kind kind;

    private final boolean requeue;

    private AckOutcome(Kind kind, boolean requeue) {
        this.kind = kind;
        this.requeue = requeue;
    }

    public static AckOutcome ack() {
        return ACK;
    }

    public static AckOutcome nack(boolean requeue) {
        return new AckOutcome(Kind.NACK, requeue);
    }

    public static AckOutcome reject(boolean requeue) {
        return new AckOutcome(Kind.REJECT, requeue);
    }

    /**
     * State a settled delivery ends up in.
     */
    public DeliveryState terminalState() {
        switch (kind) {
            case ACK:
                return DeliveryState.ACKED;
            case NACK:
                return DeliveryState.NACKED;
            case REJECT:
                return DeliveryState.REJECTED;
            default:
                throw new IllegalStateException("Unknown outcome " + kind);
        }
    }
}
