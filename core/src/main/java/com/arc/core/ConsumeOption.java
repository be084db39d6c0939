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

import java.util.Set;

/**
 * Options recognized by {@link AmqpChannel#subscribe}.
 */
public enum ConsumeOption {

    AUTOMATIC_ACK_MODE,

    MANUAL_ACK_MODE,

    EXCLUSIVE;

    /**
     * Resolves the ack mode of a subscription; automatic when neither mode is given.
     *
     * @throws IllegalArgumentException if both ack modes are requested
     */
    public static AckMode ackModeOf(Set<ConsumeOption> options) {
        if (options == null) {
            return AckMode.AUTOMATIC;
        }
        boolean automatic = options.contains(AUTOMATIC_ACK_MODE);
        boolean manual = options.contains(MANUAL_ACK_MODE);
        if (automatic && manual) {
            throw new IllegalArgumentException("automatic and manual ack mode are mutually exclusive");
        }
        return manual ? AckMode.MANUAL : AckMode.AUTOMATIC;
    }

    public static boolean isExclusive(Set<ConsumeOption> options) {
        return options != null && options.contains(EXCLUSIVE);
    }
}
