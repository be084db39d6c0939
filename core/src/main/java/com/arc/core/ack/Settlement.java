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

import com.arc.core.PendingAckTable.PendingAck;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of one ack, nack or reject call.
 */
@Value
public class Settlement {

    /**
     * Frame handed to the transport, null if the settled deliveries are unknown to the broker
     */
    AckIntent intent;

    /**
     * Deliveries removed from the pending table, in ascending tag order
     */
    List<PendingAck> settled;

    public List<Long> getDeliveryTags() {
        return settled.stream().map(PendingAck::getDeliveryTag).collect(Collectors.toList());
    }

    public boolean isEmitted() {
        return intent != null;
    }

    public int size() {
        return settled.size();
    }
}
