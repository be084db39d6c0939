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
package com.arc.core.redelivery;

import com.arc.core.Consumer;
import com.arc.core.Delivery;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Client-side view of a broker queue: the messages waiting to be offered again
 * and the round-robin position among the queue's consumers.
 */
class LogicalQueue {

    @Getter
    private final String name;

    private final Deque<Delivery> held = new ArrayDeque<>();

    private int cursor = 0;

    LogicalQueue(String name) {
        this.name = name;
    }

    void offer(Delivery delivery) {
        held.addLast(delivery);
    }

    Delivery poll() {
        return held.pollFirst();
    }

    boolean isEmpty() {
        return held.isEmpty();
    }

    int size() {
        return held.size();
    }

    /**
     * Picks the consumer whose turn it is and advances the cursor.
     */
    Consumer nextCandidate(List<Consumer> candidates) {
        Consumer next = candidates.get(Math.floorMod(cursor, candidates.size()));
        cursor = Math.floorMod(cursor + 1, candidates.size());
        return next;
    }

    int clear() {
        int count = held.size();
        held.clear();
        return count;
    }
}
