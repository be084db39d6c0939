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

import lombok.Getter;

/**
 * Base type of every failure raised by the acknowledgment engine.
 * Carries the AMQP reply code a broker would use for the same fault.
 */
@Getter
public class AmqpException extends RuntimeException {

    private final int errorCode;

    private final boolean closeConnection;

    public AmqpException(int errorCode, String message, boolean closeConnection) {
        super(message);
        this.errorCode = errorCode;
        this.closeConnection = closeConnection;
    }

    public AmqpException(int errorCode, String message) {
        this(errorCode, message, false);
    }

    public boolean shouldCloseConnection() {
        return closeConnection;
    }

    /**
     * AMQP 0-9-1 reply codes.
     */
    public interface Codes {
        int NO_CONSUMERS = 313;
        int ACCESS_REFUSED = 403;
        int NOT_FOUND = 404;
        int PRECONDITION_FAILED = 406;
        int CHANNEL_ERROR = 504;
        int NOT_ALLOWED = 530;
    }
}
