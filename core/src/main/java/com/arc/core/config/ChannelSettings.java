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
package com.arc.core.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Tunables shared by the channels of a connection.
 * <p>
 * Keys, all optional:
 * <ul>
 *     <li>{@code arc.channel.dispatch-threads} handler threads per channel</li>
 *     <li>{@code arc.channel.consumer-tag-prefix} prefix of generated consumer tags</li>
 *     <li>{@code arc.channel.shutdown-quiet-period-ms} quiet period when a channel stops its handlers</li>
 *     <li>{@code arc.channel.shutdown-timeout-ms} upper bound on waiting for handlers to finish</li>
 * </ul>
 */
@Slf4j
@Getter
@Builder
@ToString
public class ChannelSettings {

    public static final String RESOURCE_NAME = "arc-channel.properties";

    public static final String DISPATCH_THREADS = "arc.channel.dispatch-threads";

    public static final String CONSUMER_TAG_PREFIX = "arc.channel.consumer-tag-prefix";

    public static final String SHUTDOWN_QUIET_PERIOD_MS = "arc.channel.shutdown-quiet-period-ms";

    public static final String SHUTDOWN_TIMEOUT_MS = "arc.channel.shutdown-timeout-ms";

    @Builder.Default
    private final int dispatchThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

    @Builder.Default
    private final String consumerTagPrefix = "amq.ctag-";

    @Builder.Default
    private final long shutdownQuietPeriodMillis = 0;

    @Builder.Default
    private final long shutdownTimeoutMillis = 5000;

    public static ChannelSettings defaults() {
        return ChannelSettings.builder().build();
    }

    /**
     * Reads settings from properties, keeping defaults for absent keys
     *
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static ChannelSettings fromProperties(Properties properties) {
        ChannelSettingsBuilder builder = ChannelSettings.builder();
        String threads = properties.getProperty(DISPATCH_THREADS);
        if (threads != null) {
            int value = parseLong(DISPATCH_THREADS, threads).intValue();
            if (value < 1) {
                throw new IllegalArgumentException(DISPATCH_THREADS + " must be positive, got " + value);
            }
            builder.dispatchThreads(value);
        }
        String prefix = properties.getProperty(CONSUMER_TAG_PREFIX);
        if (prefix != null) {
            builder.consumerTagPrefix(prefix.trim());
        }
        String quietPeriod = properties.getProperty(SHUTDOWN_QUIET_PERIOD_MS);
        if (quietPeriod != null) {
            builder.shutdownQuietPeriodMillis(nonNegative(SHUTDOWN_QUIET_PERIOD_MS, quietPeriod));
        }
        String timeout = properties.getProperty(SHUTDOWN_TIMEOUT_MS);
        if (timeout != null) {
            builder.shutdownTimeoutMillis(nonNegative(SHUTDOWN_TIMEOUT_MS, timeout));
        }
        return builder.build();
    }

    /**
     * Reads {@value #RESOURCE_NAME} from the classpath, defaults if it is absent
     */
    public static ChannelSettings load() {
        try (InputStream in = ChannelSettings.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", RESOURCE_NAME);
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            ChannelSettings settings = fromProperties(properties);
            log.info("Loaded channel settings {}", settings);
            return settings;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE_NAME, e);
        }
    }

    private static long nonNegative(String key, String value) {
        long parsed = parseLong(key, value);
        if (parsed < 0) {
            throw new IllegalArgumentException(key + " must not be negative, got " + parsed);
        }
        return parsed;
    }

    private static Long parseLong(String key, String value) {
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value '" + value + "' for " + key, e);
        }
    }
}
