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

import com.arc.core.ack.AckFrameSender;
import com.arc.core.config.ChannelSettings;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the channels multiplexed over one transport connection and routes inbound
 * deliveries to them. Channels share nothing but the outbound sender and the settings.
 */
@Slf4j
public class AmqpConnection implements DeliveryFrameReceiver {

    // Map: channelId -> AmqpChannel
    private final Map<Integer, AmqpChannel> channels = new ConcurrentHashMap<>();

    private final AckFrameSender sender;

    @Getter
    private final ChannelSettings settings;

    public AmqpConnection(AckFrameSender sender) {
        this(sender, ChannelSettings.load());
    }

    public AmqpConnection(AckFrameSender sender, ChannelSettings settings) {
        this.sender = sender;
        this.settings = settings;
    }

    public AmqpChannel openChannel(int channelId) {
        return openChannel(channelId, ChannelEventListener.NO_OP);
    }

    /**
     * Opens a channel
     *
     * @throws IllegalArgumentException if the id is outside 1..65535
     * @throws IllegalStateException if a channel with this id is already open
     */
    public AmqpChannel openChannel(int channelId, ChannelEventListener listener) {
        if (channelId < 1 || channelId > 0xFFFF) {
            throw new IllegalArgumentException("Invalid channel id " + channelId);
        }
        AmqpChannel channel = new AmqpChannel(this, channelId, sender, settings,
            listener == null ? ChannelEventListener.NO_OP : listener);
        attach(channel);
        channel.open();
        return channel;
    }

    public AmqpChannel getChannel(int channelId) {
        return channels.get(channelId);
    }

    public Collection<AmqpChannel> getChannels() {
        return new ArrayList<>(channels.values());
    }

    @Override
    public void onDeliveryFrame(int channelId, String consumerTag, long deliveryTag, boolean redelivered, byte[] body) {
        AmqpChannel channel = channels.get(channelId);
        if (channel == null) {
            throw new AmqpException(AmqpException.Codes.CHANNEL_ERROR,
                "Delivery " + deliveryTag + " received on unknown channel " + channelId, true);
        }
        channel.onDeliveryFrame(consumerTag, deliveryTag, redelivered, body);
    }

    /**
     * Closes a channel and forgets it; its id may be opened again.
     */
    public void closeChannel(AmqpChannel channel) {
        channel.close();
        detach(channel);
    }

    void attach(AmqpChannel channel) {
        if (channels.putIfAbsent(channel.getChannelId(), channel) != null) {
            throw new IllegalStateException("Channel " + channel.getChannelId() + " is already open");
        }
    }

    void detach(AmqpChannel channel) {
        channels.remove(channel.getChannelId(), channel);
    }

    public void close() {
        getChannels().forEach(this::closeChannel);
        log.info("Connection closed");
    }
}
