/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.ziggurat.net;

import java.net.InetSocketAddress;
import java.util.EnumMap;
import java.util.Map;
import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.apache.ziggurat.config.Config;
import org.apache.ziggurat.metrics.MetricsRecorder;
import org.apache.ziggurat.protocol.Message;
import org.apache.ziggurat.protocol.Network;
import org.apache.ziggurat.protocol.messages.VersionMessage;

/**
 * Everything that shapes how a {@link SyntheticNode} behaves. Instances are immutable; use {@link #builder()}.
 */
public class SyntheticNodeConfig
{
    public enum HandshakeMode
    {
        /** connections are usable as soon as TCP is up */
        NONE,
        /** version and verack must be exchanged both ways first */
        FULL
    }

    public final Network network;
    public final HandshakeMode handshakeMode;
    public final MessageFilter.AutoReply autoReply;
    public final MessageFilter filter;
    public final int maxPeers;
    public final long connectTimeoutMillis;
    public final long ioTimeoutMillis;
    @Nullable
    public final InetSocketAddress listenAddress;
    public final int protocolVersion;
    public final long services;
    public final String userAgent;
    public final int startHeight;
    @Nullable
    public final MetricsRecorder recorder;
    public final boolean tcpNoDelay;

    private SyntheticNodeConfig(Builder builder)
    {
        this.network = builder.network;
        this.handshakeMode = builder.handshakeMode;
        this.autoReply = builder.autoReply;
        this.filter = new MessageFilter(builder.autoReply, builder.filterOverrides);
        this.maxPeers = builder.maxPeers;
        this.connectTimeoutMillis = builder.connectTimeoutMillis;
        this.ioTimeoutMillis = builder.ioTimeoutMillis;
        this.listenAddress = builder.listenAddress;
        this.protocolVersion = builder.protocolVersion;
        this.services = builder.services;
        this.userAgent = builder.userAgent;
        this.startHeight = builder.startHeight;
        this.recorder = builder.recorder;
        this.tcpNoDelay = builder.tcpNoDelay;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static class Builder
    {
        private Network network = Config.NETWORK;
        private HandshakeMode handshakeMode = HandshakeMode.NONE;
        private MessageFilter.AutoReply autoReply = MessageFilter.AutoReply.NONE;
        private final Map<Message.Type, MessageFilter.Action> filterOverrides = new EnumMap<>(Message.Type.class);
        private int maxPeers = Config.MAX_PEERS;
        private long connectTimeoutMillis = Config.CONNECT_TIMEOUT_MS;
        private long ioTimeoutMillis = Config.IO_TIMEOUT_MS;
        private InetSocketAddress listenAddress;
        private int protocolVersion = VersionMessage.DEFAULT_PROTOCOL_VERSION;
        private long services = VersionMessage.DEFAULT_SERVICES;
        private String userAgent = Config.USER_AGENT;
        private int startHeight;
        private MetricsRecorder recorder;
        private boolean tcpNoDelay = Config.TCP_NODELAY;

        private Builder()
        {   }

        public Builder network(Network network)
        {
            this.network = network;
            return this;
        }

        public Builder handshake(HandshakeMode handshakeMode)
        {
            this.handshakeMode = handshakeMode;
            return this;
        }

        public Builder autoReply(MessageFilter.AutoReply autoReply)
        {
            this.autoReply = autoReply;
            return this;
        }

        public Builder filter(Message.Type type, MessageFilter.Action action)
        {
            filterOverrides.put(type, action);
            return this;
        }

        public Builder maxPeers(int maxPeers)
        {
            this.maxPeers = maxPeers;
            return this;
        }

        public Builder connectTimeoutMillis(long connectTimeoutMillis)
        {
            this.connectTimeoutMillis = connectTimeoutMillis;
            return this;
        }

        public Builder ioTimeoutMillis(long ioTimeoutMillis)
        {
            this.ioTimeoutMillis = ioTimeoutMillis;
            return this;
        }

        /**
         * Makes the node accept connections on {@code listenAddress}; port 0 picks any free port.
         */
        public Builder listen(InetSocketAddress listenAddress)
        {
            this.listenAddress = listenAddress;
            return this;
        }

        public Builder protocolVersion(int protocolVersion)
        {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public Builder services(long services)
        {
            this.services = services;
            return this;
        }

        public Builder userAgent(String userAgent)
        {
            this.userAgent = userAgent;
            return this;
        }

        public Builder startHeight(int startHeight)
        {
            this.startHeight = startHeight;
            return this;
        }

        public Builder recorder(MetricsRecorder recorder)
        {
            this.recorder = recorder;
            return this;
        }

        public Builder tcpNoDelay(boolean tcpNoDelay)
        {
            this.tcpNoDelay = tcpNoDelay;
            return this;
        }

        public SyntheticNodeConfig build()
        {
            Preconditions.checkArgument(network != null, "network must be set");
            Preconditions.checkArgument(maxPeers > 0, "maxPeers must be positive, got %s", maxPeers);
            Preconditions.checkArgument(connectTimeoutMillis > 0, "connect timeout must be positive, got %s", connectTimeoutMillis);
            Preconditions.checkArgument(ioTimeoutMillis > 0, "io timeout must be positive, got %s", ioTimeoutMillis);
            Preconditions.checkArgument(userAgent != null, "user agent cannot be null");
            return new SyntheticNodeConfig(this);
        }
    }
}
