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
package org.apache.ziggurat.protocol.messages;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

import io.netty.buffer.ByteBuf;

import org.apache.ziggurat.protocol.Message;
import org.apache.ziggurat.protocol.NetAddr;
import org.apache.ziggurat.protocol.WireUtil;

/**
 * Opens the handshake, advertising what the sender runs and where it thinks both ends are.
 * <pre>
 * {@code
 *   version (4) | services (8) | timestamp (8) | addr_recv (26) | addr_from (26) | nonce (8)
 *   | user agent (var-str) | start height (4) | relay (1)
 * }
 * </pre>
 */
public class VersionMessage extends Message
{
    /**
     * The protocol version we announce unless told otherwise.
     */
    public static final int DEFAULT_PROTOCOL_VERSION = 170_013;

    /**
     * NODE_NETWORK.
     */
    public static final long DEFAULT_SERVICES = 1;

    public static final Message.Codec<VersionMessage> codec = new Message.Codec<VersionMessage>()
    {
        public VersionMessage decode(ByteBuf body)
        {
            int version = WireUtil.readIntLE(body);
            long services = WireUtil.readLongLE(body);
            long timestamp = WireUtil.readLongLE(body);
            NetAddr receiver = NetAddr.deserialize(body);
            NetAddr sender = NetAddr.deserialize(body);
            long nonce = WireUtil.readLongLE(body);
            String userAgent = WireUtil.readString(body);
            int startHeight = WireUtil.readIntLE(body);
            boolean relay = WireUtil.readBoolean(body);
            return new VersionMessage(version, services, timestamp, receiver, sender, nonce, userAgent, startHeight, relay);
        }

        public void encode(VersionMessage msg, ByteBuf out)
        {
            out.writeIntLE(msg.version);
            out.writeLongLE(msg.services);
            out.writeLongLE(msg.timestamp);
            msg.receiver.serialize(out);
            msg.sender.serialize(out);
            out.writeLongLE(msg.nonce);
            WireUtil.writeString(out, msg.userAgent);
            out.writeIntLE(msg.startHeight);
            out.writeByte(msg.relay ? 1 : 0);
        }
    };

    public final int version;
    public final long services;
    /**
     * Seconds since the epoch, as sent. May lie outside the range of {@link Instant}.
     */
    public final long timestamp;
    public final NetAddr receiver;
    public final NetAddr sender;
    public final long nonce;
    public final String userAgent;
    public final int startHeight;
    public final boolean relay;

    public VersionMessage(int version,
                          long services,
                          long timestamp,
                          NetAddr receiver,
                          NetAddr sender,
                          long nonce,
                          String userAgent,
                          int startHeight,
                          boolean relay)
    {
        super(Message.Type.VERSION);
        this.version = version;
        this.services = services;
        this.timestamp = timestamp;
        this.receiver = Objects.requireNonNull(receiver);
        this.sender = Objects.requireNonNull(sender);
        this.nonce = nonce;
        this.userAgent = Objects.requireNonNull(userAgent);
        this.startHeight = startHeight;
        this.relay = relay;
    }

    /**
     * The timestamp as an {@link Instant}.
     *
     * @throws java.time.DateTimeException if the peer sent seconds outside the range of {@link Instant}
     */
    public Instant timestampInstant()
    {
        return Instant.ofEpochSecond(timestamp);
    }

    /**
     * A version message timestamped now, with a random nonce and no transaction relay.
     */
    public static VersionMessage create(int version, long services, NetAddr receiver, NetAddr sender, String userAgent, int startHeight)
    {
        return new VersionMessage(version,
                                  services,
                                  Instant.now().getEpochSecond(),
                                  receiver,
                                  sender,
                                  ThreadLocalRandom.current().nextLong(),
                                  userAgent,
                                  startHeight,
                                  false);
    }

    /**
     * A version message with every default: {@link #DEFAULT_PROTOCOL_VERSION}, {@link #DEFAULT_SERVICES}, an empty user
     * agent and a start height of 0.
     */
    public static VersionMessage create(NetAddr receiver, NetAddr sender)
    {
        return create(DEFAULT_PROTOCOL_VERSION, DEFAULT_SERVICES, receiver, sender, "", 0);
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof VersionMessage))
            return false;

        VersionMessage that = (VersionMessage) other;
        return this.version == that.version
            && this.services == that.services
            && this.timestamp == that.timestamp
            && this.receiver.equals(that.receiver)
            && this.sender.equals(that.sender)
            && this.nonce == that.nonce
            && this.userAgent.equals(that.userAgent)
            && this.startHeight == that.startHeight
            && this.relay == that.relay;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(version, services, timestamp, receiver, sender, nonce, userAgent, startHeight, relay);
    }

    @Override
    public String toString()
    {
        return String.format("VERSION %d services=%s agent='%s' height=%d from %s", version, Long.toUnsignedString(services), userAgent, startHeight, sender);
    }
}
