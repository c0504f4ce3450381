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

import java.util.concurrent.ThreadLocalRandom;

import io.netty.buffer.ByteBuf;

import org.apache.ziggurat.protocol.Message;
import org.apache.ziggurat.protocol.WireUtil;

/**
 * A liveness probe. The peer is expected to answer with a {@link PongMessage} carrying the same nonce.
 */
public class PingMessage extends Message
{
    public static final Message.Codec<PingMessage> codec = new Message.Codec<PingMessage>()
    {
        public PingMessage decode(ByteBuf body)
        {
            return new PingMessage(WireUtil.readLongLE(body));
        }

        public void encode(PingMessage msg, ByteBuf out)
        {
            out.writeLongLE(msg.nonce);
        }
    };

    public final long nonce;

    public PingMessage(long nonce)
    {
        super(Message.Type.PING);
        this.nonce = nonce;
    }

    public static PingMessage random()
    {
        return new PingMessage(ThreadLocalRandom.current().nextLong());
    }

    public PongMessage reply()
    {
        return new PongMessage(nonce);
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof PingMessage && ((PingMessage) other).nonce == nonce;
    }

    @Override
    public int hashCode()
    {
        return Long.hashCode(nonce);
    }

    @Override
    public String toString()
    {
        return "PING " + Long.toUnsignedString(nonce);
    }
}
