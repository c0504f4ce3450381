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
package org.apache.ziggurat.protocol;

import java.util.HashMap;
import java.util.Map;

import io.netty.buffer.ByteBuf;

import org.apache.ziggurat.protocol.messages.*;

/**
 * A message of the peer-to-peer protocol. Each concrete message is identified on the wire by the command string of
 * its {@link Type}.
 */
public abstract class Message
{
    /**
     * Encodes and decodes message bodies. Header framing is handled by {@link MessageCodec}.
     */
    public interface Codec<M extends Message>
    {
        /**
         * Decodes a body. {@code body} holds exactly the bytes of one body; running past its end must raise a
         * {@link ProtocolException}.
         */
        M decode(ByteBuf body);

        void encode(M message, ByteBuf out);
    }

    public enum Type
    {
        VERSION    ("version",    VersionMessage.codec),
        VERACK     ("verack",     VerackMessage.codec),
        PING       ("ping",       PingMessage.codec),
        PONG       ("pong",       PongMessage.codec),
        GETADDR    ("getaddr",    GetAddrMessage.codec),
        ADDR       ("addr",       AddrMessage.codec),
        MEMPOOL    ("mempool",    MemPoolMessage.codec),
        INV        ("inv",        InvMessage.codec),
        GETDATA    ("getdata",    GetDataMessage.codec),
        NOTFOUND   ("notfound",   NotFoundMessage.codec),
        GETBLOCKS  ("getblocks",  GetBlocksMessage.codec),
        GETHEADERS ("getheaders", GetHeadersMessage.codec),
        REJECT     ("reject",     RejectMessage.codec);

        public final String command;
        public final Codec<?> codec;

        private static final Map<String, Type> commandIdx = new HashMap<>();
        static
        {
            for (Type type : Type.values())
            {
                if (commandIdx.put(type.command, type) != null)
                    throw new IllegalStateException("Duplicate command " + type.command);
            }
        }

        Type(String command, Codec<?> codec)
        {
            this.command = command;
            this.codec = codec;
        }

        public static Type fromCommand(String command)
        {
            Type t = commandIdx.get(command);
            if (t == null)
                throw new ProtocolException(String.format("Unknown command '%s'", command));
            return t;
        }
    }

    public final Type type;

    protected Message(Type type)
    {
        this.type = type;
    }

    @SuppressWarnings("unchecked")
    public void encodeBody(ByteBuf out)
    {
        ((Codec<Message>) type.codec).encode(this, out);
    }
}
