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

import io.netty.buffer.ByteBuf;

import org.apache.ziggurat.protocol.Message;

/**
 * Asks the peer for the transactions of its memory pool.
 */
public class MemPoolMessage extends Message
{
    public static final Message.Codec<MemPoolMessage> codec = new Message.Codec<MemPoolMessage>()
    {
        public MemPoolMessage decode(ByteBuf body)
        {
            return new MemPoolMessage();
        }

        public void encode(MemPoolMessage msg, ByteBuf out)
        {
            // no body
        }
    };

    public MemPoolMessage()
    {
        super(Message.Type.MEMPOOL);
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof MemPoolMessage;
    }

    @Override
    public int hashCode()
    {
        return type.hashCode();
    }

    @Override
    public String toString()
    {
        return "MEMPOOL";
    }
}
