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
 * Asks the peer for the addresses it knows about.
 */
public class GetAddrMessage extends Message
{
    public static final Message.Codec<GetAddrMessage> codec = new Message.Codec<GetAddrMessage>()
    {
        public GetAddrMessage decode(ByteBuf body)
        {
            return new GetAddrMessage();
        }

        public void encode(GetAddrMessage msg, ByteBuf out)
        {
            // no body
        }
    };

    public GetAddrMessage()
    {
        super(Message.Type.GETADDR);
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof GetAddrMessage;
    }

    @Override
    public int hashCode()
    {
        return type.hashCode();
    }

    @Override
    public String toString()
    {
        return "GETADDR";
    }
}
