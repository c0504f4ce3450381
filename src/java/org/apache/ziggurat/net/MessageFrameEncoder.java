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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import org.apache.ziggurat.protocol.Message;
import org.apache.ziggurat.protocol.MessageCodec;

class MessageFrameEncoder extends MessageToByteEncoder<Message>
{
    private static final Logger logger = LoggerFactory.getLogger(MessageFrameEncoder.class);

    private final MessageCodec codec;
    private final NodeMetrics metrics;

    MessageFrameEncoder(MessageCodec codec, NodeMetrics metrics)
    {
        super(Message.class);
        this.codec = codec;
        this.metrics = metrics;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Message message, ByteBuf out)
    {
        codec.encode(message, out);
        metrics.messageSent();
        logger.trace("sent {} to {}", message, ctx.channel().remoteAddress());
    }
}
