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

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.apache.ziggurat.protocol.Message;

/**
 * Applies the node's {@link MessageFilter} to every message of a ready connection: answers those that call for an
 * automatic reply, on this same channel, and hands the others to the {@link #sink} in the order they arrived.
 */
class InboundMessageHandler extends SimpleChannelInboundHandler<Message>
{
    private static final Logger logger = LoggerFactory.getLogger(InboundMessageHandler.class);

    private final Connection connection;
    private final MessageFilter filter;
    private final NodeMetrics metrics;
    private final Consumer<InboundMessage> sink;

    InboundMessageHandler(Connection connection, MessageFilter filter, NodeMetrics metrics, Consumer<InboundMessage> sink)
    {
        this.connection = connection;
        this.filter = filter;
        this.metrics = metrics;
        this.sink = sink;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Message message)
    {
        MessageFilter.Action action = filter.action(message.type);
        if (action == MessageFilter.Action.DROP)
        {
            logger.trace("dropping {} from {}", message, connection.peer);
            return;
        }

        if (MessageFilter.replies(action))
        {
            Message reply = MessageFilter.canonicalReply(message);
            if (reply != null)
            {
                ctx.writeAndFlush(reply);
                metrics.autoReply();
            }
            if (action == MessageFilter.Action.AUTO_REPLY_AND_DROP)
                return;
        }

        sink.accept(new InboundMessage(connection.peer, message, System.nanoTime()));
    }
}
