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

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import org.apache.ziggurat.protocol.ProtocolException;

/**
 * Last {@link ChannelHandler} of every connection's pipeline. It centralizes error handling: whatever goes wrong, the
 * connection is classified and closed, and the node's other connections carry on.
 */
class ConnectionErrorHandler extends ChannelInboundHandlerAdapter
{
    private static final Logger logger = LoggerFactory.getLogger(ConnectionErrorHandler.class);

    private final Connection connection;
    private final NodeMetrics metrics;

    ConnectionErrorHandler(Connection connection, NodeMetrics metrics)
    {
        this.connection = connection;
        this.metrics = metrics;
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        // decoding errors come wrapped by netty
        if (cause instanceof DecoderException && cause.getCause() != null)
            cause = cause.getCause();

        if (cause instanceof ProtocolException)
        {
            metrics.protocolError();
            logger.debug("protocol error from {}; closing: {}", connection.peer, cause.getMessage());
            connection.markDisconnect(Disconnect.Reason.PROTOCOL_ERROR, cause);
        }
        else if (cause instanceof IOException)
        {
            logger.trace("IOException on connection with {}; closing", connection.peer, cause);
            connection.markDisconnect(Disconnect.Reason.TRANSPORT_ERROR, cause);
        }
        else
        {
            logger.warn("exception caught in pipeline of connection with {}", connection.peer, cause);
            connection.markDisconnect(Disconnect.Reason.TRANSPORT_ERROR, cause);
        }

        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx)
    {
        logger.debug("connection with {} closed", connection.peer);
        connection.markDisconnect(Disconnect.Reason.PEER_CLOSED, null);
        ctx.fireChannelInactive();
    }
}
