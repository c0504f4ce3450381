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
import java.net.BindException;
import java.net.InetSocketAddress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.epoll.EpollSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.internal.logging.InternalLoggerFactory;
import io.netty.util.internal.logging.Slf4JLoggerFactory;
import org.apache.ziggurat.config.Config;

/**
 * A central spot for building Netty {@link Channel}s, both the listening ones and the ones dialing out. All synthetic
 * nodes of the process share the same event loops.
 */
final class NettyFactory
{
    private static final Logger logger = LoggerFactory.getLogger(NettyFactory.class);

    static final String WIRETRACE_HANDLER_NAME = "logger";
    static final String ENCODER_HANDLER_NAME = "messageEncoder";
    static final String DECODER_HANDLER_NAME = "messageDecoder";
    static final String HANDSHAKE_HANDLER_NAME = "handshakeHandler";
    static final String INBOUND_HANDLER_NAME = "inboundMessageHandler";
    static final String ERROR_HANDLER_NAME = "errorHandler";

    static
    {
        InternalLoggerFactory.setDefaultFactory(Slf4JLoggerFactory.INSTANCE);
    }

    private static final boolean useEpoll = Config.USE_EPOLL && Epoll.isAvailable();
    static
    {
        if (Config.USE_EPOLL && !useEpoll)
            logger.debug("epoll not available, falling back to nio: {}", Epoll.unavailabilityCause().toString());
    }

    private static final EventLoopGroup ACCEPT_GROUP = getEventLoopGroup(1, "SyntheticNode-Acceptor");
    private static final EventLoopGroup IO_GROUP = getEventLoopGroup(Runtime.getRuntime().availableProcessors() * 2, "SyntheticNode-IO");

    private static EventLoopGroup getEventLoopGroup(int threadCount, String threadNamePrefix)
    {
        DefaultThreadFactory threadFactory = new DefaultThreadFactory(threadNamePrefix, true);
        if (useEpoll)
        {
            logger.debug("using netty epoll event loop for pool prefix {}", threadNamePrefix);
            return new EpollEventLoopGroup(threadCount, threadFactory);
        }

        logger.debug("using netty nio event loop for pool prefix {}", threadNamePrefix);
        return new NioEventLoopGroup(threadCount, threadFactory);
    }

    private NettyFactory()
    {   }

    /**
     * Create a {@link Channel} that listens on {@code localAddr}. This blocks while binding.
     */
    static Channel createInboundChannel(InetSocketAddress localAddr, ChannelInitializer<SocketChannel> initializer, boolean tcpNoDelay) throws IOException
    {
        Class<? extends ServerChannel> transport = useEpoll ? EpollServerSocketChannel.class : NioServerSocketChannel.class;
        ServerBootstrap bootstrap = new ServerBootstrap().group(ACCEPT_GROUP, IO_GROUP)
                                                         .channel(transport)
                                                         .option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                                                         .option(ChannelOption.SO_BACKLOG, 1024)
                                                         .option(ChannelOption.SO_REUSEADDR, true)
                                                         .childOption(ChannelOption.TCP_NODELAY, tcpNoDelay)
                                                         .childOption(ChannelOption.SO_KEEPALIVE, true)
                                                         .childHandler(initializer);

        ChannelFuture channelFuture = bootstrap.bind(localAddr);
        if (!channelFuture.awaitUninterruptibly().isSuccess())
        {
            if (channelFuture.channel().isOpen())
                channelFuture.channel().close();

            Throwable cause = channelFuture.cause();
            if (cause instanceof IOException)
            {
                BindException e = new BindException("Unable to listen on " + localAddr + ": " + cause.getMessage());
                e.initCause(cause);
                throw e;
            }
            throw new IllegalStateException("Unable to listen on " + localAddr, cause);
        }

        logger.debug("listening on {}", channelFuture.channel().localAddress());
        return channelFuture.channel();
    }

    /**
     * Create the {@link Bootstrap} for connecting to a remote peer. This method does <b>not</b> attempt to connect to
     * the peer, and thus does not block.
     */
    static Bootstrap createOutboundBootstrap(ChannelInitializer<SocketChannel> initializer, long connectTimeoutMillis, boolean tcpNoDelay)
    {
        Class<? extends Channel> transport = useEpoll ? EpollSocketChannel.class : NioSocketChannel.class;
        return new Bootstrap().group(IO_GROUP)
                              .channel(transport)
                              .option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                              .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(connectTimeoutMillis, Integer.MAX_VALUE))
                              .option(ChannelOption.SO_KEEPALIVE, true)
                              .option(ChannelOption.TCP_NODELAY, tcpNoDelay)
                              .handler(initializer);
    }

    static void addWiretrace(ChannelPipeline pipeline)
    {
        if (Config.WIRETRACE)
            pipeline.addLast(WIRETRACE_HANDLER_NAME, new LoggingHandler(LogLevel.INFO));
    }

    /**
     * Whether the calling thread is one of our event loops, where blocking is forbidden.
     */
    static boolean isEventLoopThread()
    {
        for (EventExecutor executor : IO_GROUP)
        {
            if (executor.inEventLoop())
                return true;
        }
        return false;
    }
}
