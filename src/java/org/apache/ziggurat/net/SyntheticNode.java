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
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.ConnectTimeoutException;
import io.netty.channel.socket.SocketChannel;
import org.apache.ziggurat.metrics.MetricsRecorder;
import org.apache.ziggurat.net.HandshakeHandler.HandshakeResult;
import org.apache.ziggurat.protocol.Message;
import org.apache.ziggurat.protocol.MessageCodec;

/**
 * A virtual peer: it dials nodes (or accepts their connections), handshakes as configured, and lets a test scenario
 * send arbitrary messages and wait for the ones that come back.
 * <p>
 * All I/O happens on Netty event loops shared by every node of the process. Decoded messages of every connection are
 * queued, in the order each connection received them, until {@link #recvMessageTimeout(long, TimeUnit)} takes them.
 * Messages the {@link MessageFilter} answers automatically are replied to from the event loop and never wait on the
 * scenario.
 * <p>
 * Every connection, whether it completed its handshake or not, counts against {@link SyntheticNodeConfig#maxPeers}
 * until its channel is closed.
 */
public class SyntheticNode implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(SyntheticNode.class);

    private final SyntheticNodeConfig config;
    private final MessageCodec codec;
    private final NodeMetrics metrics;

    private final BlockingQueue<InboundMessage> inbound = new LinkedBlockingQueue<>();

    /**
     * Connections that are ready for use, by peer address.
     */
    private final ConcurrentMap<InetSocketAddress, Connection> connections = new ConcurrentHashMap<>();

    /**
     * Peers we are dialing or handshaking with.
     */
    private final Set<InetSocketAddress> pending = ConcurrentHashMap.newKeySet();

    /**
     * Every connection with an open channel.
     */
    private final Set<Connection> live = ConcurrentHashMap.newKeySet();

    private final AtomicInteger peerSlots = new AtomicInteger();

    private volatile Channel listener;
    private volatile boolean isShutdown;

    public SyntheticNode(SyntheticNodeConfig config)
    {
        this.config = config;
        this.codec = new MessageCodec(config.network);
        this.metrics = config.recorder == null ? NodeMetrics.NONE : new NodeMetrics(config.recorder);
    }

    /**
     * Registers the series nodes record into, for a recorder that was cleared after the node was built.
     */
    public static void registerMetrics(MetricsRecorder recorder)
    {
        NodeMetrics.register(recorder);
    }

    public SyntheticNodeConfig config()
    {
        return config;
    }

    /**
     * Starts listening, if the node was configured with a listen address. Nodes without one need not be started.
     */
    public synchronized SyntheticNode start() throws IOException
    {
        Preconditions.checkState(!isShutdown, "Node has been shut down");
        if (config.listenAddress != null && listener == null)
            listener = NettyFactory.createInboundChannel(config.listenAddress, new InboundInitializer(), config.tcpNoDelay);
        return this;
    }

    /**
     * The address the node actually listens on, or null if it does not listen.
     */
    @Nullable
    public InetSocketAddress listeningAddress()
    {
        Channel channel = listener;
        return channel == null ? null : (InetSocketAddress) channel.localAddress();
    }

    /**
     * Connects to {@code peer} and performs the configured handshake, blocking until the connection is ready.
     *
     * @throws HandshakeTimeoutException if connecting or any step of the handshake takes too long
     * @throws IOException if the connection is refused, fails or the handshake goes wrong
     * @throws IllegalStateException if the node is already tracking {@code peer}, or has no peer slot left
     */
    public Connection connect(InetSocketAddress peer) throws IOException, InterruptedException
    {
        checkNotOnEventLoop();
        try
        {
            return connectAsync(peer).get();
        }
        catch (ExecutionException e)
        {
            Throwable cause = e.getCause();
            Throwables.throwIfInstanceOf(cause, IOException.class);
            Throwables.throwIfUnchecked(cause);
            throw new IOException(cause);
        }
    }

    /**
     * Like {@link #connect(InetSocketAddress)}, but returns right away. The future fails with the exceptions
     * {@code connect} would throw, bar the {@link IllegalStateException}s which are thrown immediately.
     */
    public CompletableFuture<Connection> connectAsync(InetSocketAddress peer)
    {
        Preconditions.checkState(!isShutdown, "Node has been shut down");
        if (connections.containsKey(peer) || !pending.add(peer))
            throw new IllegalStateException("Already connected or connecting to " + peer);
        if (!reservePeerSlot())
        {
            pending.remove(peer);
            throw new IllegalStateException(String.format("Cannot connect to %s, already at the maximum of %d peers", peer, config.maxPeers));
        }

        CompletableFuture<Connection> result = new CompletableFuture<>();
        OutboundInitializer initializer = new OutboundInitializer(peer, result);
        ChannelFuture connectFuture = NettyFactory.createOutboundBootstrap(initializer, config.connectTimeoutMillis, config.tcpNoDelay)
                                                  .connect(peer);
        connectFuture.channel().closeFuture().addListener((ChannelFutureListener) future -> releasePeerSlot());
        connectFuture.addListener((ChannelFutureListener) future -> connectComplete(future, initializer, result));
        return result;
    }

    private void connectComplete(ChannelFuture future, OutboundInitializer initializer, CompletableFuture<Connection> result)
    {
        InetSocketAddress peer = initializer.peer;
        Connection connection = initializer.connection;
        if (future.isSuccess())
        {
            logger.debug("connected to {}", peer);
            if (config.handshakeMode == SyntheticNodeConfig.HandshakeMode.NONE)
            {
                connection.state(Connection.State.READY);
                connections.put(peer, connection);
                pending.remove(peer);
                result.complete(connection);
            }
            return;
        }

        pending.remove(peer);
        Throwable cause = future.cause();
        if (cause instanceof ConnectTimeoutException)
        {
            metrics.handshakeTimeout();
            HandshakeTimeoutException timeout = new HandshakeTimeoutException(HandshakeTimeoutException.Step.CONNECT, peer, config.connectTimeoutMillis, cause);
            if (connection != null)
                connection.markDisconnect(Disconnect.Reason.HANDSHAKE_TIMEOUT, timeout);
            result.completeExceptionally(timeout);
        }
        else
        {
            logger.debug("failed to connect to {}: {}", peer, cause.toString());
            if (connection != null)
                connection.markDisconnect(Disconnect.Reason.TRANSPORT_ERROR, cause);
            result.completeExceptionally(cause);
        }
    }

    private void outboundHandshakeComplete(HandshakeResult handshake, CompletableFuture<Connection> result)
    {
        InetSocketAddress peer = handshake.connection.peer;
        switch (handshake.outcome)
        {
            case SUCCESS:
                connections.put(peer, handshake.connection);
                pending.remove(peer);
                result.complete(handshake.connection);
                break;
            case TIMEOUT:
                pending.remove(peer);
                result.completeExceptionally(new HandshakeTimeoutException(handshake.step, peer, config.ioTimeoutMillis));
                break;
            default:
                pending.remove(peer);
                result.completeExceptionally(new IOException("Handshake with " + peer + " failed", handshake.cause));
        }
    }

    private void inboundHandshakeComplete(HandshakeResult handshake)
    {
        if (handshake.outcome == HandshakeResult.Outcome.SUCCESS)
            connections.put(handshake.connection.peer, handshake.connection);
        else
            logger.debug("inbound handshake with {} did not complete: {}", handshake.connection.peer, handshake.outcome);
    }

    /**
     * Sends {@code message} to {@code peer} without waiting for any response.
     *
     * @return the future of the write
     * @throws ConnectionNotFoundException if there is no ready connection to {@code peer}
     */
    public ChannelFuture sendDirectMessage(InetSocketAddress peer, Message message)
    {
        Connection connection = connections.get(peer);
        if (connection == null || !connection.channel.isActive())
            throw new ConnectionNotFoundException(peer);

        return connection.send(message);
    }

    /**
     * Takes the next message received on any connection, waiting up to {@code timeout} for one to arrive.
     *
     * @throws TimeoutException if nothing arrived in time
     */
    public InboundMessage recvMessageTimeout(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException
    {
        checkNotOnEventLoop();
        InboundMessage message = inbound.poll(timeout, unit);
        if (message == null)
            throw new TimeoutException(String.format("No message received within %d %s", timeout, unit.toString().toLowerCase()));
        return message;
    }

    /**
     * Number of received messages waiting to be taken.
     */
    public int queuedMessages()
    {
        return inbound.size();
    }

    /**
     * Closes the connection to {@code peer} and waits until its channel is closed.
     *
     * @throws ConnectionNotFoundException if there is no ready connection to {@code peer}
     */
    public void disconnect(InetSocketAddress peer) throws InterruptedException
    {
        Connection connection = connections.remove(peer);
        if (connection == null)
            throw new ConnectionNotFoundException(peer);

        logger.debug("disconnecting from {}", peer);
        connection.close().await();
    }

    @Nullable
    public Connection connection(InetSocketAddress peer)
    {
        return connections.get(peer);
    }

    public Set<InetSocketAddress> connectedPeers()
    {
        return ImmutableSet.copyOf(connections.keySet());
    }

    public boolean isConnected(InetSocketAddress peer)
    {
        Connection connection = connections.get(peer);
        return connection != null && connection.isReady();
    }

    /**
     * Closes every connection, including those still handshaking, and the listener. Waits for all channels to be
     * closed. A node cannot be restarted.
     */
    public void shutdown()
    {
        checkNotOnEventLoop();
        isShutdown = true;

        Channel channel = listener;
        if (channel != null)
            channel.close().awaitUninterruptibly();

        List<ChannelFuture> closing = new ArrayList<>();
        for (Connection connection : live)
            closing.add(connection.close());
        for (ChannelFuture future : closing)
            future.awaitUninterruptibly();

        connections.clear();
        logger.debug("synthetic node shut down, {} connections closed", closing.size());
    }

    @Override
    public void close()
    {
        shutdown();
    }

    @VisibleForTesting
    int peerSlotsInUse()
    {
        return peerSlots.get();
    }

    @VisibleForTesting
    int liveConnections()
    {
        return live.size();
    }

    private boolean reservePeerSlot()
    {
        if (peerSlots.incrementAndGet() <= config.maxPeers)
            return true;

        peerSlots.decrementAndGet();
        return false;
    }

    private void releasePeerSlot()
    {
        peerSlots.decrementAndGet();
    }

    private static void checkNotOnEventLoop()
    {
        Preconditions.checkState(!NettyFactory.isEventLoopThread(), "Blocking operations cannot be called from a netty event loop");
    }

    private void setupPipeline(Channel channel, Connection connection, HandshakeHandler.Role role, Consumer<HandshakeResult> callback)
    {
        live.add(connection);
        channel.closeFuture().addListener((ChannelFutureListener) future -> {
            live.remove(connection);
            connections.remove(connection.peer, connection);
            connection.closed();
            logger.debug("{} closed: {}", connection, connection.disconnect());
        });

        // order of handlers: logger -> encoder -> decoder -> handshake -> inbound messages -> errors
        ChannelPipeline pipeline = channel.pipeline();
        NettyFactory.addWiretrace(pipeline);
        pipeline.addLast(NettyFactory.ENCODER_HANDLER_NAME, new MessageFrameEncoder(codec, metrics));
        pipeline.addLast(NettyFactory.DECODER_HANDLER_NAME, new MessageFrameDecoder(codec, metrics));
        if (config.handshakeMode == SyntheticNodeConfig.HandshakeMode.FULL)
            pipeline.addLast(NettyFactory.HANDSHAKE_HANDLER_NAME, new HandshakeHandler(role, connection, config, metrics, callback));
        pipeline.addLast(NettyFactory.INBOUND_HANDLER_NAME, new InboundMessageHandler(connection, config.filter, metrics, inbound::add));
        pipeline.addLast(NettyFactory.ERROR_HANDLER_NAME, new ConnectionErrorHandler(connection, metrics));
    }

    private class OutboundInitializer extends ChannelInitializer<SocketChannel>
    {
        private final InetSocketAddress peer;
        private final CompletableFuture<Connection> result;

        // set when the channel registers, before the connect attempt
        private volatile Connection connection;

        OutboundInitializer(InetSocketAddress peer, CompletableFuture<Connection> result)
        {
            this.peer = peer;
            this.result = result;
        }

        @Override
        public void initChannel(SocketChannel channel)
        {
            if (isShutdown)
            {
                channel.close();
                return;
            }

            connection = new Connection(channel, peer, Connection.Direction.OUTBOUND);
            setupPipeline(channel, connection, HandshakeHandler.Role.INITIATOR, handshake -> outboundHandshakeComplete(handshake, result));
        }
    }

    private class InboundInitializer extends ChannelInitializer<SocketChannel>
    {
        @Override
        public void initChannel(SocketChannel channel)
        {
            InetSocketAddress peer = channel.remoteAddress();
            Connection connection = new Connection(channel, peer, Connection.Direction.INBOUND);
            if (isShutdown)
            {
                connection.markDisconnect(Disconnect.Reason.LOCAL_CLOSE, null);
                channel.close();
                return;
            }
            if (!reservePeerSlot())
            {
                logger.debug("rejecting connection from {}, already at the maximum of {} peers", peer, config.maxPeers);
                connection.markDisconnect(Disconnect.Reason.PEER_LIMIT, null);
                channel.close();
                return;
            }

            logger.debug("accepted connection from {}", peer);
            channel.closeFuture().addListener((ChannelFutureListener) future -> releasePeerSlot());
            setupPipeline(channel, connection, HandshakeHandler.Role.RESPONDER, SyntheticNode.this::inboundHandshakeComplete);
            if (config.handshakeMode == SyntheticNodeConfig.HandshakeMode.NONE)
            {
                connection.state(Connection.State.READY);
                connections.put(peer, connection);
            }
        }
    }
}
