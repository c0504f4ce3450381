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

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.concurrent.Future;
import org.apache.ziggurat.protocol.Message;
import org.apache.ziggurat.protocol.NetAddr;
import org.apache.ziggurat.protocol.ProtocolException;
import org.apache.ziggurat.protocol.messages.VerackMessage;
import org.apache.ziggurat.protocol.messages.VersionMessage;

/**
 * A {@link ChannelHandler} running the version/verack handshake on a freshly established connection.
 * <p>
 * As the {@link Role#INITIATOR}, our version goes out as soon as the channel is active, then we wait for the peer's
 * version, acknowledge it, and wait for the peer's verack. As the {@link Role#RESPONDER}, we first wait for the peer's
 * version and answer it with our own version followed by a verack, then wait for the peer's verack.
 * <p>
 * Each wait is bounded by the node's I/O timeout. Upon completion (on success, failure or timeout), the
 * {@link #callback} is invoked to let the node know how the handshake went. On success this handler removes itself
 * from the pipeline, leaving later messages to {@link InboundMessageHandler}; on failure the channel is closed.
 * <p>
 * Exceptions are left to {@link ConnectionErrorHandler}; the resulting close reaches us through
 * {@link #channelInactive(ChannelHandlerContext)}.
 * <p>
 * Every method runs on the channel's event loop, so there are no races between the timeouts and the reads.
 */
class HandshakeHandler extends ChannelInboundHandlerAdapter
{
    private static final Logger logger = LoggerFactory.getLogger(HandshakeHandler.class);

    enum Role
    {
        INITIATOR,
        RESPONDER
    }

    /**
     * The result of the handshake, as passed to the callback.
     */
    static class HandshakeResult
    {
        enum Outcome
        {
            SUCCESS,
            TIMEOUT,
            FAILED
        }

        final Outcome outcome;
        final Connection connection;
        @Nullable
        final HandshakeTimeoutException.Step step;
        @Nullable
        final Throwable cause;

        private HandshakeResult(Outcome outcome, Connection connection, @Nullable HandshakeTimeoutException.Step step, @Nullable Throwable cause)
        {
            this.outcome = outcome;
            this.connection = connection;
            this.step = step;
            this.cause = cause;
        }

        static HandshakeResult success(Connection connection)
        {
            return new HandshakeResult(Outcome.SUCCESS, connection, null, null);
        }

        static HandshakeResult timeout(Connection connection, HandshakeTimeoutException.Step step)
        {
            return new HandshakeResult(Outcome.TIMEOUT, connection, step, null);
        }

        static HandshakeResult failed(Connection connection, Throwable cause)
        {
            return new HandshakeResult(Outcome.FAILED, connection, null, cause);
        }
    }

    private final Role role;
    private final Connection connection;
    private final SyntheticNodeConfig config;
    private final NodeMetrics metrics;
    private final Consumer<HandshakeResult> callback;

    /**
     * Bounds the wait for the peer's next handshake message.
     */
    private Future<?> timeoutFuture;

    private long startNanos;
    private boolean isDone;

    HandshakeHandler(Role role, Connection connection, SyntheticNodeConfig config, NodeMetrics metrics, Consumer<HandshakeResult> callback)
    {
        this.role = role;
        this.connection = connection;
        this.config = config;
        this.metrics = metrics;
        this.callback = callback;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception
    {
        startNanos = System.nanoTime();
        logger.debug("starting handshake as {} with {}", role, connection.peer);
        if (role == Role.INITIATOR)
            ctx.writeAndFlush(localVersion(ctx));

        connection.state(Connection.State.AWAITING_PEER_VERSION);
        scheduleTimeout(ctx, HandshakeTimeoutException.Step.PEER_VERSION);
        ctx.fireChannelActive();
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception
    {
        if (isDone)
            return;

        Message message = (Message) msg;
        switch (connection.state())
        {
            case AWAITING_PEER_VERSION:
                if (message.type != Message.Type.VERSION)
                {
                    fail(ctx, new ProtocolException(String.format("Expecting a version message from %s, got %s", connection.peer, message.type)));
                    return;
                }
                cancelTimeout();
                connection.peerVersion((VersionMessage) message);
                if (role == Role.RESPONDER)
                    ctx.write(localVersion(ctx));
                ctx.writeAndFlush(new VerackMessage());
                connection.state(Connection.State.AWAITING_PEER_VERACK);
                scheduleTimeout(ctx, HandshakeTimeoutException.Step.PEER_VERACK);
                break;
            case AWAITING_PEER_VERACK:
                if (message.type != Message.Type.VERACK)
                {
                    fail(ctx, new ProtocolException(String.format("Expecting a verack message from %s, got %s", connection.peer, message.type)));
                    return;
                }
                cancelTimeout();
                complete(ctx);
                break;
            default:
                throw new IllegalStateException("Unexpected state " + connection.state() + " during handshake with " + connection.peer);
        }
    }

    private void complete(ChannelHandlerContext ctx)
    {
        isDone = true;
        long elapsed = System.nanoTime() - startNanos;
        metrics.handshakeCompleted(elapsed);
        logger.debug("handshake with {} completed in {}ms", connection.peer, TimeUnit.NANOSECONDS.toMillis(elapsed));
        connection.state(Connection.State.READY);
        ctx.pipeline().remove(this);
        callback.accept(HandshakeResult.success(connection));
    }

    private VersionMessage localVersion(ChannelHandlerContext ctx)
    {
        return VersionMessage.create(config.protocolVersion,
                                     config.services,
                                     netAddr(ctx.channel().remoteAddress()),
                                     netAddr(ctx.channel().localAddress()),
                                     config.userAgent,
                                     config.startHeight);
    }

    private NetAddr netAddr(SocketAddress address)
    {
        return address instanceof InetSocketAddress
               ? new NetAddr(config.services, (InetSocketAddress) address)
               : NetAddr.unspecified(config.services);
    }

    private void scheduleTimeout(ChannelHandlerContext ctx, HandshakeTimeoutException.Step step)
    {
        timeoutFuture = ctx.executor().schedule(() -> abortHandshake(ctx, step), config.ioTimeoutMillis, TimeUnit.MILLISECONDS);
    }

    private void cancelTimeout()
    {
        if (timeoutFuture != null)
        {
            timeoutFuture.cancel(false);
            timeoutFuture = null;
        }
    }

    /**
     * Handles the timeout when the peer does not send its next handshake message in time.
     */
    private void abortHandshake(ChannelHandlerContext ctx, HandshakeTimeoutException.Step step)
    {
        if (isDone)
            return;

        isDone = true;
        timeoutFuture = null;
        logger.debug("handshake with {} timed out waiting for {}", connection.peer, step);
        metrics.handshakeTimeout();
        connection.markDisconnect(Disconnect.Reason.HANDSHAKE_TIMEOUT, new HandshakeTimeoutException(step, connection.peer, config.ioTimeoutMillis));
        ctx.close();
        callback.accept(HandshakeResult.timeout(connection, step));
    }

    private void fail(ChannelHandlerContext ctx, Throwable cause)
    {
        if (isDone)
            return;

        isDone = true;
        cancelTimeout();
        logger.debug("handshake with {} failed: {}", connection.peer, cause.getMessage());
        connection.markDisconnect(Disconnect.Reason.HANDSHAKE_FAILED, cause);
        ctx.close();

        // report what actually closed the connection, it may have been classified before we got here
        Disconnect disconnect = connection.disconnect();
        callback.accept(HandshakeResult.failed(connection, disconnect != null && disconnect.cause != null ? disconnect.cause : cause));
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        fail(ctx, new ClosedChannelException());
        ctx.fireChannelInactive();
    }

    @VisibleForTesting
    boolean isDone()
    {
        return isDone;
    }
}
