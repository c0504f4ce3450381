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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import org.apache.ziggurat.protocol.Message;
import org.apache.ziggurat.protocol.messages.VersionMessage;

/**
 * One TCP connection of a {@link SyntheticNode}, along with where it stands in the handshake.
 * <p>
 * State changes happen on the channel's event loop; readers on other threads see them through volatile fields.
 */
public class Connection
{
    public enum State
    {
        DISCONNECTED,
        CONNECTING,
        AWAITING_PEER_VERSION,
        AWAITING_PEER_VERACK,
        READY
    }

    public enum Direction
    {
        /** we dialed the peer */
        OUTBOUND,
        /** the peer dialed our listener */
        INBOUND
    }

    public final InetSocketAddress peer;
    public final Direction direction;
    final Channel channel;

    private volatile State state = State.CONNECTING;
    private volatile VersionMessage peerVersion;

    private final CompletableFuture<Disconnect> disconnect = new CompletableFuture<>();

    @VisibleForTesting
    Connection(Channel channel, InetSocketAddress peer, Direction direction)
    {
        this.channel = channel;
        this.peer = peer;
        this.direction = direction;
    }

    public State state()
    {
        return state;
    }

    void state(State state)
    {
        this.state = state;
    }

    /**
     * The version message the peer sent during the handshake, or null if there was no handshake (yet).
     */
    @Nullable
    public VersionMessage peerVersion()
    {
        return peerVersion;
    }

    void peerVersion(VersionMessage version)
    {
        this.peerVersion = version;
    }

    public boolean isReady()
    {
        return state == State.READY && channel.isActive();
    }

    /**
     * Writes and flushes {@code message}. The returned future completes once the bytes are handed to the socket.
     */
    public ChannelFuture send(Message message)
    {
        return channel.writeAndFlush(message);
    }

    public ChannelFuture close()
    {
        markDisconnect(Disconnect.Reason.LOCAL_CLOSE, null);
        return channel.close();
    }

    /**
     * Records why this connection is going away. Returns false if a reason was already recorded.
     */
    boolean markDisconnect(Disconnect.Reason reason, @Nullable Throwable cause)
    {
        return disconnect.complete(new Disconnect(reason, cause));
    }

    /**
     * Invoked once the channel is closed.
     */
    void closed()
    {
        state = State.DISCONNECTED;
        markDisconnect(Disconnect.Reason.PEER_CLOSED, null);
    }

    /**
     * The reason this connection closed, or null while it is still open.
     */
    @Nullable
    public Disconnect disconnect()
    {
        return disconnect.getNow(null);
    }

    public CompletableFuture<Disconnect> disconnectFuture()
    {
        return disconnect;
    }

    public Disconnect awaitDisconnect(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException
    {
        try
        {
            return disconnect.get(timeout, unit);
        }
        catch (ExecutionException e)
        {
            // never completed exceptionally
            throw new AssertionError(e);
        }
    }

    @Override
    public String toString()
    {
        return String.format("Connection(%s %s, %s)", direction == Direction.OUTBOUND ? "to" : "from", peer, state);
    }
}
