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
import java.nio.channels.ClosedChannelException;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import io.netty.channel.embedded.EmbeddedChannel;
import org.apache.ziggurat.metrics.MetricsRecorder;
import org.apache.ziggurat.net.HandshakeHandler.HandshakeResult;
import org.apache.ziggurat.protocol.NetAddr;
import org.apache.ziggurat.protocol.Network;
import org.apache.ziggurat.protocol.ProtocolException;
import org.apache.ziggurat.protocol.messages.PingMessage;
import org.apache.ziggurat.protocol.messages.VerackMessage;
import org.apache.ziggurat.protocol.messages.VersionMessage;

public class HandshakeHandlerTest
{
    private static final InetSocketAddress PEER = new InetSocketAddress("127.0.0.1", 18344);
    private static final String HANDLER_NAME = "handshake";
    private static final long TIMEOUT_MILLIS = 50;

    private MetricsRecorder recorder;
    private SyntheticNodeConfig config;
    private EmbeddedChannel channel;
    private Connection connection;
    private HandshakeHandler handler;
    private HandshakeResult result;
    private int callbacks;

    @Before
    public void setup()
    {
        recorder = new MetricsRecorder();
        config = SyntheticNodeConfig.builder()
                                    .network(Network.REGTEST)
                                    .handshake(SyntheticNodeConfig.HandshakeMode.FULL)
                                    .ioTimeoutMillis(TIMEOUT_MILLIS)
                                    .userAgent("/handshake-test/")
                                    .startHeight(7)
                                    .recorder(recorder)
                                    .build();
        result = null;
        callbacks = 0;
    }

    @After
    public void tearDown()
    {
        if (channel != null)
            channel.finishAndReleaseAll();
    }

    private void start(HandshakeHandler.Role role) throws Exception
    {
        channel = new EmbeddedChannel(false, false);
        connection = new Connection(channel, PEER, role == HandshakeHandler.Role.INITIATOR ? Connection.Direction.OUTBOUND : Connection.Direction.INBOUND);
        handler = new HandshakeHandler(role, connection, config, new NodeMetrics(recorder), this::callback);
        channel.pipeline().addLast(HANDLER_NAME, handler);
        channel.register();
    }

    private void callback(HandshakeResult result)
    {
        this.result = result;
        callbacks++;
    }

    private static VersionMessage peerVersion()
    {
        NetAddr addr = new NetAddr(1, PEER);
        return VersionMessage.create(170_100, 1, addr, addr, "/peer:1.0/", 2_000_000);
    }

    @Test
    public void initiator_SendsVersionFirst() throws Exception
    {
        start(HandshakeHandler.Role.INITIATOR);

        Object msg = channel.readOutbound();
        Assert.assertTrue(msg instanceof VersionMessage);
        VersionMessage version = (VersionMessage) msg;
        Assert.assertEquals(config.protocolVersion, version.version);
        Assert.assertEquals("/handshake-test/", version.userAgent);
        Assert.assertEquals(7, version.startHeight);
        Assert.assertFalse(version.relay);
        Assert.assertEquals(Connection.State.AWAITING_PEER_VERSION, connection.state());
        Assert.assertNull(result);
    }

    @Test
    public void initiator_FullHandshake() throws Exception
    {
        start(HandshakeHandler.Role.INITIATOR);
        Assert.assertTrue(channel.readOutbound() instanceof VersionMessage);

        VersionMessage peerVersion = peerVersion();
        channel.writeInbound(peerVersion);
        Assert.assertEquals(new VerackMessage(), channel.readOutbound());
        Assert.assertEquals(Connection.State.AWAITING_PEER_VERACK, connection.state());
        Assert.assertEquals(peerVersion, connection.peerVersion());
        Assert.assertNull(channel.readInbound());

        channel.writeInbound(new VerackMessage());
        Assert.assertNull(channel.readInbound());
        Assert.assertEquals(HandshakeResult.Outcome.SUCCESS, result.outcome);
        Assert.assertSame(connection, result.connection);
        Assert.assertEquals(Connection.State.READY, connection.state());
        Assert.assertTrue(connection.isReady());
        Assert.assertNull(channel.pipeline().get(HANDLER_NAME));
        Assert.assertEquals(1, recorder.histogram(NodeMetrics.HANDSHAKE_LATENCY).size());
    }

    @Test
    public void responder_FullHandshake() throws Exception
    {
        start(HandshakeHandler.Role.RESPONDER);
        Assert.assertNull(channel.readOutbound());
        Assert.assertEquals(Connection.State.AWAITING_PEER_VERSION, connection.state());

        channel.writeInbound(peerVersion());
        Assert.assertTrue(channel.readOutbound() instanceof VersionMessage);
        Assert.assertEquals(new VerackMessage(), channel.readOutbound());

        channel.writeInbound(new VerackMessage());
        Assert.assertEquals(HandshakeResult.Outcome.SUCCESS, result.outcome);
        Assert.assertEquals(Connection.State.READY, connection.state());
    }

    @Test
    public void messagesFlowAfterHandshake() throws Exception
    {
        start(HandshakeHandler.Role.RESPONDER);
        channel.writeInbound(peerVersion());
        channel.writeInbound(new VerackMessage());
        channel.releaseOutbound();

        channel.writeInbound(new PingMessage(99));
        Assert.assertEquals(new PingMessage(99), channel.readInbound());
        Assert.assertEquals(1, callbacks);
    }

    @Test
    public void unexpectedMessage_BeforeVersion() throws Exception
    {
        start(HandshakeHandler.Role.INITIATOR);
        channel.releaseOutbound();

        channel.writeInbound(new PingMessage(1));
        Assert.assertEquals(HandshakeResult.Outcome.FAILED, result.outcome);
        Assert.assertTrue(result.cause instanceof ProtocolException);
        Assert.assertFalse(channel.isOpen());
        Assert.assertEquals(Disconnect.Reason.HANDSHAKE_FAILED, connection.disconnect().reason);
        Assert.assertNull(channel.readInbound());

        channel.runPendingTasks();
        Assert.assertEquals(1, callbacks);
    }

    @Test
    public void unexpectedMessage_BeforeVerack() throws Exception
    {
        start(HandshakeHandler.Role.RESPONDER);
        channel.writeInbound(peerVersion());
        channel.releaseOutbound();

        channel.writeInbound(peerVersion());
        Assert.assertEquals(HandshakeResult.Outcome.FAILED, result.outcome);
        Assert.assertTrue(handler.isDone());
        Assert.assertNotEquals(Connection.State.READY, connection.state());
    }

    @Test
    public void timeout_WaitingForVersion() throws Exception
    {
        start(HandshakeHandler.Role.INITIATOR);
        channel.releaseOutbound();

        Thread.sleep(TIMEOUT_MILLIS * 3);
        channel.runPendingTasks();

        Assert.assertEquals(HandshakeResult.Outcome.TIMEOUT, result.outcome);
        Assert.assertEquals(HandshakeTimeoutException.Step.PEER_VERSION, result.step);
        Assert.assertFalse(channel.isOpen());
        Assert.assertEquals(Disconnect.Reason.HANDSHAKE_TIMEOUT, connection.disconnect().reason);
        Assert.assertEquals(1, recorder.counter(NodeMetrics.HANDSHAKE_TIMEOUTS));
    }

    @Test
    public void timeout_WaitingForVerack() throws Exception
    {
        start(HandshakeHandler.Role.INITIATOR);
        channel.writeInbound(peerVersion());
        channel.releaseOutbound();

        Thread.sleep(TIMEOUT_MILLIS * 3);
        channel.runPendingTasks();

        Assert.assertEquals(HandshakeResult.Outcome.TIMEOUT, result.outcome);
        Assert.assertEquals(HandshakeTimeoutException.Step.PEER_VERACK, result.step);
        Assert.assertTrue(connection.disconnect().cause instanceof HandshakeTimeoutException);
    }

    @Test
    public void timeout_CancelledOnSuccess() throws Exception
    {
        start(HandshakeHandler.Role.INITIATOR);
        channel.writeInbound(peerVersion());
        channel.writeInbound(new VerackMessage());
        channel.releaseOutbound();

        Thread.sleep(TIMEOUT_MILLIS * 3);
        channel.runPendingTasks();

        Assert.assertEquals(HandshakeResult.Outcome.SUCCESS, result.outcome);
        Assert.assertEquals(1, callbacks);
        Assert.assertTrue(channel.isOpen());
        Assert.assertEquals(0, recorder.counter(NodeMetrics.HANDSHAKE_TIMEOUTS));
    }

    @Test
    public void closedDuringHandshake() throws Exception
    {
        start(HandshakeHandler.Role.INITIATOR);
        channel.releaseOutbound();

        connection.close();
        channel.runPendingTasks();

        Assert.assertEquals(HandshakeResult.Outcome.FAILED, result.outcome);
        Assert.assertTrue(result.cause instanceof ClosedChannelException);
        Assert.assertEquals(Disconnect.Reason.LOCAL_CLOSE, connection.disconnect().reason);
        Assert.assertEquals(1, callbacks);
    }
}
