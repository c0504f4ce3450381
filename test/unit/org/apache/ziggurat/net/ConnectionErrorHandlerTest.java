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

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.apache.ziggurat.metrics.MetricsRecorder;
import org.apache.ziggurat.protocol.MessageCodec;
import org.apache.ziggurat.protocol.Network;
import org.apache.ziggurat.protocol.ProtocolException;

public class ConnectionErrorHandlerTest
{
    private static final InetSocketAddress PEER = new InetSocketAddress("127.0.0.1", 18344);

    private MetricsRecorder recorder;
    private EmbeddedChannel channel;
    private Connection connection;

    @Before
    public void setup() throws Exception
    {
        recorder = new MetricsRecorder();
        NodeMetrics metrics = new NodeMetrics(recorder);
        channel = new EmbeddedChannel(false, false);
        connection = new Connection(channel, PEER, Connection.Direction.OUTBOUND);
        channel.pipeline().addLast(new MessageFrameDecoder(new MessageCodec(Network.REGTEST), metrics));
        channel.pipeline().addLast(new ConnectionErrorHandler(connection, metrics));
        channel.register();
    }

    @Test
    public void exceptionCaught_ProtocolError()
    {
        byte[] garbage = new byte[48];
        garbage[0] = 0x42;
        channel.writeInbound(Unpooled.wrappedBuffer(garbage));

        Assert.assertFalse(channel.isOpen());
        Disconnect disconnect = connection.disconnect();
        Assert.assertNotNull(disconnect);
        Assert.assertEquals(Disconnect.Reason.PROTOCOL_ERROR, disconnect.reason);
        Assert.assertTrue(disconnect.cause instanceof ProtocolException);
        Assert.assertEquals(1, recorder.counter(NodeMetrics.PROTOCOL_ERRORS));
    }

    @Test
    public void exceptionCaught_IOException()
    {
        channel.pipeline().fireExceptionCaught(new IOException("Connection reset by peer"));

        Assert.assertFalse(channel.isOpen());
        Assert.assertEquals(Disconnect.Reason.TRANSPORT_ERROR, connection.disconnect().reason);
        Assert.assertEquals(0, recorder.counter(NodeMetrics.PROTOCOL_ERRORS));
    }

    @Test
    public void channelInactive_PeerClosed()
    {
        channel.close();
        Assert.assertEquals(Disconnect.Reason.PEER_CLOSED, connection.disconnect().reason);
    }

    @Test
    public void channelInactive_KeepsFirstReason()
    {
        connection.close();
        Assert.assertEquals(Disconnect.Reason.LOCAL_CLOSE, connection.disconnect().reason);
    }
}
