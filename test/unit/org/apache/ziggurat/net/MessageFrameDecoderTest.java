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

import java.util.Arrays;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import org.apache.ziggurat.metrics.MetricsRecorder;
import org.apache.ziggurat.protocol.MessageCodec;
import org.apache.ziggurat.protocol.Network;
import org.apache.ziggurat.protocol.ProtocolException;
import org.apache.ziggurat.protocol.messages.PingMessage;
import org.apache.ziggurat.protocol.messages.VerackMessage;

public class MessageFrameDecoderTest
{
    private final MessageCodec codec = new MessageCodec(Network.REGTEST);

    private MetricsRecorder recorder;
    private EmbeddedChannel channel;

    @Before
    public void setup()
    {
        recorder = new MetricsRecorder();
        channel = new EmbeddedChannel(new MessageFrameDecoder(codec, new NodeMetrics(recorder)));
    }

    @After
    public void tearDown()
    {
        channel.finishAndReleaseAll();
    }

    @Test
    public void decode_SmallInput()
    {
        byte[] encoded = codec.encode(new PingMessage(12));
        channel.writeInbound(Unpooled.wrappedBuffer(encoded, 0, 10));
        Assert.assertNull(channel.readInbound());
    }

    @Test
    public void decode_HeaderWithoutBody()
    {
        byte[] encoded = codec.encode(new PingMessage(12));
        channel.writeInbound(Unpooled.wrappedBuffer(Arrays.copyOf(encoded, encoded.length - 1)));
        Assert.assertNull(channel.readInbound());

        channel.writeInbound(Unpooled.wrappedBuffer(encoded, encoded.length - 1, 1));
        Assert.assertEquals(new PingMessage(12), channel.readInbound());
    }

    @Test
    public void decode_OneByteAtATime()
    {
        ByteBuf stream = Unpooled.buffer();
        codec.encode(new PingMessage(1), stream);
        codec.encode(new VerackMessage(), stream);
        codec.encode(new PingMessage(2), stream);

        while (stream.isReadable())
            channel.writeInbound(stream.readRetainedSlice(1));
        stream.release();

        Assert.assertEquals(new PingMessage(1), channel.readInbound());
        Assert.assertEquals(new VerackMessage(), channel.readInbound());
        Assert.assertEquals(new PingMessage(2), channel.readInbound());
        Assert.assertNull(channel.readInbound());
        Assert.assertEquals(3, recorder.counter(NodeMetrics.MESSAGES_RECEIVED));
    }

    @Test
    public void decode_ManyInOneRead()
    {
        ByteBuf stream = Unpooled.buffer();
        for (int i = 0; i < 10; i++)
            codec.encode(new PingMessage(i), stream);

        channel.writeInbound(stream);
        for (int i = 0; i < 10; i++)
            Assert.assertEquals(new PingMessage(i), channel.readInbound());
    }

    @Test
    public void decode_WrongMagic()
    {
        byte[] mainnet = new MessageCodec(Network.MAINNET).encode(new VerackMessage());
        try
        {
            channel.writeInbound(Unpooled.wrappedBuffer(mainnet));
            Assert.fail("wrong magic should not decode");
        }
        catch (DecoderException e)
        {
            Assert.assertTrue(e.getCause() instanceof ProtocolException);
        }
    }

    @Test
    public void decode_InputIgnoredAfterFailure()
    {
        byte[] corrupted = codec.encode(new PingMessage(5));
        corrupted[corrupted.length - 1] ^= 0x7f;
        try
        {
            channel.writeInbound(Unpooled.wrappedBuffer(corrupted));
            Assert.fail("corrupted body should not decode");
        }
        catch (DecoderException e)
        {
            Assert.assertTrue(e.getCause() instanceof ProtocolException);
        }

        channel.writeInbound(Unpooled.wrappedBuffer(codec.encode(new PingMessage(6))));
        Assert.assertNull(channel.readInbound());
        Assert.assertEquals(0, recorder.counter(NodeMetrics.MESSAGES_RECEIVED));
    }
}
