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
package org.apache.ziggurat.protocol;

import java.net.InetSocketAddress;

import org.junit.Assert;
import org.junit.Test;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.util.CharsetUtil;
import org.apache.ziggurat.protocol.messages.VersionMessage;

public class MessageHeaderTest
{
    private static final NetAddr ADDR = new NetAddr(1, new InetSocketAddress("127.0.0.1", 8233));

    private static byte[] command(String ascii)
    {
        byte[] raw = new byte[MessageHeader.COMMAND_LENGTH];
        byte[] bytes = ascii.getBytes(CharsetUtil.US_ASCII);
        System.arraycopy(bytes, 0, raw, 0, bytes.length);
        return raw;
    }

    @Test
    public void serialize_RoundTrip()
    {
        MessageHeader header = new MessageHeader(Network.TESTNET.magic, "getheaders", 1234, 0xcafebabe);
        ByteBuf buf = Unpooled.buffer();
        header.serialize(buf);
        Assert.assertEquals(MessageHeader.LENGTH, buf.readableBytes());

        MessageHeader decoded = MessageHeader.deserialize(buf);
        Assert.assertEquals(header.magic, decoded.magic);
        Assert.assertEquals("getheaders", decoded.command);
        Assert.assertEquals(1234, decoded.bodyLength);
        Assert.assertEquals(0xcafebabe, decoded.checksum);
    }

    @Test
    public void serialize_MagicInWireOrder()
    {
        ByteBuf buf = Unpooled.buffer();
        new MessageHeader(Network.TESTNET.magic, "ping", 8, 0).serialize(buf);
        Assert.assertArrayEquals(new byte[]{ (byte) 0xfa, 0x1a, (byte) 0xf9, (byte) 0xbf }, Network.TESTNET.magicBytes());
        Assert.assertEquals((byte) 0xfa, buf.getByte(0));
        Assert.assertEquals((byte) 0xbf, buf.getByte(3));
        // body length is little-endian
        Assert.assertEquals(8, buf.getByte(16));
    }

    @Test
    public void parseCommand_Valid()
    {
        Assert.assertEquals("verack", MessageHeader.parseCommand(command("verack")));
        Assert.assertEquals("abcdefghijkl", MessageHeader.parseCommand(command("abcdefghijkl")));
        Assert.assertEquals("", MessageHeader.parseCommand(new byte[MessageHeader.COMMAND_LENGTH]));
    }

    @Test(expected = ProtocolException.class)
    public void parseCommand_GarbageAfterPadding()
    {
        byte[] raw = command("ping");
        raw[8] = 'x';
        MessageHeader.parseCommand(raw);
    }

    @Test(expected = ProtocolException.class)
    public void parseCommand_NotPrintable()
    {
        byte[] raw = command("ping");
        raw[1] = (byte) 0x80;
        MessageHeader.parseCommand(raw);
    }

    @Test
    public void bodyLength_Version()
    {
        MessageCodec codec = new MessageCodec(Network.MAINNET);

        byte[] noAgent = codec.encode(VersionMessage.create(ADDR, ADDR));
        Assert.assertEquals(86, MessageHeader.deserialize(Unpooled.wrappedBuffer(noAgent)).bodyLength);
        Assert.assertEquals(MessageHeader.LENGTH + 86, noAgent.length);

        // the user agent adds its length prefix and its bytes
        String userAgent = "/ziggurat:0.1.0/";
        byte[] withAgent = codec.encode(VersionMessage.create(VersionMessage.DEFAULT_PROTOCOL_VERSION, 1, ADDR, ADDR, userAgent, 0));
        Assert.assertEquals(85 + 1 + userAgent.length(), MessageHeader.deserialize(Unpooled.wrappedBuffer(withAgent)).bodyLength);
    }
}
