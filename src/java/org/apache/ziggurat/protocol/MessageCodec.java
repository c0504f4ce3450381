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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.buffer.UnpooledByteBufAllocator;

/**
 * Frames messages for one {@link Network}: a {@link MessageHeader} followed by the message body.
 * <p>
 * Every decoding failure, whether from a bad header, a checksum mismatch, a truncated body or a malformed field,
 * is reported as a {@link ProtocolException}. Instances are stateless and thread safe.
 */
public class MessageCodec
{
    /**
     * Largest body we accept, in bytes. Bigger declared lengths are refused before any body byte is buffered.
     */
    public static final int MAX_BODY_LENGTH = 2 * 1024 * 1024;

    private final Network network;

    public MessageCodec(Network network)
    {
        this.network = network;
    }

    public Network network()
    {
        return network;
    }

    public void encode(Message message, ByteBuf out)
    {
        // the body goes first in a scratch buffer, its length and checksum are needed by the header
        ByteBuf body = out.alloc().buffer();
        try
        {
            message.encodeBody(body);
            new MessageHeader(network.magic, message.type.command, body.readableBytes(), WireUtil.checksum(body)).serialize(out);
            out.writeBytes(body);
        }
        finally
        {
            body.release();
        }
    }

    public ByteBuf encode(Message message, ByteBufAllocator allocator)
    {
        ByteBuf out = allocator.buffer();
        try
        {
            encode(message, out);
            return out;
        }
        catch (RuntimeException e)
        {
            out.release();
            throw e;
        }
    }

    public byte[] encode(Message message)
    {
        ByteBuf out = encode(message, UnpooledByteBufAllocator.DEFAULT);
        try
        {
            return ByteBufUtil.getBytes(out);
        }
        finally
        {
            out.release();
        }
    }

    /**
     * Decodes exactly one message; trailing bytes are an error.
     */
    public Message decode(byte[] bytes)
    {
        ByteBuf in = Unpooled.wrappedBuffer(bytes);
        Message message = decode(in);
        if (in.isReadable())
            throw new ProtocolException(String.format("%d unexpected bytes after '%s' message", in.readableBytes(), message.type.command));
        return message;
    }

    /**
     * Decodes the next message of {@code in}, leaving any following bytes unread.
     */
    public Message decode(ByteBuf in)
    {
        MessageHeader header = decodeHeader(in);
        if (in.readableBytes() < header.bodyLength)
            throw new ProtocolException(String.format("Truncated '%s' message: header announces %d body bytes, only %d available",
                                                      header.command, header.bodyLength, in.readableBytes()));
        return decodeBody(header, in.readSlice((int) header.bodyLength));
    }

    /**
     * Reads and validates a header: magic of our network, well formed command and a body length within bounds.
     */
    public MessageHeader decodeHeader(ByteBuf in)
    {
        MessageHeader header = MessageHeader.deserialize(in);
        if (header.magic != network.magic)
            throw new ProtocolException(String.format("Invalid magic 0x%08x, expecting 0x%08x (%s)", header.magic, network.magic, network));
        if (header.bodyLength > MAX_BODY_LENGTH)
            throw new ProtocolException(String.format("Body of '%s' message is too long: %d bytes (max %d)", header.command, header.bodyLength, MAX_BODY_LENGTH));
        Message.Type.fromCommand(header.command);
        return header;
    }

    /**
     * Decodes a body that {@code header} was read for. {@code body} must hold exactly the body bytes.
     */
    public Message decodeBody(MessageHeader header, ByteBuf body)
    {
        if (body.readableBytes() != header.bodyLength)
            throw new ProtocolException(String.format("Body of '%s' message has %d bytes, header announces %d",
                                                      header.command, body.readableBytes(), header.bodyLength));

        int checksum = WireUtil.checksum(body);
        if (checksum != header.checksum)
            throw new ChecksumMismatchException(header.command, header.checksum, checksum);

        Message.Type type = Message.Type.fromCommand(header.command);
        Message message;
        try
        {
            message = type.codec.decode(body);
        }
        catch (IndexOutOfBoundsException e)
        {
            throw new ProtocolException(String.format("Truncated '%s' message body", header.command), e);
        }

        if (body.isReadable())
            throw new ProtocolException(String.format("%d unexpected bytes at the end of '%s' message body", body.readableBytes(), header.command));
        return message;
    }
}
