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

import java.util.Objects;

import io.netty.buffer.ByteBuf;
import io.netty.util.CharsetUtil;

/**
 * The fixed 24 bytes preamble of every message:
 * <pre>
 * {@code
 * +------------+--------------------------------+----------------+------------+
 * | magic (4)  | command (12, NUL padded ASCII) | body length (4)| checksum(4)|
 * +------------+--------------------------------+----------------+------------+
 * }
 * </pre>
 * The body length is a little-endian u32. Magic and checksum are kept as big-endian packed ints so they are written
 * back in the order they were read.
 */
public final class MessageHeader
{
    public static final int LENGTH = 24;
    public static final int COMMAND_LENGTH = 12;

    public final int magic;
    public final String command;
    public final long bodyLength;
    public final int checksum;

    public MessageHeader(int magic, String command, long bodyLength, int checksum)
    {
        this.magic = magic;
        this.command = Objects.requireNonNull(command);
        this.bodyLength = bodyLength;
        this.checksum = checksum;
    }

    public void serialize(ByteBuf out)
    {
        out.writeInt(magic);
        byte[] raw = command.getBytes(CharsetUtil.US_ASCII);
        if (raw.length > COMMAND_LENGTH)
            throw new IllegalArgumentException("Command too long: " + command);
        out.writeBytes(raw);
        out.writeZero(COMMAND_LENGTH - raw.length);
        out.writeIntLE((int) bodyLength);
        out.writeInt(checksum);
    }

    /**
     * Reads a header without checking magic or length; that is up to {@link MessageCodec}, which knows the network.
     */
    public static MessageHeader deserialize(ByteBuf in)
    {
        WireUtil.ensureReadable(in, LENGTH, "a message header");
        int magic = in.readInt();
        byte[] raw = new byte[COMMAND_LENGTH];
        in.readBytes(raw);
        String command = parseCommand(raw);
        long bodyLength = in.readUnsignedIntLE();
        int checksum = in.readInt();
        return new MessageHeader(magic, command, bodyLength, checksum);
    }

    /**
     * Printable ASCII, then nothing but NUL padding.
     */
    static String parseCommand(byte[] raw)
    {
        int length = 0;
        while (length < raw.length && raw[length] != 0)
        {
            if (raw[length] < 0x20 || raw[length] > 0x7e)
                throw new ProtocolException(String.format("Invalid byte 0x%02x in message command", raw[length] & 0xff));
            length++;
        }

        for (int i = length; i < raw.length; i++)
        {
            if (raw[i] != 0)
                throw new ProtocolException("Message command is not NUL padded");
        }
        return new String(raw, 0, length, CharsetUtil.US_ASCII);
    }

    @Override
    public String toString()
    {
        return String.format("MessageHeader(magic=0x%08x, command=%s, bodyLength=%d, checksum=0x%08x)", magic, command, bodyLength, checksum);
    }
}
