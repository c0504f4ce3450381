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

/**
 * The "CompactSize" variable width unsigned integer used to prefix variable length fields.
 * <pre>
 * {@code
 *   value <= 0xfc          1 byte:  the value itself
 *   value <= 0xffff        3 bytes: 0xfd + u16 little-endian
 *   value <= 0xffffffff    5 bytes: 0xfe + u32 little-endian
 *   otherwise              9 bytes: 0xff + u64 little-endian
 * }
 * </pre>
 * Values are unsigned 64 bit integers held in a {@code long}. Encoding always picks the smallest form and decoding
 * refuses any other (non-canonical) one.
 */
public final class CompactSize
{
    private static final int MARKER_U16 = 0xfd;
    private static final int MARKER_U32 = 0xfe;
    private static final int MARKER_U64 = 0xff;

    private CompactSize()
    {   }

    public static int serializedSize(long value)
    {
        if (Long.compareUnsigned(value, 0xfcL) <= 0)
            return 1;
        if (Long.compareUnsigned(value, 0xffffL) <= 0)
            return 3;
        if (Long.compareUnsigned(value, 0xffffffffL) <= 0)
            return 5;
        return 9;
    }

    public static void write(ByteBuf out, long value)
    {
        switch (serializedSize(value))
        {
            case 1:
                out.writeByte((int) value);
                break;
            case 3:
                out.writeByte(MARKER_U16);
                out.writeShortLE((int) value);
                break;
            case 5:
                out.writeByte(MARKER_U32);
                out.writeIntLE((int) value);
                break;
            default:
                out.writeByte(MARKER_U64);
                out.writeLongLE(value);
        }
    }

    public static long read(ByteBuf in)
    {
        if (!in.isReadable())
            throw new ProtocolException("Not enough bytes to read a CompactSize marker");

        int marker = in.readUnsignedByte();
        long value;
        int expectedSize;
        switch (marker)
        {
            case MARKER_U16:
                ensureReadable(in, 2, marker);
                value = in.readUnsignedShortLE();
                expectedSize = 3;
                break;
            case MARKER_U32:
                ensureReadable(in, 4, marker);
                value = in.readUnsignedIntLE();
                expectedSize = 5;
                break;
            case MARKER_U64:
                ensureReadable(in, 8, marker);
                value = in.readLongLE();
                expectedSize = 9;
                break;
            default:
                return marker;
        }

        if (serializedSize(value) != expectedSize)
            throw new ProtocolException(String.format("Non-canonical CompactSize: %s encoded with marker 0x%02x", Long.toUnsignedString(value), marker));
        return value;
    }

    /**
     * Reads a CompactSize holding an element count and checks it against {@code max}.
     */
    public static int readCount(ByteBuf in, int max, String what)
    {
        long count = read(in);
        if (Long.compareUnsigned(count, max) > 0)
            throw new ProtocolException(String.format("Too many %s: %s (max %d)", what, Long.toUnsignedString(count), max));
        return (int) count;
    }

    private static void ensureReadable(ByteBuf in, int bytes, int marker)
    {
        if (in.readableBytes() < bytes)
            throw new ProtocolException(String.format("Not enough bytes to read a CompactSize with marker 0x%02x", marker));
    }
}
