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

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Ints;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.util.CharsetUtil;

/**
 * ByteBuf utility methods for the message bodies.
 * Like the ByteBuf methods they build on, these "read" by advancing the reader index and "write" by advancing the
 * writer index. Multi-byte integers are little-endian unless noted otherwise.
 * <p>
 * Running out of bytes is reported as a {@link ProtocolException}, never as an {@link IndexOutOfBoundsException}.
 */
public abstract class WireUtil
{
    private static final HashFunction SHA256 = Hashing.sha256();

    private WireUtil() {}

    /**
     * Reads a CompactSize length prefixed, strictly UTF-8 encoded, string.
     */
    public static String readString(ByteBuf buf)
    {
        long length = CompactSize.read(buf);
        if (Long.compareUnsigned(length, buf.readableBytes()) > 0)
            throw new ProtocolException(String.format("Not enough bytes to read a string of length %s (%d available)",
                                                      Long.toUnsignedString(length), buf.readableBytes()));

        try
        {
            String str = CharsetUtil.decoder(CharsetUtil.UTF_8, CodingErrorAction.REPORT, CodingErrorAction.REPORT)
                                    .decode(buf.nioBuffer(buf.readerIndex(), (int) length))
                                    .toString();
            buf.skipBytes((int) length);
            return str;
        }
        catch (CharacterCodingException e)
        {
            throw new ProtocolException("Cannot decode string as UTF8", e);
        }
    }

    public static void writeString(ByteBuf buf, String str)
    {
        byte[] bytes = str.getBytes(CharsetUtil.UTF_8);
        CompactSize.write(buf, bytes.length);
        buf.writeBytes(bytes);
    }

    public static int sizeOfString(String str)
    {
        int length = ByteBufUtil.utf8Bytes(str);
        return CompactSize.serializedSize(length) + length;
    }

    public static Hash readHash(ByteBuf buf)
    {
        ensureReadable(buf, Hash.LENGTH, "a hash");
        byte[] bytes = new byte[Hash.LENGTH];
        buf.readBytes(bytes);
        return new Hash(bytes);
    }

    public static void writeHash(ByteBuf buf, Hash hash)
    {
        buf.writeBytes(hash.bytes());
    }

    public static int readIntLE(ByteBuf buf)
    {
        ensureReadable(buf, Integer.BYTES, "a 4 bytes integer");
        return buf.readIntLE();
    }

    public static long readLongLE(ByteBuf buf)
    {
        ensureReadable(buf, Long.BYTES, "an 8 bytes integer");
        return buf.readLongLE();
    }

    public static int readUnsignedByte(ByteBuf buf)
    {
        ensureReadable(buf, 1, "a byte");
        return buf.readUnsignedByte();
    }

    public static boolean readBoolean(ByteBuf buf)
    {
        return readUnsignedByte(buf) != 0;
    }

    public static void ensureReadable(ByteBuf buf, int bytes, String what)
    {
        if (buf.readableBytes() < bytes)
            throw new ProtocolException(String.format("Not enough bytes to read %s (%d needed, %d available)", what, bytes, buf.readableBytes()));
    }

    /**
     * The first 4 bytes of SHA256(SHA256(body)), packed big-endian so that {@link ByteBuf#writeInt(int)} emits them
     * in digest order. The readable bytes of {@code body} are left untouched.
     */
    public static int checksum(ByteBuf body)
    {
        byte[] bytes = ByteBufUtil.getBytes(body, body.readerIndex(), body.readableBytes(), false);
        byte[] digest = SHA256.hashBytes(SHA256.hashBytes(bytes).asBytes()).asBytes();
        return Ints.fromByteArray(digest);
    }
}
