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

import com.google.common.primitives.Ints;

/**
 * The networks a node may be running on. Each one is identified on the wire by the 4 magic bytes opening every
 * message header.
 */
public enum Network
{
    MAINNET (0x24, 0xe9, 0x27, 0x64),
    TESTNET (0xfa, 0x1a, 0xf9, 0xbf),
    REGTEST (0xaa, 0xe8, 0x3f, 0x5f);

    /**
     * The magic bytes, in wire order, packed big-endian so that {@link io.netty.buffer.ByteBuf#writeInt(int)} emits
     * them in the right order.
     */
    public final int magic;

    Network(int b0, int b1, int b2, int b3)
    {
        this.magic = Ints.fromBytes((byte) b0, (byte) b1, (byte) b2, (byte) b3);
    }

    public byte[] magicBytes()
    {
        return Ints.toByteArray(magic);
    }

    public static Network fromName(String name)
    {
        for (Network network : values())
        {
            if (network.name().equalsIgnoreCase(name))
                return network;
        }
        throw new IllegalArgumentException("Unknown network: " + name);
    }
}
