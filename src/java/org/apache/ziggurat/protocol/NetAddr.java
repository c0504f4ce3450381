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

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.Objects;

import com.google.common.base.Preconditions;

import io.netty.buffer.ByteBuf;

/**
 * A network address as carried in {@code version} and {@code addr} messages:
 * <pre>
 * {@code
 * +----------------+----------------------------------+--------+
 * | services (8)   | IPv6 address (16)                | port(2)|
 * +----------------+----------------------------------+--------+
 * }
 * </pre>
 * Services are little-endian. IPv4 addresses travel as IPv4-mapped IPv6 ({@code ::ffff:a.b.c.d}) and are unwrapped
 * back to IPv4 when read. The port is big-endian, unlike every other integer of the protocol.
 */
public final class NetAddr
{
    public static final int SERIALIZED_SIZE = 26;

    private static final int IP_LENGTH = 16;
    private static final InetSocketAddress UNSPECIFIED = new InetSocketAddress("0.0.0.0", 0);

    public final long services;
    public final InetSocketAddress address;

    public NetAddr(long services, InetSocketAddress address)
    {
        this.services = services;
        this.address = Objects.requireNonNull(address);
        Preconditions.checkArgument(!address.isUnresolved(), "cannot carry unresolved address %s", address);
    }

    /**
     * An address for endpoints that have no IP, such as in-memory test channels.
     */
    public static NetAddr unspecified(long services)
    {
        return new NetAddr(services, UNSPECIFIED);
    }

    public void serialize(ByteBuf out)
    {
        out.writeLongLE(services);
        out.writeBytes(toIpv6Bytes(address.getAddress()));
        out.writeShort(address.getPort());
    }

    public static NetAddr deserialize(ByteBuf in)
    {
        WireUtil.ensureReadable(in, SERIALIZED_SIZE, "a network address");
        long services = in.readLongLE();
        byte[] ip = new byte[IP_LENGTH];
        in.readBytes(ip);
        int port = in.readUnsignedShort();
        return new NetAddr(services, new InetSocketAddress(fromIpv6Bytes(ip), port));
    }

    static byte[] toIpv6Bytes(InetAddress address)
    {
        byte[] raw = address.getAddress();
        if (raw.length == IP_LENGTH)
            return raw;

        byte[] mapped = new byte[IP_LENGTH];
        mapped[10] = (byte) 0xff;
        mapped[11] = (byte) 0xff;
        System.arraycopy(raw, 0, mapped, 12, raw.length);
        return mapped;
    }

    // unwraps ::ffff:a.b.c.d to a.b.c.d
    static InetAddress fromIpv6Bytes(byte[] ip)
    {
        try
        {
            if (isIpv4Mapped(ip))
            {
                byte[] v4 = new byte[4];
                System.arraycopy(ip, 12, v4, 0, 4);
                return Inet4Address.getByAddress(v4);
            }
            return Inet6Address.getByAddress(null, ip, null);
        }
        catch (UnknownHostException e)
        {
            // only thrown for illegal lengths, which we control
            throw new AssertionError(e);
        }
    }

    private static boolean isIpv4Mapped(byte[] ip)
    {
        for (int i = 0; i < 10; i++)
        {
            if (ip[i] != 0)
                return false;
        }
        return ip[10] == (byte) 0xff && ip[11] == (byte) 0xff;
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof NetAddr))
            return false;

        NetAddr that = (NetAddr) other;
        return this.services == that.services && this.address.equals(that.address);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(services, address);
    }

    @Override
    public String toString()
    {
        return address + " (services " + Long.toUnsignedString(services) + ')';
    }
}
