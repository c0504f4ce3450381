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
package org.apache.ziggurat.protocol.messages;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import io.netty.buffer.ByteBuf;

import org.apache.ziggurat.protocol.CompactSize;
import org.apache.ziggurat.protocol.Message;
import org.apache.ziggurat.protocol.NetAddr;
import org.apache.ziggurat.protocol.WireUtil;

/**
 * Gossips known peer addresses, each stamped with the time it was last seen (u32 seconds).
 */
public class AddrMessage extends Message
{
    public static final int MAX_ENTRIES = 1000;

    public static final Message.Codec<AddrMessage> codec = new Message.Codec<AddrMessage>()
    {
        public AddrMessage decode(ByteBuf body)
        {
            int count = CompactSize.readCount(body, MAX_ENTRIES, "addr entries");
            List<Entry> entries = new ArrayList<>(count);
            for (int i = 0; i < count; i++)
            {
                long lastSeen = WireUtil.readIntLE(body) & 0xffffffffL;
                entries.add(new Entry(lastSeen, NetAddr.deserialize(body)));
            }
            return new AddrMessage(entries);
        }

        public void encode(AddrMessage msg, ByteBuf out)
        {
            CompactSize.write(out, msg.entries.size());
            for (Entry entry : msg.entries)
            {
                out.writeIntLE((int) entry.lastSeen);
                entry.address.serialize(out);
            }
        }
    };

    public static class Entry
    {
        public final long lastSeen;
        public final NetAddr address;

        public Entry(long lastSeen, NetAddr address)
        {
            this.lastSeen = lastSeen;
            this.address = Objects.requireNonNull(address);
        }

        @Override
        public boolean equals(Object other)
        {
            if (!(other instanceof Entry))
                return false;

            Entry that = (Entry) other;
            return this.lastSeen == that.lastSeen && this.address.equals(that.address);
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(lastSeen, address);
        }

        @Override
        public String toString()
        {
            return address + "@" + lastSeen;
        }
    }

    public final List<Entry> entries;

    public AddrMessage(List<Entry> entries)
    {
        super(Message.Type.ADDR);
        Preconditions.checkArgument(entries.size() <= MAX_ENTRIES, "at most %s addr entries, got %s", MAX_ENTRIES, entries.size());
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static AddrMessage empty()
    {
        return new AddrMessage(Collections.emptyList());
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof AddrMessage && ((AddrMessage) other).entries.equals(entries);
    }

    @Override
    public int hashCode()
    {
        return entries.hashCode();
    }

    @Override
    public String toString()
    {
        return "ADDR " + entries;
    }
}
