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
import org.apache.ziggurat.protocol.Hash;
import org.apache.ziggurat.protocol.Message;
import org.apache.ziggurat.protocol.WireUtil;

/**
 * Base of {@code getblocks} and {@code getheaders}, which share a body: protocol version, a block locator (hashes
 * from the tip backwards) and the hash to stop at, {@link Hash#ZERO} meaning "as many as allowed".
 */
public abstract class LocatorMessage extends Message
{
    public static final int MAX_LOCATOR_HASHES = 500;

    public final int version;
    public final List<Hash> locator;
    public final Hash stop;

    protected LocatorMessage(Message.Type type, int version, List<Hash> locator, Hash stop)
    {
        super(type);
        Preconditions.checkArgument(locator.size() <= MAX_LOCATOR_HASHES, "at most %s locator hashes, got %s", MAX_LOCATOR_HASHES, locator.size());
        this.version = version;
        this.locator = Collections.unmodifiableList(new ArrayList<>(locator));
        this.stop = Objects.requireNonNull(stop);
    }

    interface Factory<M extends LocatorMessage>
    {
        M create(int version, List<Hash> locator, Hash stop);
    }

    static <M extends LocatorMessage> Message.Codec<M> codec(Factory<M> factory)
    {
        return new Message.Codec<M>()
        {
            public M decode(ByteBuf body)
            {
                int version = WireUtil.readIntLE(body);
                int count = CompactSize.readCount(body, MAX_LOCATOR_HASHES, "locator hashes");
                List<Hash> locator = new ArrayList<>(count);
                for (int i = 0; i < count; i++)
                    locator.add(WireUtil.readHash(body));
                return factory.create(version, locator, WireUtil.readHash(body));
            }

            public void encode(M msg, ByteBuf out)
            {
                out.writeIntLE(msg.version);
                CompactSize.write(out, msg.locator.size());
                for (Hash hash : msg.locator)
                    WireUtil.writeHash(out, hash);
                WireUtil.writeHash(out, msg.stop);
            }
        };
    }

    @Override
    public boolean equals(Object other)
    {
        if (other == null || other.getClass() != getClass())
            return false;

        LocatorMessage that = (LocatorMessage) other;
        return this.version == that.version && this.locator.equals(that.locator) && this.stop.equals(that.stop);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(type, version, locator, stop);
    }

    @Override
    public String toString()
    {
        return String.format("%s version=%d locator=%s stop=%s", type, version, locator, stop);
    }
}
