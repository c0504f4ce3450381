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
import java.util.function.Function;

import com.google.common.base.Preconditions;
import io.netty.buffer.ByteBuf;

import org.apache.ziggurat.protocol.CompactSize;
import org.apache.ziggurat.protocol.InventoryVector;
import org.apache.ziggurat.protocol.Message;

/**
 * Base of the messages whose body is a plain list of {@link InventoryVector}: {@code inv}, {@code getdata} and
 * {@code notfound}.
 */
public abstract class InventoryMessage extends Message
{
    public static final int MAX_ENTRIES = 50_000;

    public final List<InventoryVector> inventory;

    protected InventoryMessage(Message.Type type, List<InventoryVector> inventory)
    {
        super(type);
        Preconditions.checkArgument(inventory.size() <= MAX_ENTRIES, "at most %s inventory entries, got %s", MAX_ENTRIES, inventory.size());
        this.inventory = Collections.unmodifiableList(new ArrayList<>(inventory));
    }

    static <M extends InventoryMessage> Message.Codec<M> codec(Function<List<InventoryVector>, M> factory)
    {
        return new Message.Codec<M>()
        {
            public M decode(ByteBuf body)
            {
                int count = CompactSize.readCount(body, MAX_ENTRIES, "inventory entries");
                List<InventoryVector> inventory = new ArrayList<>(count);
                for (int i = 0; i < count; i++)
                    inventory.add(InventoryVector.deserialize(body));
                return factory.apply(inventory);
            }

            public void encode(M msg, ByteBuf out)
            {
                CompactSize.write(out, msg.inventory.size());
                for (InventoryVector vector : msg.inventory)
                    vector.serialize(out);
            }
        };
    }

    @Override
    public boolean equals(Object other)
    {
        return other != null && other.getClass() == getClass() && ((InventoryMessage) other).inventory.equals(inventory);
    }

    @Override
    public int hashCode()
    {
        return 31 * type.hashCode() + inventory.hashCode();
    }

    @Override
    public String toString()
    {
        return type + " " + inventory;
    }
}
