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

/**
 * An {@code inv}/{@code getdata}/{@code notfound} entry: a u32 object type followed by the object's hash.
 */
public final class InventoryVector
{
    public static final int SERIALIZED_SIZE = 4 + Hash.LENGTH;

    public static final int ERROR = 0;
    public static final int MSG_TX = 1;
    public static final int MSG_BLOCK = 2;
    public static final int MSG_FILTERED_BLOCK = 3;

    public final int type;
    public final Hash hash;

    public InventoryVector(int type, Hash hash)
    {
        this.type = type;
        this.hash = Objects.requireNonNull(hash);
    }

    public void serialize(ByteBuf out)
    {
        out.writeIntLE(type);
        WireUtil.writeHash(out, hash);
    }

    public static InventoryVector deserialize(ByteBuf in)
    {
        WireUtil.ensureReadable(in, SERIALIZED_SIZE, "an inventory vector");
        int type = in.readIntLE();
        return new InventoryVector(type, WireUtil.readHash(in));
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof InventoryVector))
            return false;

        InventoryVector that = (InventoryVector) other;
        return this.type == that.type && this.hash.equals(that.hash);
    }

    @Override
    public int hashCode()
    {
        return 31 * type + hash.hashCode();
    }

    @Override
    public String toString()
    {
        return type + ":" + hash;
    }
}
