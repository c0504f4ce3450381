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

import java.util.Arrays;
import java.util.concurrent.ThreadLocalRandom;

import com.google.common.base.Preconditions;
import com.google.common.io.BaseEncoding;

/**
 * An opaque 32 bytes block or transaction hash, kept in wire order.
 */
public final class Hash
{
    public static final int LENGTH = 32;

    public static final Hash ZERO = new Hash(new byte[LENGTH]);

    private final byte[] bytes;

    public Hash(byte[] bytes)
    {
        Preconditions.checkArgument(bytes.length == LENGTH, "a hash is %s bytes long, got %s", LENGTH, bytes.length);
        this.bytes = bytes.clone();
    }

    public static Hash random()
    {
        byte[] bytes = new byte[LENGTH];
        ThreadLocalRandom.current().nextBytes(bytes);
        return new Hash(bytes);
    }

    public byte[] bytes()
    {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof Hash && Arrays.equals(bytes, ((Hash) other).bytes);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString()
    {
        return BaseEncoding.base16().lowerCase().encode(bytes);
    }
}
