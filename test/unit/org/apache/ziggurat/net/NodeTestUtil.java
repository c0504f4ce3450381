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
package org.apache.ziggurat.net;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import com.google.common.util.concurrent.Uninterruptibles;
import org.junit.Assert;

import org.apache.ziggurat.protocol.Network;

final class NodeTestUtil
{
    static final InetSocketAddress LOOPBACK = new InetSocketAddress("127.0.0.1", 0);
    static final long AWAIT_MILLIS = 5000;

    private NodeTestUtil()
    {   }

    static SyntheticNodeConfig.Builder config()
    {
        return SyntheticNodeConfig.builder()
                                  .network(Network.REGTEST)
                                  .connectTimeoutMillis(2000)
                                  .ioTimeoutMillis(2000);
    }

    /**
     * A started node accepting connections on an ephemeral loopback port.
     */
    static SyntheticNode listeningNode(SyntheticNodeConfig.Builder builder) throws Exception
    {
        return new SyntheticNode(builder.listen(LOOPBACK).build()).start();
    }

    static void awaitTrue(String what, BooleanSupplier condition)
    {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(AWAIT_MILLIS);
        while (!condition.getAsBoolean())
        {
            if (System.nanoTime() > deadline)
                Assert.fail("timed out waiting for " + what);
            Uninterruptibles.sleepUninterruptibly(10, TimeUnit.MILLISECONDS);
        }
    }
}
