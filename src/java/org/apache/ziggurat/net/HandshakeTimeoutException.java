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

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * A connection attempt did not complete in time. {@link #step} tells which part was waited on.
 */
public class HandshakeTimeoutException extends IOException
{
    public enum Step
    {
        /** establishing the TCP connection */
        CONNECT,
        PEER_VERSION,
        PEER_VERACK
    }

    public final Step step;
    public final InetSocketAddress peer;

    public HandshakeTimeoutException(Step step, InetSocketAddress peer, long timeoutMillis)
    {
        this(step, peer, timeoutMillis, null);
    }

    public HandshakeTimeoutException(Step step, InetSocketAddress peer, long timeoutMillis, Throwable cause)
    {
        super(String.format("Timed out after %dms waiting for %s with %s", timeoutMillis, describe(step), peer), cause);
        this.step = step;
        this.peer = peer;
    }

    private static String describe(Step step)
    {
        switch (step)
        {
            case CONNECT:
                return "the TCP connection";
            case PEER_VERSION:
                return "the peer's version";
            default:
                return "the peer's verack";
        }
    }
}
