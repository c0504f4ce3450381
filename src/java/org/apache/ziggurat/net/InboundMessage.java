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

import org.apache.ziggurat.protocol.Message;

/**
 * A decoded message as handed to the scenario, with the peer it came from.
 */
public final class InboundMessage
{
    public final InetSocketAddress peer;
    public final Message message;

    /**
     * {@link System#nanoTime()} when the message was decoded.
     */
    public final long receivedNanos;

    InboundMessage(InetSocketAddress peer, Message message, long receivedNanos)
    {
        this.peer = peer;
        this.message = message;
        this.receivedNanos = receivedNanos;
    }

    @Override
    public String toString()
    {
        return message + " from " + peer;
    }
}
