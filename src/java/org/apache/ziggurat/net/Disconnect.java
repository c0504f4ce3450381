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

import javax.annotation.Nullable;

/**
 * Why a {@link Connection} went away. Only the first classification of a connection sticks.
 */
public final class Disconnect
{
    public enum Reason
    {
        /** closed by this node */
        LOCAL_CLOSE,
        /** the peer closed the socket */
        PEER_CLOSED,
        TRANSPORT_ERROR,
        /** the peer sent bytes that do not decode */
        PROTOCOL_ERROR,
        HANDSHAKE_TIMEOUT,
        HANDSHAKE_FAILED,
        /** accepted while the node already had its maximum number of peers */
        PEER_LIMIT
    }

    public final Reason reason;
    @Nullable
    public final Throwable cause;

    Disconnect(Reason reason, @Nullable Throwable cause)
    {
        this.reason = reason;
        this.cause = cause;
    }

    @Override
    public String toString()
    {
        return cause == null ? reason.toString() : reason + " (" + cause + ')';
    }
}
