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
package org.apache.ziggurat.config;

import org.apache.ziggurat.protocol.Network;

/**
 * Process-wide defaults for synthetic nodes, overridable with {@code -Dziggurat.<name>=<value>} system properties.
 * Values are read once, when this class is loaded.
 */
public final class Config
{
    public static final String PROPERTY_PREFIX = "ziggurat.";

    /**
     * Upper bound on establishing the TCP connection to a peer.
     */
    public static final long CONNECT_TIMEOUT_MS = Long.getLong(PROPERTY_PREFIX + "connect_timeout_ms", 5000);

    /**
     * Upper bound on each awaited step of the handshake.
     */
    public static final long IO_TIMEOUT_MS = Long.getLong(PROPERTY_PREFIX + "io_timeout_ms", 5000);

    public static final int MAX_PEERS = Integer.getInteger(PROPERTY_PREFIX + "max_peers", 1000);

    public static final Network NETWORK = Network.fromName(System.getProperty(PROPERTY_PREFIX + "network", "testnet"));

    public static final String USER_AGENT = System.getProperty(PROPERTY_PREFIX + "user_agent", "");

    public static final boolean TCP_NODELAY = Boolean.parseBoolean(System.getProperty(PROPERTY_PREFIX + "tcp_nodelay", "true"));

    /** a useful addition for debugging; set to true to get every frame in the logs */
    public static final boolean WIRETRACE = Boolean.getBoolean(PROPERTY_PREFIX + "wiretrace");

    /**
     * Use the native epoll transport when it is available on this platform.
     */
    public static final boolean USE_EPOLL = Boolean.parseBoolean(System.getProperty(PROPERTY_PREFIX + "use_epoll", "true"));

    private Config()
    {   }
}
