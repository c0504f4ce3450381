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
/**
 * <h1>Synthetic nodes</h1>
 * Here we describe how a {@link org.apache.ziggurat.net.SyntheticNode} talks to the node under test. To avoid any
 * confusion with client-server terminology, we'll use "initiator" for the side dialing the connection and "responder"
 * for the side accepting it. A synthetic node may play either role, or both on different connections.
 *
 * <h2>Starting a connection</h2>
 * Each connection begins the same way:
 * - establish the TCP socket connection
 * - perform the handshake, unless the node was configured to skip it
 * - exchange messages ... until one end closes the socket
 *
 * <h3>handshake</h3>
 * <pre>
 * {@code
 *   initiator                      responder
 *       | ---------- version --------> |
 *       | <--------- version --------- |
 *       | <--------- verack ---------- |
 *       | ---------- verack ---------> |
 * }
 * </pre>
 * The initiator speaks first. Each side acknowledges the other's version with a verack, and a connection is ready
 * once a side both sent its verack and received the peer's. Every wait is bounded by the node's I/O timeout, and any
 * other message during the handshake fails it. See {@link org.apache.ziggurat.net.HandshakeHandler}.
 *
 * <h2>Message format</h2>
 * Every message is a 24 bytes header followed by the body. All integers are little-endian, except where noted.
 *
 * <pre>
 * {@code
 *            1 1 1 1 1 2 2 2 2 2 3 3 3 3 3 4 4 4 4 4 5 5 5 5 5 6 6
 *  0 2 4 6 8 0 2 4 6 8 0 2 4 6 8 0 2 4 6 8 0 2 4 6 8 0 2 4 6 8 0 2
 * +-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+
 * |                   NETWORK MAGIC (wire order)                  |
 * +-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+
 * |                                                               |
 * +               Command (ASCII, NUL padded to 12 bytes)         +
 * |                                                               |
 * +-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+
 * |                         Body length                           |
 * +-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+
 * |        Checksum (first 4 bytes of SHA256(SHA256(body)))       |
 * +-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+
 * |                                                               /
 * /                             Body                              /
 * /                                                               |
 * +-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+
 * }
 * </pre>
 *
 * Variable length fields are prefixed by a {@link org.apache.ziggurat.protocol.CompactSize} count.
 *
 * <h1>Implementation notes</h1>
 * Each connection is a netty channel whose pipeline is, in order: {@link org.apache.ziggurat.net.MessageFrameEncoder},
 * {@link org.apache.ziggurat.net.MessageFrameDecoder}, {@link org.apache.ziggurat.net.HandshakeHandler} (removed once
 * the handshake completes), {@link org.apache.ziggurat.net.InboundMessageHandler} and
 * {@link org.apache.ziggurat.net.ConnectionErrorHandler}. Nothing on an event loop ever blocks; the scenario thread
 * blocks in {@link org.apache.ziggurat.net.SyntheticNode#connect(java.net.InetSocketAddress)} and
 * {@link org.apache.ziggurat.net.SyntheticNode#recvMessageTimeout(long, java.util.concurrent.TimeUnit)} only.
 */
package org.apache.ziggurat.net;
