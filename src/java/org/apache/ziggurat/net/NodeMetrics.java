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

import org.apache.ziggurat.metrics.MetricsRecorder;

/**
 * The series a {@link SyntheticNode} feeds into its recorder, if it has one. Every method is a no-op otherwise.
 */
class NodeMetrics
{
    static final String MESSAGES_SENT = "synthetic_node_messages_sent";
    static final String MESSAGES_RECEIVED = "synthetic_node_messages_received";
    static final String AUTO_REPLIES = "synthetic_node_auto_replies";
    static final String PROTOCOL_ERRORS = "synthetic_node_protocol_errors";
    static final String HANDSHAKE_TIMEOUTS = "synthetic_node_handshake_timeouts";
    static final String HANDSHAKE_LATENCY = "synthetic_node_handshake_latency_ms";

    static final NodeMetrics NONE = new NodeMetrics(null);

    @Nullable
    private final MetricsRecorder recorder;

    NodeMetrics(@Nullable MetricsRecorder recorder)
    {
        this.recorder = recorder;
        if (recorder != null)
            register(recorder);
    }

    static void register(MetricsRecorder recorder)
    {
        recorder.registerCounter(MESSAGES_SENT);
        recorder.registerCounter(MESSAGES_RECEIVED);
        recorder.registerCounter(AUTO_REPLIES);
        recorder.registerCounter(PROTOCOL_ERRORS);
        recorder.registerCounter(HANDSHAKE_TIMEOUTS);
        recorder.registerHistogram(HANDSHAKE_LATENCY);
    }

    void messageSent()
    {
        increment(MESSAGES_SENT);
    }

    void messageReceived()
    {
        increment(MESSAGES_RECEIVED);
    }

    void autoReply()
    {
        increment(AUTO_REPLIES);
    }

    void protocolError()
    {
        increment(PROTOCOL_ERRORS);
    }

    void handshakeTimeout()
    {
        increment(HANDSHAKE_TIMEOUTS);
    }

    void handshakeCompleted(long elapsedNanos)
    {
        if (recorder != null)
            recorder.recordHistogram(HANDSHAKE_LATENCY, MetricsRecorder.durationAsMillis(elapsedNanos));
    }

    private void increment(String name)
    {
        if (recorder != null)
            recorder.incrementCounter(name, 1);
    }
}
