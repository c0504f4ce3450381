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

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import com.sun.management.UnixOperatingSystemMXBean;
import org.junit.Assert;
import org.junit.Assume;
import org.junit.BeforeClass;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.ziggurat.metrics.MetricsRecorder;
import org.apache.ziggurat.metrics.RequestStats;
import org.apache.ziggurat.metrics.Snapshot;
import org.apache.ziggurat.protocol.Message;
import org.apache.ziggurat.protocol.messages.PingMessage;
import org.apache.ziggurat.protocol.messages.PongMessage;

import static org.apache.ziggurat.net.NodeTestUtil.config;
import static org.apache.ziggurat.net.NodeTestUtil.listeningNode;

/**
 * N synthetic peers each ping a node that auto-replies, one ping at a time, and time every round trip.
 * The number of pings per peer can be lowered with {@code -Dziggurat.test.ping_pong.requests=<n>}.
 */
public class PingPongLatencyTest
{
    private static final Logger logger = LoggerFactory.getLogger(PingPongLatencyTest.class);

    private static final int REQUESTS_PER_PEER = Integer.getInteger("ziggurat.test.ping_pong.requests", 1000);
    private static final long RECV_TIMEOUT_SECONDS = 5;

    private static final String LATENCY = "ping_pong_latency_ms";
    private static final String MISMATCHES = "ping_pong_mismatches";

    private static MetricsRecorder recorder;

    @BeforeClass
    public static void setupRecorder()
    {
        recorder = MetricsRecorder.install();
    }

    @Test
    public void peers_1() throws Exception
    {
        run(1);
    }

    @Test
    public void peers_10() throws Exception
    {
        run(10);
    }

    @Test
    public void peers_100() throws Exception
    {
        run(100);
    }

    @Test
    public void peers_800() throws Exception
    {
        // both ends of every connection live in this process
        Assume.assumeTrue("not enough file descriptors for 800 connections", availableDescriptors() > 800 * 2 + 256);
        run(800);
    }

    private static long availableDescriptors()
    {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (!(os instanceof UnixOperatingSystemMXBean))
            return Long.MAX_VALUE;

        UnixOperatingSystemMXBean unix = (UnixOperatingSystemMXBean) os;
        return unix.getMaxFileDescriptorCount() - unix.getOpenFileDescriptorCount();
    }

    private void run(int peers) throws Exception
    {
        String peersLabel = Integer.toString(peers);
        recorder.clear();
        Assert.assertTrue(recorder.histograms().isEmpty());
        Assert.assertTrue(recorder.counters().isEmpty());
        recorder.registerHistogram(LATENCY, "peers", peersLabel);
        recorder.registerCounter(MISMATCHES, "peers", peersLabel);

        SyntheticNode server = listeningNode(config().handshake(SyntheticNodeConfig.HandshakeMode.FULL)
                                                     .autoReply(MessageFilter.AutoReply.ALL)
                                                     .filter(Message.Type.PING, MessageFilter.Action.AUTO_REPLY_AND_DROP)
                                                     .maxPeers(peers)
                                                     .ioTimeoutMillis(TimeUnit.SECONDS.toMillis(RECV_TIMEOUT_SECONDS)));
        List<SyntheticNode> clients = new ArrayList<>(peers);
        ExecutorService executor = Executors.newFixedThreadPool(peers);
        try
        {
            InetSocketAddress serverAddress = server.listeningAddress();
            for (int i = 0; i < peers; i++)
            {
                SyntheticNode client = new SyntheticNode(config().handshake(SyntheticNodeConfig.HandshakeMode.FULL)
                                                                 .ioTimeoutMillis(TimeUnit.SECONDS.toMillis(RECV_TIMEOUT_SECONDS))
                                                                 .build());
                clients.add(client);
                client.connect(serverAddress);
            }

            AtomicLong completed = new AtomicLong();
            long start = System.nanoTime();
            List<Future<?>> futures = new ArrayList<>(peers);
            for (SyntheticNode client : clients)
            {
                futures.add(executor.submit(() -> {
                    pingLoop(client, serverAddress, peersLabel, completed);
                    return null;
                }));
            }
            for (Future<?> future : futures)
                future.get();
            double elapsedSeconds = (System.nanoTime() - start) / (double) TimeUnit.SECONDS.toNanos(1);

            Snapshot latencies = recorder.histogram(LATENCY, "peers", peersLabel);
            RequestStats stats = new RequestStats(peers, REQUESTS_PER_PEER, latencies, elapsedSeconds);
            logger.info("ping/pong {}", stats);

            Assert.assertEquals(0, recorder.counter(MISMATCHES, "peers", peersLabel));
            Assert.assertEquals(completed.get(), stats.completedRequests());
            Assert.assertEquals(stats.expectedRequests(), stats.completedRequests());
            Assert.assertEquals(100.0, stats.completionPercentage(), 0.0);
            Assert.assertEquals(0, recorder.droppedWrites());
        }
        finally
        {
            executor.shutdownNow();
            for (SyntheticNode client : clients)
                client.shutdown();
            server.shutdown();
        }
    }

    private void pingLoop(SyntheticNode client, InetSocketAddress server, String peersLabel, AtomicLong completed) throws Exception
    {
        for (int i = 0; i < REQUESTS_PER_PEER; i++)
        {
            long nonce = ThreadLocalRandom.current().nextLong();
            long sentNanos = System.nanoTime();
            client.sendDirectMessage(server, new PingMessage(nonce));

            InboundMessage reply;
            try
            {
                reply = client.recvMessageTimeout(RECV_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
            catch (TimeoutException e)
            {
                logger.warn("no pong from {} after ping {} of {}", server, i, REQUESTS_PER_PEER);
                return;
            }

            if (!new PongMessage(nonce).equals(reply.message))
            {
                recorder.incrementCounter(MISMATCHES, 1, "peers", peersLabel);
                continue;
            }
            recorder.recordHistogram(LATENCY, MetricsRecorder.durationAsMillis(reply.receivedNanos - sentNanos), "peers", peersLabel);
            completed.incrementAndGet();
        }
    }
}
