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
package org.apache.ziggurat.metrics;

/**
 * Summary of a request/response scenario: how many peers issued how many requests each, the latencies of those that
 * completed, and how long it all took.
 */
public final class RequestStats
{
    public final int peers;
    public final int requestsPerPeer;
    public final Snapshot latencies;
    public final double elapsedSeconds;

    public RequestStats(int peers, int requestsPerPeer, Snapshot latencies, double elapsedSeconds)
    {
        this.peers = peers;
        this.requestsPerPeer = requestsPerPeer;
        this.latencies = latencies;
        this.elapsedSeconds = elapsedSeconds;
    }

    public long expectedRequests()
    {
        return (long) peers * requestsPerPeer;
    }

    public long completedRequests()
    {
        return latencies.size();
    }

    public double completionPercentage()
    {
        long expected = expectedRequests();
        return expected == 0 ? 0 : 100.0 * completedRequests() / expected;
    }

    /**
     * Completed requests per second.
     */
    public double throughput()
    {
        return elapsedSeconds <= 0 ? 0 : completedRequests() / elapsedSeconds;
    }

    @Override
    public String toString()
    {
        return String.format("peers=%d requests=%d min=%dms max=%dms stddev=%.2fms p10=%dms p50=%dms p75=%dms p90=%dms p99=%dms completion=%.2f%% time=%.2fs throughput=%.2f/s",
                             peers,
                             requestsPerPeer,
                             latencies.min(),
                             latencies.max(),
                             latencies.stdDev(),
                             latencies.percentile(10),
                             latencies.percentile(50),
                             latencies.percentile(75),
                             latencies.percentile(90),
                             latencies.percentile(99),
                             completionPercentage(),
                             elapsedSeconds,
                             throughput());
    }
}
