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

import java.util.Arrays;

import io.micrometer.core.instrument.DistributionSummary;

/**
 * Keeps every sample it is given, so snapshots are exact rather than bucketed. The Micrometer summary it feeds only
 * tracks count, total and max, for whatever registry the samples are exported to.
 * <p>
 * Not thread safe; {@link MetricsRecorder} serializes access.
 */
final class SampleHistogram
{
    private final DistributionSummary summary;
    private double[] samples = new double[64];
    private int count;

    SampleHistogram(DistributionSummary summary)
    {
        this.summary = summary;
    }

    DistributionSummary summary()
    {
        return summary;
    }

    void record(double value)
    {
        if (count == samples.length)
            samples = Arrays.copyOf(samples, count * 2);
        samples[count++] = value;
        summary.record(value);
    }

    int count()
    {
        return count;
    }

    Snapshot snapshot()
    {
        long[] rounded = new long[count];
        for (int i = 0; i < count; i++)
            rounded[i] = Math.round(samples[i]);
        return new Snapshot(rounded);
    }
}
