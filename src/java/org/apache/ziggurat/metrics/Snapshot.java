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

import com.google.common.base.Preconditions;

/**
 * An immutable, sorted copy of the samples of a histogram, rounded to integers.
 * Every statistic of an empty snapshot is 0.
 */
public final class Snapshot
{
    private final long[] values;

    public Snapshot(long[] values)
    {
        this.values = values.clone();
        Arrays.sort(this.values);
    }

    public int size()
    {
        return values.length;
    }

    public long min()
    {
        return values.length == 0 ? 0 : values[0];
    }

    public long max()
    {
        return values.length == 0 ? 0 : values[values.length - 1];
    }

    public double mean()
    {
        if (values.length == 0)
            return 0;

        double sum = 0;
        for (long value : values)
            sum += value;
        return sum / values.length;
    }

    /**
     * Population standard deviation.
     */
    public double stdDev()
    {
        if (values.length == 0)
            return 0;

        double mean = mean();
        double sum = 0;
        for (long value : values)
        {
            double diff = value - mean;
            sum += diff * diff;
        }
        return Math.sqrt(sum / values.length);
    }

    /**
     * Nearest-rank percentile: the smallest sample such that at least {@code percentile}% of the samples are lower or
     * equal to it.
     *
     * @param percentile between 0 and 100, inclusive
     */
    public long percentile(double percentile)
    {
        Preconditions.checkArgument(percentile >= 0 && percentile <= 100, "percentile must be in [0, 100], got %s", percentile);
        if (values.length == 0)
            return 0;

        int rank = (int) Math.ceil(percentile / 100 * values.length);
        return values[Math.max(rank - 1, 0)];
    }

    public long[] values()
    {
        return values.clone();
    }

    @Override
    public String toString()
    {
        return String.format("Snapshot(n=%d, min=%d, p50=%d, p99=%d, max=%d)", size(), min(), percentile(50), percentile(99), max());
    }
}
