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

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Counters and histograms that test scenarios record into and then assert on.
 * <p>
 * A series must be registered before it is written to. Writes to a series that is not registered (including one
 * removed by {@link #clear()}) are dropped: they are logged once per series and counted in {@link #droppedWrites()},
 * but never fail the caller.
 * <p>
 * Every registered series is mirrored in a Micrometer {@link MeterRegistry}, so an exporting registry can be passed
 * to {@link #MetricsRecorder(MeterRegistry)}. Histogram snapshots, however, come from the raw samples.
 * <p>
 * All methods are thread safe.
 */
public class MetricsRecorder
{
    private static final Logger logger = LoggerFactory.getLogger(MetricsRecorder.class);

    private static final AtomicReference<MetricsRecorder> instance = new AtomicReference<>();

    private final MeterRegistry registry;

    private final Map<MetricKey, Counter> counters = new HashMap<>();
    private final Map<MetricKey, SampleHistogram> histograms = new HashMap<>();

    // dropped series already logged
    private final Set<MetricKey> warned = new HashSet<>();
    private long droppedWrites;

    public MetricsRecorder()
    {
        this(new SimpleMeterRegistry());
    }

    public MetricsRecorder(MeterRegistry registry)
    {
        this.registry = registry;
    }

    /**
     * Returns the process-wide recorder, creating it on first use.
     */
    public static MetricsRecorder install()
    {
        MetricsRecorder recorder = instance.get();
        if (recorder != null)
            return recorder;

        instance.compareAndSet(null, new MetricsRecorder());
        return instance.get();
    }

    public MeterRegistry registry()
    {
        return registry;
    }

    /**
     * Registers a counter. Registering an existing series is a no-op.
     *
     * @param labels alternating label names and values
     */
    public synchronized MetricKey registerCounter(String name, String... labels)
    {
        MetricKey key = MetricKey.of(name, labels);
        counters.computeIfAbsent(key, k -> Counter.builder(k.name).tags(k.tags()).register(registry));
        warned.remove(key);
        return key;
    }

    /**
     * Registers a histogram. Registering an existing series is a no-op.
     *
     * @param labels alternating label names and values
     */
    public synchronized MetricKey registerHistogram(String name, String... labels)
    {
        MetricKey key = MetricKey.of(name, labels);
        histograms.computeIfAbsent(key, k -> new SampleHistogram(DistributionSummary.builder(k.name).tags(k.tags()).register(registry)));
        warned.remove(key);
        return key;
    }

    public synchronized void incrementCounter(String name, long delta, String... labels)
    {
        Preconditions.checkArgument(delta >= 0, "counters only go up, got a delta of %s", delta);
        MetricKey key = MetricKey.of(name, labels);
        Counter counter = counters.get(key);
        if (counter == null)
        {
            dropped(key, "counter");
            return;
        }
        counter.increment(delta);
    }

    public synchronized void recordHistogram(String name, double value, String... labels)
    {
        MetricKey key = MetricKey.of(name, labels);
        SampleHistogram histogram = histograms.get(key);
        if (histogram == null)
        {
            dropped(key, "histogram");
            return;
        }
        histogram.record(value);
    }

    private void dropped(MetricKey key, String kind)
    {
        droppedWrites++;
        if (warned.add(key))
            logger.warn("Dropping write to unregistered {} {}", kind, key);
    }

    public synchronized Map<MetricKey, Long> counters()
    {
        Map<MetricKey, Long> values = new HashMap<>();
        for (Map.Entry<MetricKey, Counter> entry : counters.entrySet())
            values.put(entry.getKey(), (long) entry.getValue().count());
        return values;
    }

    /**
     * The current value of a counter, or 0 if it is not registered.
     */
    public synchronized long counter(String name, String... labels)
    {
        Counter counter = counters.get(MetricKey.of(name, labels));
        return counter == null ? 0 : (long) counter.count();
    }

    public synchronized Map<MetricKey, Snapshot> histograms()
    {
        Map<MetricKey, Snapshot> snapshots = new HashMap<>();
        for (Map.Entry<MetricKey, SampleHistogram> entry : histograms.entrySet())
            snapshots.put(entry.getKey(), entry.getValue().snapshot());
        return snapshots;
    }

    /**
     * A snapshot of one histogram, or null if it is not registered.
     */
    @Nullable
    public synchronized Snapshot histogram(String name, String... labels)
    {
        SampleHistogram histogram = histograms.get(MetricKey.of(name, labels));
        return histogram == null ? null : histogram.snapshot();
    }

    /**
     * Unregisters every series, from this recorder and from its Micrometer registry.
     */
    public synchronized void clear()
    {
        for (Counter counter : counters.values())
            registry.remove(counter);
        for (SampleHistogram histogram : histograms.values())
            registry.remove(histogram.summary());
        counters.clear();
        histograms.clear();
        warned.clear();
    }

    public synchronized long droppedWrites()
    {
        return droppedWrites;
    }

    public static double durationAsMillis(long nanos)
    {
        return nanos / (double) TimeUnit.MILLISECONDS.toNanos(1);
    }

    @VisibleForTesting
    static void resetInstance()
    {
        instance.set(null);
    }
}
