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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.base.Preconditions;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

/**
 * Identifies a series: a metric name plus its labels, kept sorted so that the order they are given in does not matter.
 */
public final class MetricKey
{
    public final String name;
    public final SortedMap<String, String> labels;

    private MetricKey(String name, SortedMap<String, String> labels)
    {
        this.name = name;
        this.labels = Collections.unmodifiableSortedMap(labels);
    }

    /**
     * @param labels alternating label names and values
     */
    public static MetricKey of(String name, String... labels)
    {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "metric name cannot be empty");
        Preconditions.checkArgument(labels.length % 2 == 0, "labels must be name/value pairs, got %s strings", labels.length);
        SortedMap<String, String> sorted = new TreeMap<>();
        for (int i = 0; i < labels.length; i += 2)
        {
            if (sorted.put(labels[i], labels[i + 1]) != null)
                throw new IllegalArgumentException("Duplicate label " + labels[i] + " for metric " + name);
        }
        return new MetricKey(name, sorted);
    }

    Tags tags()
    {
        Tags tags = Tags.empty();
        for (Map.Entry<String, String> label : labels.entrySet())
            tags = tags.and(Tag.of(label.getKey(), label.getValue()));
        return tags;
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof MetricKey))
            return false;

        MetricKey that = (MetricKey) other;
        return this.name.equals(that.name) && this.labels.equals(that.labels);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(name, labels);
    }

    @Override
    public String toString()
    {
        return labels.isEmpty() ? name : name + labels;
    }
}
