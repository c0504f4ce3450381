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

import org.junit.Assert;
import org.junit.Test;

public class SnapshotTest
{
    private static final Snapshot ONE_TO_TEN = new Snapshot(new long[]{ 10, 9, 8, 7, 6, 5, 4, 3, 2, 1 });

    @Test
    public void sorted()
    {
        Assert.assertArrayEquals(new long[]{ 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 }, ONE_TO_TEN.values());
        Assert.assertEquals(1, ONE_TO_TEN.min());
        Assert.assertEquals(10, ONE_TO_TEN.max());
        Assert.assertEquals(10, ONE_TO_TEN.size());
    }

    @Test
    public void meanAndStdDev()
    {
        Assert.assertEquals(5.5, ONE_TO_TEN.mean(), 1e-9);
        Assert.assertEquals(Math.sqrt(8.25), ONE_TO_TEN.stdDev(), 1e-9);
        Assert.assertEquals(0.0, new Snapshot(new long[]{ 4, 4, 4 }).stdDev(), 0.0);
    }

    @Test
    public void percentile_NearestRank()
    {
        Assert.assertEquals(1, ONE_TO_TEN.percentile(0));
        Assert.assertEquals(1, ONE_TO_TEN.percentile(10));
        Assert.assertEquals(5, ONE_TO_TEN.percentile(50));
        Assert.assertEquals(8, ONE_TO_TEN.percentile(75));
        Assert.assertEquals(9, ONE_TO_TEN.percentile(90));
        Assert.assertEquals(10, ONE_TO_TEN.percentile(99));
        Assert.assertEquals(10, ONE_TO_TEN.percentile(100));
    }

    @Test(expected = IllegalArgumentException.class)
    public void percentile_OutOfRange()
    {
        ONE_TO_TEN.percentile(100.5);
    }

    @Test
    public void empty()
    {
        Snapshot empty = new Snapshot(new long[0]);
        Assert.assertEquals(0, empty.size());
        Assert.assertEquals(0, empty.min());
        Assert.assertEquals(0, empty.max());
        Assert.assertEquals(0.0, empty.mean(), 0.0);
        Assert.assertEquals(0.0, empty.stdDev(), 0.0);
        Assert.assertEquals(0, empty.percentile(50));
    }

    @Test
    public void valuesAreCopied()
    {
        long[] values = { 3, 1, 2 };
        Snapshot snapshot = new Snapshot(values);
        values[0] = 100;
        snapshot.values()[0] = 100;
        Assert.assertEquals(3, snapshot.max());
        Assert.assertEquals(1, snapshot.min());
    }
}
