/*
 * Copyright 2014 the original author or authors.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */


package org.logjournal.core.process;

import org.junit.Test;
import org.logjournal.core.BrokerEndpoint;
import org.logjournal.core.support.ObjectStreamSerializer;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.logjournal.core.process.JournalWriterShardTest.config;

/**
 * Tests on routing streams to shards.
 *
 * @author LogJournal contributors
 */
public class ShardPoolTest {
    private final RecordingLogTransport transport = new RecordingLogTransport();

    @Test
    public void failedCreationClosesCreatedShards() {
        // Given
        final AtomicInteger created = new AtomicInteger();
        final WriterConfig config = config(new ObjectStreamSerializer(), new BrokerEndpoint("broker-1", 9092));

        try {
            // When
            new ShardPool<>(3, index -> {
                if (index == 2) {
                    throw new IllegalStateException("Unable to create shard");
                }
                created.incrementAndGet();
                return new JournalWriterShard(index, transport, config);
            });
            fail("Expected the pool creation to fail");
        } catch (final IllegalStateException e) {
            // Then
            assertEquals(2, created.get());
            assertEquals(2, transport.lifecycle().stream().filter(entry -> entry.startsWith("close:")).count());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void poolMustNotBeEmpty() {
        new ShardPool<>(0, index -> new JournalWriterShard(index, transport, null));
    }

    @Test
    public void sameStreamAlwaysUsesTheSameShard() {
        // Given
        final WriterConfig config = config(new ObjectStreamSerializer(), new BrokerEndpoint("broker-1", 9092));
        final ShardPool<JournalWriterShard> pool = new ShardPool<>(4, index -> new JournalWriterShard(index, transport, config));

        // When
        final JournalWriterShard first = pool.shardFor("order-42");
        final JournalWriterShard second = pool.shardFor("order-42");

        // Then
        assertSame(first, second);
        assertEquals(Math.floorMod("order-42".hashCode(), 4), first.index());
        for (int i = 0; i < 100; i++) {
            final int index = pool.indexFor("stream-" + i);
            assertTrue(index >= 0 && index < pool.size());
        }

        // Cleanup
        pool.stop();
    }

    @Test
    public void updateReachesEveryShard() throws Exception {
        // Given
        final ShardPool<JournalWriterShard> pool = new ShardPool<>(3, index ->
                new JournalWriterShard(index, transport, config(new ObjectStreamSerializer(), new BrokerEndpoint("broker-1", 9092))));

        // When
        pool.updateConfig(config(new ObjectStreamSerializer(), new BrokerEndpoint("broker-2", 9092))).get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(3, transport.lifecycle().stream().filter("open:broker-2:9092"::equals).count());
        assertEquals(3, transport.lifecycle().stream().filter("close:broker-1:9092"::equals).count());

        // Cleanup
        pool.stop();
    }
}
