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

import org.junit.After;
import org.junit.Test;
import org.logjournal.core.BrokerEndpoint;
import org.logjournal.core.Event;
import org.logjournal.core.EventFilter;
import org.logjournal.core.EventTopicMapper;
import org.logjournal.core.WriteAcknowledgement;
import org.logjournal.core.WriteResult;
import org.logjournal.core.support.EventTopicMappers;
import org.logjournal.core.support.ObjectStreamSerializer;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.logjournal.core.process.JournalWriterShardTest.records;

/**
 * Tests on republishing records as events.
 *
 * @author LogJournal contributors
 */
public class EventWriterShardTest {
    private final ObjectStreamSerializer serializer = new ObjectStreamSerializer();
    private EventWriterShard shard;
    private final RecordingLogTransport transport = new RecordingLogTransport();

    @After
    public void tearDown() {
        if (shard != null) {
            shard.stop();
        }
    }

    @Test
    public void emptyMapperPublishesNothing() throws Exception {
        // Given
        shard = new EventWriterShard(0, transport, config(EventTopicMappers.empty(), EventFilter.ACCEPT_ALL));

        // When
        final List<WriteResult> results = shard.write(records("orders", 3)).get(5, TimeUnit.SECONDS);

        // Then
        assertTrue(results.isEmpty());
        assertTrue(transport.delegate().topics().isEmpty());
    }

    @Test
    public void eventsArePublishedToEveryMappedTopic() throws Exception {
        // Given
        shard = new EventWriterShard(0, transport, config(EventTopicMappers.fixed("audit", "billing"), EventFilter.ACCEPT_ALL));

        // When
        final List<WriteResult> results = shard.write(records("orders", 2)).get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(4, results.size());
        assertEquals(2, transport.delegate().payloads("audit").size());
        assertEquals(2, transport.delegate().payloads("billing").size());

        final Event event = serializer.deserializeEvent(transport.delegate().payloads("billing").get(1));
        assertEquals("orders", event.streamId());
        assertEquals(2L, event.sequenceNr());
    }

    @Test
    public void filteredEventsAreSkipped() throws Exception {
        // Given
        final EventFilter evenOnly = event -> event.sequenceNr() % 2 == 0;
        shard = new EventWriterShard(0, transport, config(EventTopicMappers.defaultMapper(), evenOnly));

        // When
        final List<WriteResult> results = shard.write(records("orders", 4)).get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(2, results.size());
        final List<byte[]> published = transport.delegate().payloads(EventTopicMappers.DEFAULT_EVENT_TOPIC);
        assertEquals(2L, serializer.deserializeEvent(published.get(0)).sequenceNr());
        assertEquals(4L, serializer.deserializeEvent(published.get(1)).sequenceNr());
    }

    @Test
    public void streamIdIsThePartitionKey() throws Exception {
        // Given
        shard = new EventWriterShard(0, transport, config(EventTopicMappers.defaultMapper(), EventFilter.ACCEPT_ALL));

        // When
        shard.write(records("orders", 1)).get(5, TimeUnit.SECONDS);
        shard.write(records("invoices", 1)).get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(Arrays.asList("orders", "invoices"), transport.delegate().keys(EventTopicMappers.DEFAULT_EVENT_TOPIC));
    }

    @Test
    public void failedPublicationIsReportedPerTopic() throws Exception {
        // Given
        transport.failAppends("billing"::equals);
        shard = new EventWriterShard(0, transport, config(EventTopicMappers.fixed("audit", "billing"), EventFilter.ACCEPT_ALL));

        // When
        final List<WriteResult> results = shard.write(records("orders", 1)).get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(2, results.size());
        assertTrue(results.get(0).isSuccess());
        assertFalse(results.get(1).isSuccess());
        assertEquals(1, transport.delegate().payloads("audit").size());
    }

    private WriterConfig config(final EventTopicMapper mapper, final EventFilter filter) {
        return new JournalSettings(
                1,
                0,
                WriteAcknowledgement.DISPATCHED,
                new Properties(),
                new Properties(),
                new Properties(),
                mapper,
                filter,
                serializer,
                serializer).writerConfig(Collections.singletonList(new BrokerEndpoint("broker-1", 9092)));
    }
}
