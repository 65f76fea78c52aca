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


package org.logjournal.core;

import org.junit.Test;
import org.logjournal.core.support.DefaultJournalRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;

/**
 * Tests on atomic writes and broker endpoints.
 *
 * @author LogJournal contributors
 */
public class AtomicWriteTest {
    @Test
    public void atomicWriteBelongsToOneStream() {
        // When
        final AtomicWrite write = AtomicWrite.of(record("orders", 1L), record("orders", 2L));

        // Then
        assertEquals("orders", write.streamId());
        assertEquals(2, write.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyAtomicWriteIsRejected() {
        new AtomicWrite(Collections.<JournalRecord>emptyList());
    }

    @Test(expected = IllegalArgumentException.class)
    public void mixedStreamsAreRejected() {
        AtomicWrite.of(record("orders", 1L), record("invoices", 1L));
    }

    @Test
    public void recordsAreCopied() {
        // Given
        final List<JournalRecord> records = new ArrayList<>();
        records.add(record("orders", 1L));
        final AtomicWrite write = new AtomicWrite(records);

        // When
        records.add(record("orders", 2L));

        // Then
        assertEquals(1, write.size());
    }

    @Test
    public void parseEndpoint() {
        // When
        final BrokerEndpoint endpoint = BrokerEndpoint.parse(" kafka-1:9093 ");

        // Then
        assertEquals("kafka-1", endpoint.host());
        assertEquals(9093, endpoint.port());
        assertEquals("kafka-1:9093", endpoint.toString());
        assertEquals(new BrokerEndpoint("kafka-1", 9093), endpoint);
    }

    @Test(expected = IllegalArgumentException.class)
    public void parseEndpointWithoutPort() {
        BrokerEndpoint.parse("kafka-1");
    }

    @Test(expected = IllegalArgumentException.class)
    public void parseEndpointWithInvalidPort() {
        BrokerEndpoint.parse("kafka-1:abc");
    }

    private JournalRecord record(final String streamId, final long sequenceNr) {
        return new DefaultJournalRecord(streamId, sequenceNr, new byte[]{1});
    }
}
