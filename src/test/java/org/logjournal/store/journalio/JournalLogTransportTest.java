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


package org.logjournal.store.journalio;

import org.junit.Test;
import org.logjournal.core.LogProducer;
import org.logjournal.core.support.AbstractLogTransportTest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Tests on the journal log.
 *
 * @author LogJournal contributors
 */
public class JournalLogTransportTest extends AbstractLogTransportTest<JournalLogTransport> {
    // Given
    private final Path tempDirectory;

    public JournalLogTransportTest() throws IOException {
        tempDirectory = Files.createTempDirectory("org.logjournal.test");
    }

    @Test
    public void appendCloseAndAppend() throws Exception {
        // Given
        JournalLogTransport log = createLog();
        LogProducer producer = log.producer(new Properties());
        producer.append("orders", "static", payload(1));
        producer.append("orders", "static", payload(2));
        close(producer, log);

        // When
        log = createLog();
        producer = log.producer(new Properties());
        final long offset = producer.append("orders", "static", payload(3));

        // Then
        assertEquals(2L, offset);
        assertEquals(3L, log.offsetFor("localhost", 9092, "orders", 0));
        final List<byte[]> read = readAll(log.cursor(leader(log, "orders"), "orders", 0, 2L, new Properties()));
        assertEquals(1, read.size());
        assertArrayEquals(payload(3), read.get(0));

        // Cleanup
        close(producer, log);
    }

    @Test
    public void topicExistsAfterRestart() throws Exception {
        // Given
        JournalLogTransport log = createLog();
        final LogProducer producer = log.producer(new Properties());
        producer.append("order/1", "static", payload(1));
        close(producer, log);

        // When
        log = createLog();

        // Then
        assertTrue(log.leaderFor("order/1", Collections.emptyList()).isPresent());
        assertEquals(1L, log.offsetFor("localhost", 9092, "order/1", 0));

        // Cleanup
        close(log);
    }

    @Override
    protected JournalLogTransport createLog() {
        return new JournalLogTransport(tempDirectory.toString());
    }
}
