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
import org.logjournal.core.process.JournalCoordinator;
import org.logjournal.core.support.DefaultJournalRecord;
import org.logjournal.core.support.EventTopicMappers;
import org.logjournal.core.support.InMemoryLogTransport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * Tests on setting up the journal.
 *
 * @author LogJournal contributors
 */
public class LogJournalBuilderTest {
    @Test
    public void buildAndWrite() throws Exception {
        // Given
        final LogJournal journal = LogJournalBuilder.builder()
                .brokers(InMemoryLogTransport.LOCAL_ENDPOINT)
                .log(new InMemoryLogTransport())
                .acknowledgement(WriteAcknowledgement.PERSISTED)
                .build()
                .start();

        // When
        final List<WriteResult> results = journal.write(Arrays.asList(
                AtomicWrite.of(new DefaultJournalRecord("order-1", 1L, "created".getBytes())),
                AtomicWrite.of(new DefaultJournalRecord("order-1", 2L, "paid".getBytes()))))
                .get(5, TimeUnit.SECONDS);

        // Then
        assertTrue(results.stream().allMatch(WriteResult::isSuccess));

        final List<JournalRecord> replayed = new ArrayList<>();
        journal.replay("order-1", 1L, Long.MAX_VALUE, Long.MAX_VALUE, replayed::add).get(5, TimeUnit.SECONDS);
        assertEquals(2, replayed.size());
        assertEquals("paid", new String(replayed.get(1).payload()));
        assertEquals(2L, (long) journal.highestSequenceNr("order-1", 0L).get(5, TimeUnit.SECONDS));

        // Cleanup
        journal.stop();
    }

    @Test
    public void builderCanBeReused() throws Exception {
        // Given
        final LogJournalBuilder builder = LogJournalBuilder.builder()
                .brokers(InMemoryLogTransport.LOCAL_ENDPOINT)
                .log(new InMemoryLogTransport())
                .acknowledgement(WriteAcknowledgement.PERSISTED);
        final LogJournal first = builder.build().start();
        final LogJournal second = builder.build().start();

        // When
        first.stop();

        // Then
        final List<WriteResult> results = second.write(Arrays.asList(
                AtomicWrite.of(new DefaultJournalRecord("order-2", 1L, "created".getBytes()))))
                .get(5, TimeUnit.SECONDS);
        assertTrue(results.get(0).isSuccess());
        assertEquals(1L, (long) second.highestSequenceNr("order-2", 0L).get(5, TimeUnit.SECONDS));

        // Cleanup
        second.stop();
    }

    @Test
    public void configureFromClasspath() throws Exception {
        // Given
        final CapturingLogTransport log = new CapturingLogTransport();
        final LogJournal journal = LogJournalBuilder.builder()
                .configure("logjournal-test.properties")
                .log(log)
                .eventTopicMapper(EventTopicMappers.empty())
                .build()
                .start();

        // When
        journal.write(Arrays.asList(AtomicWrite.of(new DefaultJournalRecord("order-1", 1L, new byte[]{1}))))
                .get(5, TimeUnit.SECONDS);
        journal.replay("order-1", 1L, 1L, 1L, record -> {
        }).get(5, TimeUnit.SECONDS);

        // Then
        final JournalCoordinator coordinator = (JournalCoordinator) journal;
        assertEquals(Arrays.asList(BrokerEndpoint.parse("kafka-1:9092"), BrokerEndpoint.parse("kafka-2:9093")),
                coordinator.brokers());

        // Three journal writers and three event writers
        assertEquals(6, log.producerConfigs.size());
        assertTrue(log.producerConfigs.stream().allMatch(config ->
                "kafka-1:9092,kafka-2:9093".equals(config.getProperty("bootstrap.servers"))));
        assertEquals(3, log.producerConfigs.stream().filter(config -> "all".equals(config.getProperty("acks"))).count());
        assertEquals(3, log.producerConfigs.stream().filter(config -> "5".equals(config.getProperty("linger.ms"))).count());
        assertEquals("100", log.cursorConfigs.get(0).getProperty("max.poll.records"));

        // Cleanup
        journal.stop();
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidAcknowledgement() {
        LogJournalBuilder.builder().configure(properties("journal.acknowledgement", "sometimes"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidBrokers() {
        LogJournalBuilder.builder().configure(properties("journal.brokers", "kafka-1"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidPartition() {
        LogJournalBuilder.builder()
                .brokers(InMemoryLogTransport.LOCAL_ENDPOINT)
                .log(new InMemoryLogTransport())
                .partition(-1)
                .build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidWriteConcurrency() {
        LogJournalBuilder.builder()
                .brokers(InMemoryLogTransport.LOCAL_ENDPOINT)
                .log(new InMemoryLogTransport())
                .writeConcurrency(0)
                .build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingConfiguration() {
        LogJournalBuilder.builder().configure("missing.properties");
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonNumericWriteConcurrency() {
        LogJournalBuilder.builder().configure(properties("journal.write-concurrency", "many"));
    }

    @Test
    public void providedExecutorIsNotShutDown() {
        // Given
        final ExecutorService executorService = Executors.newSingleThreadExecutor();
        final LogJournal journal = LogJournalBuilder.builder()
                .brokers(InMemoryLogTransport.LOCAL_ENDPOINT)
                .log(new InMemoryLogTransport())
                .executorService(executorService)
                .build()
                .start();

        // When
        journal.stop();

        // Then
        assertFalse(executorService.isShutdown());

        // Cleanup
        executorService.shutdown();
    }

    private Properties properties(final String key, final String value) {
        final Properties properties = new Properties();
        properties.setProperty(key, value);
        return properties;
    }

    private static class CapturingLogTransport extends InMemoryLogTransport {
        private final List<Properties> cursorConfigs = new CopyOnWriteArrayList<>();
        private final List<Properties> producerConfigs = new CopyOnWriteArrayList<>();

        @Override
        public LogCursor cursor(
                final BrokerEndpoint leader,
                final String topic,
                final int partition,
                final long offset,
                final Properties config) {

            cursorConfigs.add(config);
            return super.cursor(leader, topic, partition, offset, config);
        }

        @Override
        public LogProducer producer(final Properties config) {
            producerConfigs.add(config);
            return super.producer(config);
        }
    }
}
