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


package org.logjournal.transport.kafka;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.Test;
import org.logjournal.core.BrokerEndpoint;
import org.logjournal.core.LogCursor;
import org.logjournal.core.LogProducer;
import org.logjournal.core.TransportException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * Tests on the Kafka transport, using the mock clients shipped with kafka-clients.
 *
 * @author LogJournal contributors
 */
public class KafkaLogTransportTest {
    private static final BrokerEndpoint LEADER = new BrokerEndpoint("kafka-1", 9092);
    private static final TopicPartition ORDERS = new TopicPartition("orders", 0);
    private final MockConsumer<String, byte[]> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    private final List<Properties> consumerConfigs = new ArrayList<>();
    private final MockProducer<String, byte[]> producer =
            new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    private final KafkaLogTransport transport = new KafkaLogTransport(
            config -> producer,
            config -> {
                consumerConfigs.add(config);
                return consumer;
            },
            Duration.ofMillis(10),
            3);

    @Test
    public void appendSendsKeyedRecordsAndReturnsOffsets() {
        // Given
        final LogProducer logProducer = transport.producer(new Properties());

        // When
        final long first = logProducer.append("orders", "static", new byte[]{1});
        final long second = logProducer.append("orders", "static", new byte[]{2});

        // Then
        assertEquals(0L, first);
        assertEquals(1L, second);
        final List<ProducerRecord<String, byte[]>> history = producer.history();
        assertEquals(2, history.size());
        assertTrue(history.stream().allMatch(record -> "orders".equals(record.topic()) && "static".equals(record.key())));
    }

    @Test(expected = TransportException.class)
    public void appendAfterCloseFails() {
        // Given
        final LogProducer logProducer = transport.producer(new Properties());
        logProducer.close();

        // When
        logProducer.append("orders", "static", new byte[]{1});
    }

    @Test
    public void consumerConfigDoesNotJoinAGroup() {
        // Given
        final Properties base = new Properties();
        base.setProperty(ConsumerConfig.GROUP_ID_CONFIG, "journal");
        base.setProperty(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, "100");

        // When
        final Properties config = KafkaLogTransport.consumerConfig(base, LEADER);

        // Then
        assertFalse(config.containsKey(ConsumerConfig.GROUP_ID_CONFIG));
        assertEquals("false", config.getProperty(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
        assertEquals("kafka-1:9092", config.getProperty(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG));
        assertEquals("100", config.getProperty(ConsumerConfig.MAX_POLL_RECORDS_CONFIG));
        assertEquals("journal", base.getProperty(ConsumerConfig.GROUP_ID_CONFIG));
    }

    @Test
    public void cursorReadsFromOffsetToEnd() {
        // Given
        consumer.updateEndOffsets(Collections.singletonMap(ORDERS, 3L));
        final LogCursor cursor = transport.cursor(LEADER, "orders", 0, 1L, new Properties());
        for (long offset = 0; offset < 4; offset++) {
            consumer.addRecord(new ConsumerRecord<>("orders", 0, offset, "static", new byte[]{(byte) offset}));
        }

        // When
        final List<byte[]> read = new ArrayList<>();
        while (cursor.hasNext()) {
            read.add(cursor.next());
        }

        // Then
        assertEquals(2, read.size());
        assertArrayEquals(new byte[]{1}, read.get(0));
        assertArrayEquals(new byte[]{2}, read.get(1));
        assertTrue(consumer.closed());
        assertEquals("kafka-1:9092", consumerConfigs.get(0).getProperty(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG));
    }

    @Test
    public void cursorOnEmptyPartitionIsEmpty() {
        // Given
        consumer.updateEndOffsets(Collections.singletonMap(ORDERS, 0L));

        // When
        final LogCursor cursor = transport.cursor(LEADER, "orders", 0, 0L, new Properties());

        // Then
        assertFalse(cursor.hasNext());
    }

    @Test(expected = TransportException.class)
    public void cursorGivesUpWhenRecordsDoNotArrive() {
        // Given
        consumer.updateEndOffsets(Collections.singletonMap(ORDERS, 2L));
        final LogCursor cursor = transport.cursor(LEADER, "orders", 0, 0L, new Properties());

        // When
        cursor.hasNext();
    }
}
