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

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.logjournal.core.BrokerEndpoint;
import org.logjournal.core.LogCursor;
import org.logjournal.core.LogProducer;
import org.logjournal.core.LogTransport;
import org.logjournal.core.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.NoSuchElementException;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Log transport on top of the Apache Kafka clients. Appends are synchronous: every record is sent and the call blocks until
 * the broker has acknowledged it. Cursors assign themselves to a single partition without joining a consumer group.
 *
 * @author LogJournal contributors
 */
public class KafkaLogTransport implements LogTransport {
    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);
    public static final int DEFAULT_MAX_EMPTY_POLLS = 20;
    private final Function<Properties, Consumer<String, byte[]>> consumerFactory;
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final int maxEmptyPolls;
    private final Duration pollTimeout;
    private final Function<Properties, Producer<String, byte[]>> producerFactory;

    public KafkaLogTransport() {
        this(
                config -> new KafkaProducer<>(config, new StringSerializer(), new ByteArraySerializer()),
                config -> new KafkaConsumer<>(config, new StringDeserializer(), new ByteArrayDeserializer()),
                DEFAULT_POLL_TIMEOUT,
                DEFAULT_MAX_EMPTY_POLLS);
    }

    public KafkaLogTransport(
            final Function<Properties, Producer<String, byte[]>> producerFactory,
            final Function<Properties, Consumer<String, byte[]>> consumerFactory,
            final Duration pollTimeout,
            final int maxEmptyPolls) {

        this.producerFactory = producerFactory;
        this.consumerFactory = consumerFactory;
        this.pollTimeout = pollTimeout;
        this.maxEmptyPolls = maxEmptyPolls;
    }

    /**
     * Consumer configuration for reading a single partition: no consumer group, no offset commits.
     */
    static Properties consumerConfig(final Properties base, final BrokerEndpoint endpoint) {
        final Properties config = new Properties();
        if (base != null) {
            config.putAll(base);
        }
        if (!config.containsKey(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG)) {
            config.setProperty(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, endpoint.toString());
        }
        config.setProperty(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        config.remove(ConsumerConfig.GROUP_ID_CONFIG);
        return config;
    }

    @Override
    public LogCursor cursor(
            final BrokerEndpoint leader,
            final String topic,
            final int partition,
            final long offset,
            final Properties config) {

        final TopicPartition topicPartition = new TopicPartition(topic, partition);
        final Consumer<String, byte[]> consumer = consumerFactory.apply(consumerConfig(config, leader));
        try {
            consumer.assign(Collections.singletonList(topicPartition));
            final Long end = consumer.endOffsets(Collections.singletonList(topicPartition)).get(topicPartition);
            consumer.seek(topicPartition, Math.max(0L, offset));
            log.debug("Opened cursor [topic={}, partition={}, offset={}, end={}]", topic, partition, offset, end);
            return new KafkaCursor(consumer, topicPartition, Math.max(0L, offset), end == null ? 0L : end);
        } catch (final KafkaException e) {
            consumer.close();
            throw new TransportException("Unable to open cursor for " + topicPartition, e);
        }
    }

    @Override
    public LogProducer producer(final Properties config) {
        final Producer<String, byte[]> producer = producerFactory.apply(config);
        return new KafkaLogProducer(producer);
    }

    private static final class KafkaLogProducer implements LogProducer {
        private final Producer<String, byte[]> producer;

        private KafkaLogProducer(final Producer<String, byte[]> producer) {
            this.producer = producer;
        }

        @Override
        public long append(final String topic, final String key, final byte[] payload) {
            try {
                return producer.send(new ProducerRecord<>(topic, key, payload)).get().offset();
            } catch (final ExecutionException e) {
                throw new TransportException("Unable to append record to topic " + topic, e.getCause());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("Interrupted while appending record to topic " + topic, e);
            } catch (final KafkaException | IllegalStateException e) {
                throw new TransportException("Unable to append record to topic " + topic, e);
            }
        }

        @Override
        public void close() {
            producer.close();
        }
    }

    /**
     * Pulls records batch by batch until the end offset observed when the cursor was opened has been reached.
     */
    private final class KafkaCursor implements LogCursor {
        private final Deque<ConsumerRecord<String, byte[]>> buffer = new ArrayDeque<>();
        private boolean closed;
        private final Consumer<String, byte[]> consumer;
        private final long end;
        private long nextOffset;
        private final TopicPartition topicPartition;

        private KafkaCursor(
                final Consumer<String, byte[]> consumer,
                final TopicPartition topicPartition,
                final long offset,
                final long end) {

            this.consumer = consumer;
            this.topicPartition = topicPartition;
            this.nextOffset = offset;
            this.end = end;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                buffer.clear();
                consumer.close();
            }
        }

        @Override
        public boolean hasNext() {
            if (closed) {
                return false;
            }

            int emptyPolls = 0;
            while (buffer.isEmpty() && nextOffset < end) {
                final int fetched = fetch();
                if (fetched == 0 && ++emptyPolls >= maxEmptyPolls) {
                    throw new TransportException(String.format(
                            "No records received from %s [offset=%d, end=%d, polls=%d]",
                            topicPartition, nextOffset, end, emptyPolls));
                }
            }

            if (buffer.isEmpty()) {
                close();
                return false;
            }
            return true;
        }

        @Override
        public byte[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll().value();
        }

        private int fetch() {
            try {
                int fetched = 0;
                for (final ConsumerRecord<String, byte[]> record : consumer.poll(pollTimeout).records(topicPartition)) {
                    if (record.offset() >= nextOffset && record.offset() < end) {
                        buffer.add(record);
                        nextOffset = record.offset() + 1;
                        fetched++;
                    }
                }

                // Skips offsets that carry no records, e.g. transaction markers
                nextOffset = Math.max(nextOffset, consumer.position(topicPartition));
                return fetched;
            } catch (final KafkaException e) {
                throw new TransportException("Unable to read from " + topicPartition, e);
            }
        }
    }
}
