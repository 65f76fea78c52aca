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

import com.hazelcast.config.Config;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import org.logjournal.cluster.hazelcast.HazelcastBrokerDirectory;
import org.logjournal.core.process.JournalCoordinator;
import org.logjournal.core.process.JournalSettings;
import org.logjournal.core.support.EventTopicMappers;
import org.logjournal.core.support.InMemoryLogTransport;
import org.logjournal.core.support.ObjectStreamSerializer;
import org.logjournal.core.support.StaticBrokerDirectory;
import org.logjournal.transport.kafka.KafkaLogTransport;
import org.logjournal.transport.kafka.KafkaMetadataClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Setup of the journal is done via this class. The builder design pattern is used and all the relevant settings can be
 * changed/overridden.
 *
 * <p>The following components can be specified:
 *
 * <strong>Brokers</strong>: Where the log brokers are found, either a fixed list of brokers or a {@link BrokerDirectory}
 * that reports topology changes. If nothing is specified a Hazelcast member is started and the brokers are read from the
 * distributed set {@link HazelcastBrokerDirectory#DEFAULT_NAME}.
 *
 * <strong>Log</strong>: The {@link LogTransport} used for appends and replays and the {@link MetadataClient} used to find
 * partition leaders and offsets. The default is Apache Kafka.
 *
 * <strong>Write concurrency</strong>: The number of writer shards, the default is {@link #DEFAULT_WRITE_CONCURRENCY}.
 *
 * <strong>Events</strong>: Written records are also republished as events, the {@link EventTopicMapper} decides the
 * destination topics and the {@link EventFilter} which events are republished at all.
 *
 * <strong>Executor service</strong>: The thread pool running replays and sequence number queries. If no thread pool is
 * defined a default fixed-size thread pool is created. </p>
 *
 * To initialize a journal against a fixed Kafka cluster and write a record the following code can be used:
 * <pre>
 *     LogJournal journal = LogJournalBuilder.builder()
 *         .brokers(BrokerEndpoint.parse("localhost:9092"))
 *         .build()
 *         .start();
 *
 *     journal.write(List.of(AtomicWrite.of(new DefaultJournalRecord("order-1", 1L, payload))));
 * </pre>
 *
 * The same settings can be read from a properties file on the classpath:
 * <pre>
 *     journal.brokers=kafka-1:9092,kafka-2:9092
 *     journal.write-concurrency=4
 *     journal.producer.acks=all
 * </pre>
 *
 * @author LogJournal contributors
 */
public final class LogJournalBuilder {
    public static final String CONFIG_PREFIX = "journal.";
    public static final int DEFAULT_EXECUTOR_THREADS = 4;
    public static final int DEFAULT_PARTITION = 0;
    public static final int DEFAULT_WRITE_CONCURRENCY = 2;
    private WriteAcknowledgement acknowledgement;
    private BrokerDirectory brokerDirectory;
    private final Properties consumerConfig = new Properties();
    private EventFilter eventFilter;
    private final Properties eventProducerConfig = new Properties();
    private EventSerializer eventSerializer;
    private EventTopicMapper eventTopicMapper;
    private ExecutorService executorService;
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private MetadataClient metadataClient;
    private Integer partition;
    private final Properties producerConfig = new Properties();
    private RecordSerializer recordSerializer;
    private LogTransport transport;
    private Integer writeConcurrency;

    /**
     * Creates this builder.
     *
     * @return The builder.
     */
    public static LogJournalBuilder builder() {
        return new LogJournalBuilder();
    }

    private LogJournalBuilder() {
        // empty
    }

    /**
     * Decides when writes are acknowledged, the default is {@link WriteAcknowledgement#DISPATCHED}.
     *
     * @param acknowledgement The acknowledgement mode.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder acknowledgement(final WriteAcknowledgement acknowledgement) {
        this.acknowledgement = acknowledgement;
        return this;
    }

    /**
     * Set the directory the brokers are read from.
     *
     * @param brokerDirectory The broker directory.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder brokerDirectory(final BrokerDirectory brokerDirectory) {
        this.brokerDirectory = brokerDirectory;
        return this;
    }

    /**
     * Use a fixed list of brokers.
     *
     * @param brokers The brokers.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder brokers(final BrokerEndpoint... brokers) {
        return brokerDirectory(new StaticBrokerDirectory(brokers));
    }

    /**
     * Build the journal based on the settings you provided in the earlier steps.
     *
     * @return A journal that has not yet been started.
     */
    public LogJournal build() {
        final int writeConcurrency = writeConcurrency();
        final int partition = partition();
        final LogTransport transport = transport();
        final MetadataClient metadataClient = metadataClient(partition);
        final BrokerDirectory brokerDirectory = brokerDirectory();
        final boolean ownsExecutor = executorService == null;

        final JournalSettings settings = new JournalSettings(
                writeConcurrency,
                partition,
                acknowledgement(),
                producerConfig,
                eventProducerConfig,
                consumerConfig,
                eventTopicMapper(),
                eventFilter(),
                recordSerializer(),
                eventSerializer());

        return new JournalCoordinator(
                settings,
                brokerDirectory,
                metadataClient,
                transport,
                executorService(),
                ownsExecutor);
    }

    /**
     * Applies the settings found in the properties. Recognized keys are {@code journal.brokers} (comma separated list of
     * {@code host:port}), {@code journal.write-concurrency}, {@code journal.partition}, {@code journal.acknowledgement} and the
     * groups {@code journal.producer.*}, {@code journal.event.producer.*} and {@code journal.consumer.*} that are passed on to the
     * log transport with the prefix removed.
     *
     * @param properties The properties.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder configure(final Properties properties) {
        requireNonNull(properties, "Properties must not be null");

        for (final String key : properties.stringPropertyNames()) {
            final String value = properties.getProperty(key).trim();
            if (!key.startsWith(CONFIG_PREFIX)) {
                continue;
            }

            final String name = key.substring(CONFIG_PREFIX.length());
            if (name.startsWith("event.producer.")) {
                eventProducerConfig.setProperty(name.substring("event.producer.".length()), value);
            } else if (name.startsWith("producer.")) {
                producerConfig.setProperty(name.substring("producer.".length()), value);
            } else if (name.startsWith("consumer.")) {
                consumerConfig.setProperty(name.substring("consumer.".length()), value);
            } else {
                switch (name) {
                    case "brokers":
                        brokerDirectory(new StaticBrokerDirectory(parseBrokers(value)));
                        break;
                    case "write-concurrency":
                        writeConcurrency(parseInt(key, value));
                        break;
                    case "partition":
                        partition(parseInt(key, value));
                        break;
                    case "acknowledgement":
                        acknowledgement(parseAcknowledgement(value));
                        break;
                    default:
                        logger.warn("Unknown journal setting ignored [key={}]", key);
                }
            }
        }
        return this;
    }

    /**
     * Applies the settings found in a properties file on the classpath.
     *
     * @param resource The name of the classpath resource.
     * @return The builder to allow further chaining.
     * @see #configure(Properties)
     */
    public LogJournalBuilder configure(final String resource) {
        try (InputStream is = LogJournalBuilder.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalArgumentException("Configuration not found [resource=" + resource + "]");
            }
            final Properties properties = new Properties();
            properties.load(is);
            return configure(properties);
        } catch (final IOException e) {
            throw new IllegalStateException("Unable to read configuration [resource=" + resource + "]", e);
        }
    }

    /**
     * Properties passed to every replay cursor.
     *
     * @param config The consumer configuration.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder consumerConfig(final Properties config) {
        consumerConfig.putAll(requireNonNull(config, "Config must not be null"));
        return this;
    }

    /**
     * Selects the events that are republished. By default every event is republished.
     *
     * @param eventFilter The filter.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder eventFilter(final EventFilter eventFilter) {
        this.eventFilter = eventFilter;
        return this;
    }

    /**
     * Properties passed to the producers that republish events.
     *
     * @param config The producer configuration.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder eventProducerConfig(final Properties config) {
        eventProducerConfig.putAll(requireNonNull(config, "Config must not be null"));
        return this;
    }

    /**
     * The serializer for republished events, the default uses Java object streams.
     *
     * @param eventSerializer The serializer.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder eventSerializer(final EventSerializer eventSerializer) {
        this.eventSerializer = eventSerializer;
        return this;
    }

    /**
     * Decides the destination topics of republished events. The default publishes every event to
     * {@link EventTopicMappers#DEFAULT_EVENT_TOPIC}.
     *
     * @param eventTopicMapper The mapper.
     * @return The builder to allow further chaining.
     * @see EventTopicMappers
     */
    public LogJournalBuilder eventTopicMapper(final EventTopicMapper eventTopicMapper) {
        this.eventTopicMapper = eventTopicMapper;
        return this;
    }

    /**
     * Provide your own thread pool instead of the default. A provided thread pool is not shut down when the journal stops.
     *
     * @param executorService The thread pool.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder executorService(final ExecutorService executorService) {
        this.executorService = executorService;
        return this;
    }

    /**
     * Read the brokers from the default distributed set of the given Hazelcast instance.
     *
     * @param hz The hazelcast instance to use.
     * @return The builder to allow further chaining.
     * @see HazelcastBrokerDirectory
     */
    public LogJournalBuilder hazelcast(final HazelcastInstance hz) {
        return brokerDirectory(new HazelcastBrokerDirectory(hz));
    }

    /**
     * Starts a Hazelcast member with the provided configuration and reads the brokers from its default distributed set. The
     * member is shut down when the journal stops.
     *
     * @param config The hazelcast configuration to use.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder hazelcast(final Config config) {
        return brokerDirectory(new HazelcastBrokerDirectory(
                Hazelcast.newHazelcastInstance(config), HazelcastBrokerDirectory.DEFAULT_NAME, true));
    }

    /**
     * Use a log that is both the transport and the metadata client, e.g. {@link InMemoryLogTransport} or
     * {@link org.logjournal.store.journalio.JournalLogTransport}.
     *
     * @param log The log.
     * @return The builder to allow further chaining.
     */
    public <T extends LogTransport & MetadataClient> LogJournalBuilder log(final T log) {
        this.transport = log;
        this.metadataClient = log;
        return this;
    }

    /**
     * Set the metadata client, the default is a {@link KafkaMetadataClient}.
     *
     * @param metadataClient The metadata client.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder metadataClient(final MetadataClient metadataClient) {
        this.metadataClient = metadataClient;
        return this;
    }

    /**
     * The partition of the journal topics, the default is {@link #DEFAULT_PARTITION}.
     *
     * @param partition The partition.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder partition(final int partition) {
        this.partition = partition;
        return this;
    }

    /**
     * Properties passed to the producers that append journal records.
     *
     * @param config The producer configuration.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder producerConfig(final Properties config) {
        producerConfig.putAll(requireNonNull(config, "Config must not be null"));
        return this;
    }

    /**
     * The serializer for journal records, the default uses Java object streams.
     *
     * @param recordSerializer The serializer.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder recordSerializer(final RecordSerializer recordSerializer) {
        this.recordSerializer = recordSerializer;
        return this;
    }

    /**
     * Set the log transport, the default is a {@link KafkaLogTransport}.
     *
     * @param transport The transport.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder transport(final LogTransport transport) {
        this.transport = transport;
        return this;
    }

    /**
     * Sets the number of writer shards. Every stream is written by exactly one shard.
     *
     * @param writeConcurrency The number of shards.
     * @return The builder to allow further chaining.
     */
    public LogJournalBuilder writeConcurrency(final int writeConcurrency) {
        this.writeConcurrency = writeConcurrency;
        return this;
    }

    private static WriteAcknowledgement parseAcknowledgement(final String value) {
        try {
            return WriteAcknowledgement.valueOf(value.toUpperCase());
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid acknowledgement [value=" + value + "], expected one of "
                    + Arrays.toString(WriteAcknowledgement.values()), e);
        }
    }

    private static List<BrokerEndpoint> parseBrokers(final String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(endpoint -> !endpoint.isEmpty())
                .map(BrokerEndpoint::parse)
                .collect(Collectors.toList());
    }

    private static int parseInt(final String key, final String value) {
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number [key=" + key + ", value=" + value + "]", e);
        }
    }

    private WriteAcknowledgement acknowledgement() {
        return acknowledgement != null ? acknowledgement : WriteAcknowledgement.DISPATCHED;
    }

    private BrokerDirectory brokerDirectory() {
        if (brokerDirectory != null) {
            return brokerDirectory;
        }

        logger.info("No brokers configured, reading them from the default Hazelcast cluster");
        return new HazelcastBrokerDirectory(
                Hazelcast.newHazelcastInstance(new Config()), HazelcastBrokerDirectory.DEFAULT_NAME, true);
    }

    private EventFilter eventFilter() {
        return eventFilter != null ? eventFilter : EventFilter.ACCEPT_ALL;
    }

    private EventSerializer eventSerializer() {
        return eventSerializer != null ? eventSerializer : new ObjectStreamSerializer();
    }

    private EventTopicMapper eventTopicMapper() {
        return eventTopicMapper != null ? eventTopicMapper : EventTopicMappers.defaultMapper();
    }

    private ExecutorService executorService() {
        return executorService != null ? executorService : Executors.newFixedThreadPool(DEFAULT_EXECUTOR_THREADS);
    }

    private MetadataClient metadataClient(final int partition) {
        return metadataClient != null ? metadataClient : new KafkaMetadataClient(partition, consumerConfig);
    }

    private int partition() {
        final int value = partition != null ? partition : DEFAULT_PARTITION;
        if (value < 0) {
            throw new IllegalArgumentException("Partition must not be negative [partition=" + value + "]");
        }
        return value;
    }

    private RecordSerializer recordSerializer() {
        return recordSerializer != null ? recordSerializer : new ObjectStreamSerializer();
    }

    private LogTransport transport() {
        if (transport == null) {
            return new KafkaLogTransport();
        }
        if (transport instanceof InMemoryLogTransport) {
            logger.warn("The in-memory log is being used. " +
                    "This is a non-durable log so records disappear when the instance is rebooted. " +
                    "It is strongly recommended that you use a durable log.");
        }
        return transport;
    }

    private int writeConcurrency() {
        final int value = writeConcurrency != null ? writeConcurrency : DEFAULT_WRITE_CONCURRENCY;
        if (value <= 0) {
            throw new IllegalArgumentException("Write concurrency must be positive [writeConcurrency=" + value + "]");
        }
        return value;
    }
}
