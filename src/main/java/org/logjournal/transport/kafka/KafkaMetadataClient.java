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

import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.TopicPartitionInfo;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.logjournal.core.BrokerEndpoint;
import org.logjournal.core.MetadataClient;
import org.logjournal.core.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves partition leaders via the Kafka admin client and high-water offsets via a short-lived consumer connected to the
 * leader. The admin client is kept open and replaced when it is asked to use a different set of brokers; a replaced client
 * is closed after the lookups still running on it have finished.
 *
 * @author LogJournal contributors
 */
public class KafkaMetadataClient implements MetadataClient, AutoCloseable {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    /**
     * An admin client together with the lookups currently using it. A retired handle is closed once its last user is done.
     */
    private static final class AdminHandle {
        private final Admin admin;
        private final List<BrokerEndpoint> brokers;
        private boolean retired;
        private int users;

        private AdminHandle(final List<BrokerEndpoint> brokers, final Admin admin) {
            this.brokers = brokers;
            this.admin = admin;
        }
    }

    private AdminHandle adminHandle;
    private final Function<Properties, Admin> adminFactory;
    private final Properties config;
    private final Function<Properties, Consumer<String, byte[]>> consumerFactory;
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final int partition;
    private final Duration timeout;

    public KafkaMetadataClient(final int partition, final Properties config) {
        this(
                partition,
                config,
                Admin::create,
                consumerConfig -> new KafkaConsumer<>(consumerConfig, new StringDeserializer(), new ByteArrayDeserializer()),
                DEFAULT_TIMEOUT);
    }

    public KafkaMetadataClient(
            final int partition,
            final Properties config,
            final Function<Properties, Admin> adminFactory,
            final Function<Properties, Consumer<String, byte[]>> consumerFactory,
            final Duration timeout) {

        this.partition = partition;
        this.config = new Properties();
        if (config != null) {
            this.config.putAll(config);
        }
        this.adminFactory = adminFactory;
        this.consumerFactory = consumerFactory;
        this.timeout = timeout;
    }

    @Override
    public void close() {
        final AdminHandle unused;
        synchronized (this) {
            unused = retireCurrent();
        }
        closeAdmin(unused);
    }

    @Override
    public Optional<BrokerEndpoint> leaderFor(final String topic, final List<BrokerEndpoint> knownBrokers) {
        AdminHandle handle = null;
        try {
            handle = acquire(knownBrokers);
            final TopicDescription description = handle.admin.describeTopics(Collections.singletonList(topic))
                    .allTopicNames()
                    .get()
                    .get(topic);

            return description.partitions().stream()
                    .filter(info -> info.partition() == partition)
                    .map(TopicPartitionInfo::leader)
                    .filter(leader -> leader != null && !leader.isEmpty())
                    .findFirst()
                    .map(this::endpoint);
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof UnknownTopicOrPartitionException) {
                log.debug("Topic does not exist [topic={}]", topic);
                return Optional.empty();
            }
            throw new TransportException("Unable to find leader for topic " + topic, e.getCause());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while finding leader for topic " + topic, e);
        } catch (final KafkaException e) {
            throw new TransportException("Unable to find leader for topic " + topic, e);
        } finally {
            if (handle != null) {
                release(handle);
            }
        }
    }

    @Override
    public long offsetFor(final String host, final int port, final String topic, final int partition) {
        final TopicPartition topicPartition = new TopicPartition(topic, partition);
        try (Consumer<String, byte[]> consumer = consumerFactory.apply(
                KafkaLogTransport.consumerConfig(config, new BrokerEndpoint(host, port)))) {

            final Long offset = consumer.endOffsets(Collections.singletonList(topicPartition), timeout).get(topicPartition);
            return offset == null ? 0L : offset;
        } catch (final KafkaException e) {
            throw new TransportException("Unable to find offset for " + topicPartition, e);
        }
    }

    /**
     * The admin client for the given brokers, registered as in use until it is released.
     */
    private AdminHandle acquire(final List<BrokerEndpoint> brokers) {
        final AdminHandle acquired;
        final AdminHandle unused;
        synchronized (this) {
            if (adminHandle != null && adminHandle.brokers.equals(brokers)) {
                adminHandle.users++;
                return adminHandle;
            }

            final Properties adminConfig = new Properties();
            adminConfig.putAll(config);
            adminConfig.setProperty(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG,
                    brokers.stream().map(BrokerEndpoint::toString).collect(Collectors.joining(",")));
            log.debug("Creating admin client [brokers={}]", brokers);
            acquired = new AdminHandle(List.copyOf(brokers), adminFactory.apply(adminConfig));
            acquired.users++;

            unused = retireCurrent();
            adminHandle = acquired;
        }
        closeAdmin(unused);
        return acquired;
    }

    private void closeAdmin(final AdminHandle handle) {
        if (handle != null) {
            log.debug("Closing admin client [brokers={}]", handle.brokers);
            handle.admin.close(timeout);
        }
    }

    private void release(final AdminHandle handle) {
        final boolean unused;
        synchronized (this) {
            handle.users--;
            unused = handle.retired && handle.users == 0;
        }
        if (unused) {
            closeAdmin(handle);
        }
    }

    /**
     * Retires the current handle. Must be called holding the lock.
     *
     * @return The retired handle if nothing uses it anymore and it can be closed right away, otherwise {@code null}.
     */
    private AdminHandle retireCurrent() {
        final AdminHandle current = adminHandle;
        adminHandle = null;
        if (current == null) {
            return null;
        }

        current.retired = true;
        return current.users == 0 ? current : null;
    }

    private BrokerEndpoint endpoint(final Node node) {
        return new BrokerEndpoint(node.host(), node.port());
    }
}
