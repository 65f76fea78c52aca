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

import org.logjournal.core.BrokerEndpoint;
import org.logjournal.core.EventFilter;
import org.logjournal.core.EventSerializer;
import org.logjournal.core.EventTopicMapper;
import org.logjournal.core.RecordSerializer;
import org.logjournal.core.WriteAcknowledgement;

import java.util.List;
import java.util.Properties;

import static java.util.Objects.requireNonNull;

/**
 * The static settings of a journal, created once by the builder. The broker dependent parts are derived per topology via
 * {@link #writerConfig(List)}.
 *
 * @author LogJournal contributors
 */
public final class JournalSettings {
    private final WriteAcknowledgement acknowledgement;
    private final Properties consumerConfig;
    private final EventFilter eventFilter;
    private final Properties eventProducerConfig;
    private final EventSerializer eventSerializer;
    private final EventTopicMapper eventTopicMapper;
    private final int partition;
    private final Properties producerConfig;
    private final RecordSerializer recordSerializer;
    private final int writeConcurrency;

    public JournalSettings(
            final int writeConcurrency,
            final int partition,
            final WriteAcknowledgement acknowledgement,
            final Properties producerConfig,
            final Properties eventProducerConfig,
            final Properties consumerConfig,
            final EventTopicMapper eventTopicMapper,
            final EventFilter eventFilter,
            final RecordSerializer recordSerializer,
            final EventSerializer eventSerializer) {

        if (writeConcurrency <= 0) {
            throw new IllegalArgumentException("Write concurrency must be positive [writeConcurrency=" + writeConcurrency + "]");
        }
        if (partition < 0) {
            throw new IllegalArgumentException("Partition must not be negative [partition=" + partition + "]");
        }

        this.writeConcurrency = writeConcurrency;
        this.partition = partition;
        this.acknowledgement = requireNonNull(acknowledgement, "Acknowledgement must not be null");
        this.producerConfig = JournalHelper.copy(producerConfig);
        this.eventProducerConfig = JournalHelper.copy(eventProducerConfig);
        this.consumerConfig = JournalHelper.copy(consumerConfig);
        this.eventTopicMapper = requireNonNull(eventTopicMapper, "Event topic mapper must not be null");
        this.eventFilter = requireNonNull(eventFilter, "Event filter must not be null");
        this.recordSerializer = requireNonNull(recordSerializer, "Record serializer must not be null");
        this.eventSerializer = requireNonNull(eventSerializer, "Event serializer must not be null");
    }

    public WriteAcknowledgement acknowledgement() {
        return acknowledgement;
    }

    /**
     * @return A copy of the consumer configuration used by replay cursors.
     */
    public Properties consumerConfig() {
        return JournalHelper.copy(consumerConfig);
    }

    public int partition() {
        return partition;
    }

    public RecordSerializer recordSerializer() {
        return recordSerializer;
    }

    public int writeConcurrency() {
        return writeConcurrency;
    }

    /**
     * Creates the writer configuration for the given brokers.
     */
    public WriterConfig writerConfig(final List<BrokerEndpoint> brokers) {
        return new WriterConfig(
                brokers,
                JournalHelper.producerConfig(producerConfig, brokers),
                JournalHelper.producerConfig(eventProducerConfig, brokers),
                eventTopicMapper,
                eventFilter,
                recordSerializer,
                eventSerializer);
    }
}
