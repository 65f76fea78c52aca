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

import java.util.List;
import java.util.Properties;

import static java.util.Objects.requireNonNull;

/**
 * Immutable snapshot of everything a writer shard needs. A new snapshot is created whenever the broker topology changes and is
 * handed to every shard, it is never modified in place.
 *
 * @author LogJournal contributors
 */
public final class WriterConfig {
    private final List<BrokerEndpoint> brokers;
    private final EventFilter eventFilter;
    private final Properties eventProducerConfig;
    private final EventSerializer eventSerializer;
    private final EventTopicMapper eventTopicMapper;
    private final Properties journalProducerConfig;
    private final RecordSerializer recordSerializer;

    WriterConfig(
            final List<BrokerEndpoint> brokers,
            final Properties journalProducerConfig,
            final Properties eventProducerConfig,
            final EventTopicMapper eventTopicMapper,
            final EventFilter eventFilter,
            final RecordSerializer recordSerializer,
            final EventSerializer eventSerializer) {

        this.brokers = List.copyOf(brokers);
        this.journalProducerConfig = JournalHelper.copy(journalProducerConfig);
        this.eventProducerConfig = JournalHelper.copy(eventProducerConfig);
        this.eventTopicMapper = requireNonNull(eventTopicMapper, "Event topic mapper must not be null");
        this.eventFilter = requireNonNull(eventFilter, "Event filter must not be null");
        this.recordSerializer = requireNonNull(recordSerializer, "Record serializer must not be null");
        this.eventSerializer = requireNonNull(eventSerializer, "Event serializer must not be null");
    }

    public List<BrokerEndpoint> brokers() {
        return brokers;
    }

    public EventFilter eventFilter() {
        return eventFilter;
    }

    /**
     * @return A copy of the event producer configuration.
     */
    public Properties eventProducerConfig() {
        return JournalHelper.copy(eventProducerConfig);
    }

    public EventSerializer eventSerializer() {
        return eventSerializer;
    }

    public EventTopicMapper eventTopicMapper() {
        return eventTopicMapper;
    }

    /**
     * @return A copy of the journal producer configuration.
     */
    public Properties journalProducerConfig() {
        return JournalHelper.copy(journalProducerConfig);
    }

    public RecordSerializer recordSerializer() {
        return recordSerializer;
    }

    @Override
    public String toString() {
        return "WriterConfig[brokers=" + brokers + "]";
    }
}
