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


package org.logjournal.core.support;

import org.logjournal.core.BrokerEndpoint;
import org.logjournal.core.LogCursor;
import org.logjournal.core.LogProducer;
import org.logjournal.core.LogTransport;
import org.logjournal.core.MetadataClient;
import org.logjournal.core.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * A simple in-memory log with single-partition topics. It acts both as the transport and as the metadata client, the local
 * endpoint is the leader of every topic that has been written to. This log is not durable and is mainly intended for testing.
 *
 * @author LogJournal contributors
 */
public class InMemoryLogTransport implements LogTransport, MetadataClient {
    public static final BrokerEndpoint LOCAL_ENDPOINT = new BrokerEndpoint("localhost", 9092);
    private static final int PARTITION = 0;

    private static final class Entry {
        private final String key;
        private final byte[] payload;

        private Entry(final String key, final byte[] payload) {
            this.key = key;
            this.payload = payload;
        }
    }

    private final Logger log = LoggerFactory.getLogger(getClass());
    private final ConcurrentMap<String, List<Entry>> topics = new ConcurrentHashMap<>();

    @Override
    public LogCursor cursor(
            final BrokerEndpoint leader,
            final String topic,
            final int partition,
            final long offset,
            final Properties config) {

        final List<Entry> entries = partition == PARTITION ? topics.get(topic) : null;
        return new InMemoryCursor(entries == null ? Collections.emptyList() : entries, offset);
    }

    /**
     * The keys of all records in the topic, in append order.
     */
    public List<String> keys(final String topic) {
        return snapshot(topic).stream().map(entry -> entry.key).collect(Collectors.toList());
    }

    @Override
    public Optional<BrokerEndpoint> leaderFor(final String topic, final List<BrokerEndpoint> knownBrokers) {
        return topics.containsKey(topic) ? Optional.of(LOCAL_ENDPOINT) : Optional.empty();
    }

    @Override
    public long offsetFor(final String host, final int port, final String topic, final int partition) {
        final List<Entry> entries = partition == PARTITION ? topics.get(topic) : null;
        if (entries == null) {
            return 0L;
        }
        synchronized (entries) {
            return entries.size();
        }
    }

    /**
     * The payloads of all records in the topic, in append order.
     */
    public List<byte[]> payloads(final String topic) {
        return snapshot(topic).stream().map(entry -> entry.payload).collect(Collectors.toList());
    }

    @Override
    public LogProducer producer(final Properties config) {
        return new InMemoryProducer();
    }

    /**
     * The names of all topics that have been written to.
     */
    public List<String> topics() {
        return new ArrayList<>(topics.keySet());
    }

    private long append(final String topic, final String key, final byte[] payload) {
        final List<Entry> entries = topics.computeIfAbsent(topic, name -> new ArrayList<>());
        synchronized (entries) {
            entries.add(new Entry(key, payload));
            log.trace("Appended record [topic={}, offset={}]", topic, entries.size() - 1);
            return entries.size() - 1L;
        }
    }

    private List<Entry> snapshot(final String topic) {
        final List<Entry> entries = topics.get(topic);
        if (entries == null) {
            return Collections.emptyList();
        }
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }

    private static final class InMemoryCursor implements LogCursor {
        private final long end;
        private final List<Entry> entries;
        private long position;

        private InMemoryCursor(final List<Entry> entries, final long offset) {
            this.entries = entries;
            synchronized (entries) {
                this.end = entries.size();
            }
            this.position = Math.max(0L, offset);
        }

        @Override
        public void close() {
            position = end;
        }

        @Override
        public boolean hasNext() {
            return position < end;
        }

        @Override
        public byte[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            synchronized (entries) {
                return entries.get((int) position++).payload;
            }
        }
    }

    private final class InMemoryProducer implements LogProducer {
        private volatile boolean closed;

        @Override
        public long append(final String topic, final String key, final byte[] payload) {
            if (closed) {
                throw new TransportException("Producer is closed");
            }
            return InMemoryLogTransport.this.append(topic, key, payload);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
