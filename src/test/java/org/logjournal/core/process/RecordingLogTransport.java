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
import org.logjournal.core.LogCursor;
import org.logjournal.core.LogProducer;
import org.logjournal.core.LogTransport;
import org.logjournal.core.MetadataClient;
import org.logjournal.core.TransportException;
import org.logjournal.core.support.InMemoryLogTransport;

import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * In-memory log that records the producer lifecycle and can fail or hold back appends.
 *
 * @author LogJournal contributors
 */
class RecordingLogTransport implements LogTransport, MetadataClient {
    private final InMemoryLogTransport delegate = new InMemoryLogTransport();
    private volatile Predicate<String> failingTopics = topic -> false;
    private volatile CountDownLatch gate = new CountDownLatch(0);
    private volatile boolean failingMetadata;
    private final List<String> lifecycle = new CopyOnWriteArrayList<>();

    @Override
    public LogCursor cursor(
            final BrokerEndpoint leader,
            final String topic,
            final int partition,
            final long offset,
            final Properties config) {

        return delegate.cursor(leader, topic, partition, offset, config);
    }

    InMemoryLogTransport delegate() {
        return delegate;
    }

    /**
     * Appends to the matching topics fail.
     */
    void failAppends(final Predicate<String> failingTopics) {
        this.failingTopics = failingTopics;
    }

    /**
     * Leader lookups fail while set.
     */
    void failMetadata(final boolean failingMetadata) {
        this.failingMetadata = failingMetadata;
    }

    /**
     * Appends block until the returned latch is released.
     */
    CountDownLatch holdAppends() {
        gate = new CountDownLatch(1);
        return gate;
    }

    @Override
    public Optional<BrokerEndpoint> leaderFor(final String topic, final List<BrokerEndpoint> knownBrokers) {
        if (failingMetadata) {
            throw new TransportException("Leader lookup failed for " + topic);
        }
        return delegate.leaderFor(topic, knownBrokers);
    }

    /**
     * Producer opens and closes as {@code open:<bootstrap.servers>} and {@code close:<bootstrap.servers>}.
     */
    List<String> lifecycle() {
        return lifecycle;
    }

    @Override
    public long offsetFor(final String host, final int port, final String topic, final int partition) {
        return delegate.offsetFor(host, port, topic, partition);
    }

    @Override
    public LogProducer producer(final Properties config) {
        final String servers = config.getProperty(JournalHelper.BOOTSTRAP_SERVERS, "none");
        final LogProducer producer = delegate.producer(config);
        lifecycle.add("open:" + servers);

        return new LogProducer() {
            @Override
            public long append(final String topic, final String key, final byte[] payload) {
                try {
                    if (!gate.await(10, TimeUnit.SECONDS)) {
                        throw new TransportException("Append was held back too long");
                    }
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TransportException("Interrupted", e);
                }
                if (failingTopics.test(topic)) {
                    throw new TransportException("Append failed for " + topic);
                }
                lifecycle.add("append:" + servers);
                return producer.append(topic, key, payload);
            }

            @Override
            public void close() {
                lifecycle.add("close:" + servers);
                producer.close();
            }
        };
    }
}
