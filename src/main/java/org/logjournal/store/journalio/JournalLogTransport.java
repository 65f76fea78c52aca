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

import journal.io.api.Journal;
import journal.io.api.JournalBuilder;
import journal.io.api.Location;
import org.logjournal.core.BrokerEndpoint;
import org.logjournal.core.LogCursor;
import org.logjournal.core.LogProducer;
import org.logjournal.core.LogTransport;
import org.logjournal.core.MetadataClient;
import org.logjournal.core.TransportException;
import org.logjournal.core.support.JournalTopics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A durable, single node log backed by <a href="https://github.com/sbtourist/Journal.IO/">Journal.IO</a>. Every topic has a
 * single partition stored in its own journal folder below the root folder. The local endpoint is the leader of every topic
 * that exists on disk.
 *
 * @author LogJournal contributors
 */
public class JournalLogTransport implements LogTransport, MetadataClient, AutoCloseable {
    public static final BrokerEndpoint LOCAL_ENDPOINT = new BrokerEndpoint("localhost", 9092);
    private static final int PARTITION = 0;

    /**
     * A topic journal and the number of records it holds, which is also the next offset.
     */
    private static final class TopicLog {
        private final Journal journal;
        private long size;

        private TopicLog(final Journal journal, final long size) {
            this.journal = journal;
            this.size = size;
        }
    }

    private final Logger log = LoggerFactory.getLogger(getClass());
    private final Path root;
    private final ConcurrentMap<String, TopicLog> topics = new ConcurrentHashMap<>();

    public JournalLogTransport(final String path) {
        this.root = writeableFolder(path).toPath();
        log.info("Creating journal log [path={}]", path);
    }

    @Override
    public void close() {
        log.debug("Closing journal log [path={}]", root);
        topics.values().forEach(topicLog -> {
            try {
                synchronized (topicLog) {
                    topicLog.journal.close();
                }
            } catch (final IOException e) {
                log.error("Unable to close journal", e);
            }
        });
        topics.clear();
    }

    @Override
    public LogCursor cursor(
            final BrokerEndpoint leader,
            final String topic,
            final int partition,
            final long offset,
            final Properties config) {

        if (partition != PARTITION || !exists(topic)) {
            return new JournalCursor(null, 0L, 0L);
        }

        final TopicLog topicLog = topicLog(topic);
        final long end;
        synchronized (topicLog) {
            end = topicLog.size;
        }
        return new JournalCursor(topicLog.journal, Math.max(0L, offset), end);
    }

    @Override
    public Optional<BrokerEndpoint> leaderFor(final String topic, final List<BrokerEndpoint> knownBrokers) {
        return exists(topic) ? Optional.of(LOCAL_ENDPOINT) : Optional.empty();
    }

    @Override
    public long offsetFor(final String host, final int port, final String topic, final int partition) {
        if (partition != PARTITION || !exists(topic)) {
            return 0L;
        }

        final TopicLog topicLog = topicLog(topic);
        synchronized (topicLog) {
            return topicLog.size;
        }
    }

    @Override
    public LogProducer producer(final Properties config) {
        return new LogProducer() {
            private volatile boolean closed;

            @Override
            public long append(final String topic, final String key, final byte[] payload) {
                if (closed) {
                    throw new TransportException("Producer is closed");
                }
                return JournalLogTransport.this.append(topic, payload);
            }

            @Override
            public void close() {
                closed = true;
            }
        };
    }

    private long append(final String topic, final byte[] payload) {
        final TopicLog topicLog = topicLog(topic);
        synchronized (topicLog) {
            try {
                topicLog.journal.write(payload, Journal.WriteType.SYNC);
                log.trace("Appended record [topic={}, offset={}]", topic, topicLog.size);
                return topicLog.size++;
            } catch (final IOException e) {
                throw new TransportException("Unable to append record to topic " + topic, e);
            }
        }
    }

    private boolean exists(final String topic) {
        return topics.containsKey(topic) || Files.isDirectory(topicFolder(topic));
    }

    private TopicLog openTopic(final String topic) {
        try {
            final File folder = writeableFolder(topicFolder(topic).toString());
            final Journal journal = JournalBuilder.of(folder).open();

            long size = 0L;
            for (final Location ignored : journal.redo()) {
                size++;
            }
            log.debug("Opened topic journal [topic={}, size={}]", topic, size);
            return new TopicLog(journal, size);
        } catch (final IOException e) {
            throw new TransportException("Unable to open journal for topic " + topic, e);
        }
    }

    private Path topicFolder(final String topic) {
        return root.resolve(JournalTopics.journalTopic(topic) + "-" + PARTITION);
    }

    private TopicLog topicLog(final String topic) {
        return topics.computeIfAbsent(topic, this::openTopic);
    }

    private File writeableFolder(final String folder) {
        final File f = new File(folder);
        f.mkdirs();
        final Path path = f.toPath();

        if (!Files.isDirectory(path) || !Files.isWritable(path)) {
            throw new IllegalStateException(String.format("%s is an invalid path, make sure it is writeable", folder));
        }
        return f;
    }

    /**
     * Walks the journal from the start, skipping everything before the requested offset. Journal.IO locations are not
     * addressable by index.
     */
    private static final class JournalCursor implements LogCursor {
        private final long end;
        private Iterator<Location> locations;
        private long position;

        private JournalCursor(final Journal journal, final long offset, final long end) {
            this.end = end;
            this.position = offset;
            if (journal != null && offset < end) {
                try {
                    this.locations = journal.redo().iterator();
                    for (long skipped = 0; skipped < offset && locations.hasNext(); skipped++) {
                        locations.next();
                    }
                } catch (final IOException e) {
                    throw new TransportException("Unable to open cursor", e);
                }
            }
        }

        @Override
        public void close() {
            locations = null;
        }

        @Override
        public boolean hasNext() {
            return locations != null && position < end && locations.hasNext();
        }

        @Override
        public byte[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            position++;
            return locations.next().getData();
        }
    }
}
