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

import org.logjournal.core.AtomicWrite;
import org.logjournal.core.BrokerDirectory;
import org.logjournal.core.BrokerEndpoint;
import org.logjournal.core.BrokersListener;
import org.logjournal.core.JournalRecord;
import org.logjournal.core.LogJournal;
import org.logjournal.core.LogTransport;
import org.logjournal.core.MetadataClient;
import org.logjournal.core.WriteAcknowledgement;
import org.logjournal.core.WriteResult;
import org.logjournal.core.support.Closeables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.runAsync;
import static java.util.concurrent.CompletableFuture.supplyAsync;
import static org.logjournal.core.support.JournalTopics.journalTopic;

/**
 * The implementation of the journal that "connects" all the various components: writes are grouped per stream and routed to
 * the writer shards, queries are answered via the metadata client and the replay engine, and topology changes reported by the
 * broker directory are pushed to every shard. This instance should NOT be instantiated directly but rather via the
 * {@link org.logjournal.core.LogJournalBuilder} class.
 *
 * @author LogJournal contributors
 */
public class JournalCoordinator implements LogJournal, BrokersListener {
    private volatile List<BrokerEndpoint> brokers = Collections.emptyList();
    private final Deletions deletions = new Deletions();
    private final BrokerDirectory directory;
    private ShardPool<EventWriterShard> eventWriters;
    private final ExecutorService executorService;
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final MetadataClient metadataClient;
    private List<BrokerEndpoint> pendingBrokers;
    private final ReplayEngine replayEngine;
    private final JournalSettings settings;
    private final boolean shutdownExecutorOnStop;
    private volatile boolean started;
    private final LogTransport transport;
    private ShardPool<JournalWriterShard> writers;

    public JournalCoordinator(
            final JournalSettings settings,
            final BrokerDirectory directory,
            final MetadataClient metadataClient,
            final LogTransport transport,
            final ExecutorService executorService,
            final boolean shutdownExecutorOnStop) {

        this.settings = requireNonNull(settings, "Settings must not be null");
        this.directory = requireNonNull(directory, "Broker directory must not be null");
        this.metadataClient = requireNonNull(metadataClient, "Metadata client must not be null");
        this.transport = requireNonNull(transport, "Transport must not be null");
        this.executorService = requireNonNull(executorService, "Executor service must not be null");
        this.shutdownExecutorOnStop = shutdownExecutorOnStop;
        this.replayEngine = new ReplayEngine(
                metadataClient, transport, settings.recordSerializer(), settings.partition(), settings.consumerConfig());
    }

    /**
     * Installs a new writer configuration on every shard if the brokers differ from the current ones. Writes already queued on a
     * shard complete under the configuration that was active when they were queued. An update that arrives while the journal is
     * starting is kept and applied once the shards exist.
     */
    @Override
    public synchronized void brokersUpdated(final List<BrokerEndpoint> newBrokers) {
        if (!started) {
            pendingBrokers = List.copyOf(newBrokers);
            return;
        }
        if (newBrokers.equals(brokers)) {
            log.debug("Brokers unchanged, ignoring update [brokers={}]", newBrokers);
            return;
        }

        log.info("Broker topology changed [old={}, new={}]", brokers, newBrokers);
        brokers = List.copyOf(newBrokers);
        final WriterConfig config = settings.writerConfig(brokers);
        writers.updateConfig(config);
        eventWriters.updateConfig(config);
    }

    /**
     * The brokers currently in use.
     */
    public List<BrokerEndpoint> brokers() {
        return brokers;
    }

    @Override
    public void deleteTo(final String streamId, final long toSequenceNr) {
        deleteTo(streamId, toSequenceNr, false);
    }

    @Override
    public void deleteTo(final String streamId, final long toSequenceNr, final boolean permanent) {
        requireNonNull(streamId, "Stream id must not be null");
        deletions.deleteTo(streamId, toSequenceNr, permanent);
    }

    @Override
    public CompletableFuture<Long> highestSequenceNr(final String streamId, final long fromSequenceNr) {
        requireNonNull(streamId, "Stream id must not be null");
        return supplyAsync(() -> readHighestSequenceNr(streamId, fromSequenceNr), executorService);
    }

    /**
     * Synchronous version of {@link #highestSequenceNr(String, long)}.
     *
     * @throws org.logjournal.core.TransportException If the leader or the offset could not be resolved.
     */
    public long readHighestSequenceNr(final String streamId, final long fromSequenceNr) {
        final String topic = journalTopic(streamId);
        final Optional<BrokerEndpoint> leader = metadataClient.leaderFor(topic, brokers);
        if (!leader.isPresent()) {
            log.debug("Stream has not been written [streamId={}]", streamId);
            return fromSequenceNr;
        }

        final BrokerEndpoint endpoint = leader.get();
        return metadataClient.offsetFor(endpoint.host(), endpoint.port(), topic, settings.partition());
    }

    @Override
    public CompletableFuture<Void> replay(
            final String streamId,
            final long fromSequenceNr,
            final long toSequenceNr,
            final long max,
            final Consumer<JournalRecord> callback) {

        requireNonNull(streamId, "Stream id must not be null");
        requireNonNull(callback, "Callback must not be null");

        // The marker and the brokers are captured when the replay is requested
        final DeletionMarker deletion = deletions.markerFor(streamId);
        final List<BrokerEndpoint> currentBrokers = brokers;
        return runAsync(
                () -> replayEngine.replay(streamId, fromSequenceNr, toSequenceNr, max, deletion, currentBrokers, callback),
                executorService);
    }

    /**
     * The index of the shard that writes the given stream.
     */
    public int shardIndexFor(final String streamId) {
        return JournalHelper.shardIndex(streamId, settings.writeConcurrency());
    }

    @Override
    public synchronized LogJournal start() {
        if (started) {
            return this;
        }

        // Subscribe before the snapshot is taken so no update falls in between
        directory.addListener(this);
        try {
            brokers = List.copyOf(directory.start());
        } catch (RuntimeException e) {
            directory.removeListener(this);
            pendingBrokers = null;
            throw e;
        }

        final WriterConfig config = settings.writerConfig(brokers);
        writers = new ShardPool<>(settings.writeConcurrency(), index -> new JournalWriterShard(index, transport, config));
        eventWriters = new ShardPool<>(settings.writeConcurrency(), index -> new EventWriterShard(index, transport, config));
        started = true;

        log.info("Journal started [brokers={}, writeConcurrency={}, acknowledgement={}]",
                brokers, settings.writeConcurrency(), settings.acknowledgement());

        final List<BrokerEndpoint> pending = pendingBrokers;
        pendingBrokers = null;
        if (pending != null) {
            brokersUpdated(pending);
        }
        return this;
    }

    @Override
    public synchronized void stop() {
        if (!started) {
            return;
        }

        started = false;
        directory.removeListener(this);
        Closeables.closeSilently(directory, writers, eventWriters);
        close(metadataClient);
        if (transport != metadataClient) {
            close(transport);
        }
        if (shutdownExecutorOnStop) {
            executorService.shutdown();
        }
        log.info("Journal stopped");
    }

    @Override
    public CompletableFuture<List<WriteResult>> write(final List<AtomicWrite> writes) {
        requireNonNull(writes, "Writes must not be null");
        if (!started) {
            return CompletableFuture.failedFuture(new IllegalStateException("Journal is not started"));
        }

        final Map<String, List<Integer>> writesPerStream = groupByStream(writes);
        final List<CompletableFuture<Void>> persisted = new ArrayList<>(writesPerStream.size());
        final WriteResult[] results = new WriteResult[writes.size()];

        writesPerStream.forEach((streamId, indices) -> {
            final List<JournalRecord> records = new ArrayList<>();
            indices.forEach(index -> records.addAll(writes.get(index).records()));
            log.debug("Dispatching writes [streamId={}, records={}, shard={}]", streamId, records.size(), shardIndexFor(streamId));

            final CompletableFuture<List<WriteResult>> journalWrite = writers.shardFor(streamId).write(records);
            eventWriters.shardFor(streamId).write(records).whenComplete((eventResults, thr) -> {
                if (thr != null) {
                    log.error("Event republication failed [streamId={}]", streamId, thr);
                }
            });

            if (settings.acknowledgement() == WriteAcknowledgement.PERSISTED) {
                persisted.add(journalWrite.handle((recordResults, thr) -> {
                    fillResults(results, writes, indices, recordResults, thr);
                    return null;
                }));
            } else {
                journalWrite.whenComplete((recordResults, thr) -> {
                    if (thr != null) {
                        log.error("Journal write failed [streamId={}]", streamId, thr);
                    }
                });
                indices.forEach(index -> results[index] = WriteResult.success());
            }
        });

        return CompletableFuture.allOf(persisted.toArray(new CompletableFuture[0]))
                .thenApply(done -> List.of(results));
    }

    private void close(final Object closeable) {
        if (closeable instanceof AutoCloseable) {
            Closeables.closeSilently((AutoCloseable) closeable);
        }
    }

    /**
     * Maps the per-record results of a stream back onto the atomic writes the records came from. An atomic write fails with the
     * first failure among its records.
     */
    private void fillResults(
            final WriteResult[] results,
            final List<AtomicWrite> writes,
            final List<Integer> indices,
            final List<WriteResult> recordResults,
            final Throwable thr) {

        int offset = 0;
        for (final int index : indices) {
            final int size = writes.get(index).size();
            if (thr != null) {
                results[index] = WriteResult.failure(thr);
            } else {
                results[index] = recordResults.subList(offset, offset + size).stream()
                        .filter(result -> !result.isSuccess())
                        .findFirst()
                        .orElse(WriteResult.success());
            }
            offset += size;
        }
    }

    private Map<String, List<Integer>> groupByStream(final List<AtomicWrite> writes) {
        final Map<String, List<Integer>> writesPerStream = new LinkedHashMap<>();
        for (int i = 0; i < writes.size(); i++) {
            writesPerStream.computeIfAbsent(writes.get(i).streamId(), streamId -> new ArrayList<>()).add(i);
        }
        return writesPerStream;
    }
}
