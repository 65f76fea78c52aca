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

import org.logjournal.core.JournalRecord;
import org.logjournal.core.LogProducer;
import org.logjournal.core.LogTransport;
import org.logjournal.core.TransportException;
import org.logjournal.core.WriteResult;
import org.logjournal.core.lifecycle.Stoppable;
import org.logjournal.core.support.Closeables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static java.util.concurrent.CompletableFuture.runAsync;
import static java.util.concurrent.CompletableFuture.supplyAsync;

/**
 * A writer shard owns one producer handle and applies its work strictly in arrival order on a single thread. The queue of the
 * single-threaded executor is the mailbox of the shard: writes and configuration updates are executed one at a time, so a
 * configuration update waits for the writes queued before it and writes queued after it wait for the update.
 *
 * @author LogJournal contributors
 */
abstract class AbstractWriterShard implements Stoppable {
    private static final long STOP_TIMEOUT_SECONDS = 30;
    protected final Logger log = LoggerFactory.getLogger(getClass());
    private WriterConfig config;
    private final ExecutorService executor;
    private final int index;
    private LogProducer producer;
    private final LogTransport transport;

    AbstractWriterShard(final String name, final int index, final LogTransport transport, final WriterConfig config) {
        this.index = index;
        this.transport = transport;
        this.config = config;
        this.producer = openProducer(transport, config);
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            final Thread thread = new Thread(runnable, name + "-" + index);
            thread.setDaemon(true);
            return thread;
        });
    }

    int index() {
        return index;
    }

    @Override
    public void stop() {
        try {
            runAsync(this::closeProducer, executor);
        } catch (final RejectedExecutionException e) {
            log.debug("Shard already stopped [index={}]", index);
            return;
        }

        executor.shutdown();
        try {
            if (!executor.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.error("Shard did not stop in time [index={}, timeout={}s]", index, STOP_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while stopping shard " + index, e);
        }
    }

    /**
     * Queues a configuration update. The current producer is closed (blocking until it is flushed) before a producer for the new
     * configuration is opened.
     *
     * @return A future that completes when the new configuration is in use.
     */
    CompletableFuture<Void> updateConfig(final WriterConfig newConfig) {
        try {
            return runAsync(() -> swap(newConfig), executor);
        } catch (final RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Shard " + index + " is stopped", e));
        }
    }

    /**
     * Queues a write of the given records.
     *
     * @return A future holding one result per written unit.
     */
    CompletableFuture<List<WriteResult>> write(final List<JournalRecord> records) {
        try {
            return supplyAsync(() -> doWrite(records), executor);
        } catch (final RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Shard " + index + " is stopped", e));
        }
    }

    /**
     * Appends one unit with the current producer.
     */
    protected long append(final String topic, final String key, final byte[] payload) {
        if (producer == null) {
            throw new TransportException("No producer available for shard " + index);
        }
        return producer.append(topic, key, payload);
    }

    /**
     * Creates the producer for the given configuration.
     */
    protected abstract LogProducer createProducer(LogTransport transport, WriterConfig config);

    /**
     * Writes the records, invoked on the shard thread. Implementations must capture the outcome of every unit separately.
     */
    protected abstract List<WriteResult> write(List<JournalRecord> records, WriterConfig config);

    private void closeProducer() {
        if (producer != null) {
            Closeables.closeSilently(producer);
            producer = null;
        }
    }

    private List<WriteResult> doWrite(final List<JournalRecord> records) {
        final List<WriteResult> results = write(records, config);
        results.stream()
                .filter(result -> !result.isSuccess())
                .forEach(result -> log.error("Write failed [index={}]", index, result.cause().orElse(null)));
        return results;
    }

    private LogProducer openProducer(final LogTransport transport, final WriterConfig config) {
        log.debug("Opening producer [index={}, brokers={}]", index, config.brokers());
        return createProducer(transport, config);
    }

    private void swap(final WriterConfig newConfig) {
        log.debug("Updating writer config [index={}, config={}]", index, newConfig);
        closeProducer();
        config = newConfig;
        try {
            producer = openProducer(transport, newConfig);
        } catch (final RuntimeException e) {
            log.error("Unable to open producer, writes fail until the next topology change [index={}]", index, e);
            throw e;
        }
    }
}
