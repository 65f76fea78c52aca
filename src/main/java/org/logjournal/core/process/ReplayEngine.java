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
import org.logjournal.core.JournalRecord;
import org.logjournal.core.LogCursor;
import org.logjournal.core.LogTransport;
import org.logjournal.core.MetadataClient;
import org.logjournal.core.RecordSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Consumer;

import static org.logjournal.core.support.JournalTopics.journalTopic;

/**
 * Reconstructs the records of a stream from its topic. The engine holds no state of its own, every replay reads the topic from
 * the first requested record onwards through a lazy cursor.
 *
 * <p>Sequence numbers map directly onto offsets: the record with sequence number {@code n} is stored at offset
 * {@code n - 1}.</p>
 *
 * @author LogJournal contributors
 */
class ReplayEngine {
    private final Properties consumerConfig;
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final MetadataClient metadataClient;
    private final int partition;
    private final RecordSerializer serializer;
    private final LogTransport transport;

    ReplayEngine(
            final MetadataClient metadataClient,
            final LogTransport transport,
            final RecordSerializer serializer,
            final int partition,
            final Properties consumerConfig) {

        this.metadataClient = metadataClient;
        this.transport = transport;
        this.serializer = serializer;
        this.partition = partition;
        this.consumerConfig = JournalHelper.copy(consumerConfig);
    }

    /**
     * Replays the records of the stream within {@code [fromSequenceNr, toSequenceNr]}, at most {@code max} of them.
     *
     * @return The number of records passed to the callback.
     */
    long replay(
            final String streamId,
            final long fromSequenceNr,
            final long toSequenceNr,
            final long max,
            final DeletionMarker deletion,
            final List<BrokerEndpoint> brokers,
            final Consumer<JournalRecord> callback) {

        final long deletedTo = deletion.toSequenceNr();
        final boolean permanent = deletion.permanent();

        if (permanent && deletedTo == Long.MAX_VALUE) {
            log.debug("Stream is deleted, nothing to replay [streamId={}]", streamId);
            return 0L;
        }

        final long adjustedFrom = permanent ? Math.max(deletedTo + 1L, fromSequenceNr) : fromSequenceNr;
        final long adjustedNum = toSequenceNr - adjustedFrom + 1L;
        final long adjustedTo = max < adjustedNum ? adjustedFrom + max - 1L : toSequenceNr;

        if (max <= 0 || adjustedTo < adjustedFrom) {
            log.debug("Nothing to replay [streamId={}, from={}, to={}, max={}]", streamId, adjustedFrom, adjustedTo, max);
            return 0L;
        }

        final String topic = journalTopic(streamId);
        final Optional<BrokerEndpoint> leader = metadataClient.leaderFor(topic, brokers);
        if (!leader.isPresent()) {
            // The topic is created by the first write
            log.debug("No records to replay, stream has not been written [streamId={}]", streamId);
            return 0L;
        }

        long replayed = 0L;
        try (LogCursor cursor = transport.cursor(
                leader.get(), topic, partition, Math.max(0L, adjustedFrom - 1L), consumerConfig)) {

            while (cursor.hasNext()) {
                JournalRecord record = serializer.deserializeRecord(cursor.next());
                if (!permanent && record.sequenceNr() <= deletedTo) {
                    record = record.withDeleted(true);
                }

                if (record.sequenceNr() > adjustedTo) {
                    break;
                }
                if (record.sequenceNr() >= adjustedFrom) {
                    callback.accept(record);
                    replayed++;
                }
            }
        }

        log.debug("Replay completed [streamId={}, from={}, to={}, replayed={}]", streamId, adjustedFrom, adjustedTo, replayed);
        return replayed;
    }
}
