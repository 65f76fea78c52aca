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

import org.logjournal.core.lifecycle.Startable;
import org.logjournal.core.lifecycle.Stoppable;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * The entry point for working with the journal. Instances are created via {@link LogJournalBuilder} and must be started before
 * use.
 *
 * <p>Every stream is stored in its own topic and all records of a stream are appended by the same writer shard, so the
 * records of one stream are always stored in the order they were written. The order between different streams is
 * unspecified.</p>
 *
 * @see LogJournalBuilder
 *
 * @author LogJournal contributors
 */
public interface LogJournal extends Startable<LogJournal>, Stoppable {
    /**
     * Soft-deletes all records of the stream up to and including the given sequence number. Soft-deleted records are still
     * replayed but flagged as deleted.
     *
     * @param streamId     The stream.
     * @param toSequenceNr The highest sequence number to delete.
     * @see #deleteTo(String, long, boolean)
     */
    void deleteTo(String streamId, long toSequenceNr);

    /**
     * Deletes all records of the stream up to and including the given sequence number. The deletion is kept in memory only and
     * is lost when the process restarts, the underlying log is never modified.
     *
     * @param streamId     The stream.
     * @param toSequenceNr The highest sequence number to delete.
     * @param permanent    If true the deleted records are never replayed again, otherwise they are replayed flagged as
     *                     deleted.
     */
    void deleteTo(String streamId, long toSequenceNr, boolean permanent);

    /**
     * Finds the highest sequence number stored for the stream.
     *
     * @param streamId       The stream.
     * @param fromSequenceNr Returned as-is if the stream has never been written.
     * @return A future holding the highest sequence number, failed if the metadata could not be resolved.
     */
    CompletableFuture<Long> highestSequenceNr(String streamId, long fromSequenceNr);

    /**
     * Replays the records of a stream within the given (inclusive) range, in ascending sequence number order. The returned
     * future completes when the whole window has been walked.
     *
     * @param streamId       The stream.
     * @param fromSequenceNr The lowest sequence number to replay.
     * @param toSequenceNr   The highest sequence number to replay.
     * @param max            The maximum number of records to replay.
     * @param callback       Invoked once per replayed record.
     * @return A future that completes when the replay is done.
     */
    CompletableFuture<Void> replay(
            String streamId,
            long fromSequenceNr,
            long toSequenceNr,
            long max,
            Consumer<JournalRecord> callback);

    /**
     * Writes a batch of atomic writes. Writes for the same stream are merged and appended in order, different streams are
     * written in parallel.
     *
     * @param writes The writes.
     * @return One result per atomic write, in the order they were provided. When the result is available depends on the
     * configured {@link WriteAcknowledgement}.
     */
    CompletableFuture<List<WriteResult>> write(List<AtomicWrite> writes);
}
