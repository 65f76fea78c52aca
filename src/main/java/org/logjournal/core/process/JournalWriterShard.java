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
import org.logjournal.core.WriteResult;

import java.util.ArrayList;
import java.util.List;

import static org.logjournal.core.support.JournalTopics.journalTopic;

/**
 * Appends journal records to the topic of their stream. Every record is appended with the same static key so all records of a
 * stream are stored, in order, in a single partition.
 *
 * @author LogJournal contributors
 */
class JournalWriterShard extends AbstractWriterShard {
    JournalWriterShard(final int index, final LogTransport transport, final WriterConfig config) {
        super("journal-writer", index, transport, config);
    }

    @Override
    protected LogProducer createProducer(final LogTransport transport, final WriterConfig config) {
        return transport.producer(config.journalProducerConfig());
    }

    @Override
    protected List<WriteResult> write(final List<JournalRecord> records, final WriterConfig config) {
        final List<WriteResult> results = new ArrayList<>(records.size());
        for (final JournalRecord record : records) {
            try {
                final byte[] payload = config.recordSerializer().serialize(record);
                final long offset = append(journalTopic(record.streamId()), JournalHelper.STATIC_PARTITION_KEY, payload);
                log.trace("Record appended [streamId={}, sequenceNr={}, offset={}]",
                        record.streamId(), record.sequenceNr(), offset);
                results.add(WriteResult.success());
            } catch (final RuntimeException e) {
                results.add(WriteResult.failure(e));
            }
        }
        return results;
    }
}
