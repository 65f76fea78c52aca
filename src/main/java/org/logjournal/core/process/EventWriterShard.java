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

import org.logjournal.core.Event;
import org.logjournal.core.JournalRecord;
import org.logjournal.core.LogProducer;
import org.logjournal.core.LogTransport;
import org.logjournal.core.WriteResult;
import org.logjournal.core.support.DefaultEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Republishes journal records as events to the topics selected by the event topic mapper. The stream id is the partition key so
 * events of one stream stay in order within each event topic, while events of different streams may interleave.
 *
 * @author LogJournal contributors
 */
class EventWriterShard extends AbstractWriterShard {
    EventWriterShard(final int index, final LogTransport transport, final WriterConfig config) {
        super("event-writer", index, transport, config);
    }

    @Override
    protected LogProducer createProducer(final LogTransport transport, final WriterConfig config) {
        return transport.producer(config.eventProducerConfig());
    }

    /**
     * @return One result per publication, i.e. per event and destination topic. Filtered events produce no result.
     */
    @Override
    protected List<WriteResult> write(final List<JournalRecord> records, final WriterConfig config) {
        final List<WriteResult> results = new ArrayList<>();
        for (final JournalRecord record : records) {
            final Event event = DefaultEvent.of(record);
            try {
                if (!config.eventFilter().accept(event)) {
                    log.trace("Event filtered [streamId={}, sequenceNr={}]", event.streamId(), event.sequenceNr());
                    continue;
                }

                final List<String> topics = config.eventTopicMapper().topicsFor(event);
                if (topics.isEmpty()) {
                    continue;
                }

                final byte[] payload = config.eventSerializer().serialize(event);
                for (final String topic : topics) {
                    results.add(publish(topic, event, payload));
                }
            } catch (final RuntimeException e) {
                results.add(WriteResult.failure(e));
            }
        }
        return results;
    }

    private WriteResult publish(final String topic, final Event event, final byte[] payload) {
        try {
            append(topic, event.streamId(), payload);
            log.trace("Event published [topic={}, streamId={}, sequenceNr={}]", topic, event.streamId(), event.sequenceNr());
            return WriteResult.success();
        } catch (final RuntimeException e) {
            return WriteResult.failure(e);
        }
    }
}
