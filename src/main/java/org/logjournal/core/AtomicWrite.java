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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A group of records for a single stream that is written as one unit. The records are appended in the order they are provided.
 *
 * @author LogJournal contributors
 */
public final class AtomicWrite {
    private final List<JournalRecord> records;
    private final String streamId;

    public AtomicWrite(final List<? extends JournalRecord> records) {
        requireNonNull(records, "Records must not be null");
        if (records.isEmpty()) {
            throw new IllegalArgumentException("An atomic write must contain at least one record");
        }

        this.streamId = records.get(0).streamId();
        for (final JournalRecord record : records) {
            if (!streamId.equals(record.streamId())) {
                throw new IllegalArgumentException(String.format(
                        "All records of an atomic write must share stream id [expected=%s, actual=%s]",
                        streamId, record.streamId()));
            }
        }
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    public static AtomicWrite of(final JournalRecord... records) {
        return new AtomicWrite(List.of(records));
    }

    public List<JournalRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public String streamId() {
        return streamId;
    }

    @Override
    public String toString() {
        return "AtomicWrite[streamId=" + streamId + ", size=" + records.size() + "]";
    }
}
