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

import org.logjournal.core.Event;
import org.logjournal.core.JournalRecord;

import java.io.Serializable;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Default, serializable implementation of the {@link Event}-interface.
 *
 * @author LogJournal contributors
 */
public class DefaultEvent implements Event, Serializable {
    private static final long serialVersionUID = 1L;
    private static final byte[] EMPTY = new byte[0];
    private final byte[] payload;
    private final long sequenceNr;
    private final String streamId;

    public DefaultEvent(final String streamId, final long sequenceNr, final byte[] payload) {
        this.streamId = requireNonNull(streamId, "Stream id must not be null");
        this.sequenceNr = sequenceNr;
        this.payload = payload == null ? EMPTY : payload;
    }

    /**
     * Creates the event view of a journal record.
     */
    public static Event of(final JournalRecord record) {
        return new DefaultEvent(record.streamId(), record.sequenceNr(), record.payload());
    }

    @Override
    public boolean equals(final Object otherObject) {
        if (otherObject instanceof DefaultEvent) {
            final DefaultEvent otherEvent = (DefaultEvent) otherObject;
            return sequenceNr == otherEvent.sequenceNr && Objects.equals(streamId, otherEvent.streamId);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, sequenceNr);
    }

    @Override
    public byte[] payload() {
        return payload;
    }

    @Override
    public long sequenceNr() {
        return sequenceNr;
    }

    @Override
    public String streamId() {
        return streamId;
    }

    @Override
    public String toString() {
        return "Event[streamId=" + streamId + ", sequenceNr=" + sequenceNr + "]";
    }
}
