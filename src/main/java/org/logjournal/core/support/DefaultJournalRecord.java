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

import org.logjournal.core.JournalRecord;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Default, serializable implementation of the {@link JournalRecord}-interface.
 *
 * @author LogJournal contributors
 */
public class DefaultJournalRecord implements JournalRecord, Serializable {
    private static final long serialVersionUID = 1L;
    private static final byte[] EMPTY = new byte[0];
    private final boolean deleted;
    private final byte[] payload;
    private final long sequenceNr;
    private final String streamId;

    public DefaultJournalRecord(final String streamId, final long sequenceNr, final byte[] payload) {
        this(streamId, sequenceNr, payload, false);
    }

    public DefaultJournalRecord(final String streamId, final long sequenceNr, final byte[] payload, final boolean deleted) {
        this.streamId = requireNonNull(streamId, "Stream id must not be null");
        this.sequenceNr = sequenceNr;
        this.payload = payload == null ? EMPTY : payload;
        this.deleted = deleted;
    }

    @Override
    public boolean deleted() {
        return deleted;
    }

    @Override
    public boolean equals(final Object otherObject) {
        if (otherObject instanceof DefaultJournalRecord) {
            final DefaultJournalRecord other = (DefaultJournalRecord) otherObject;
            return sequenceNr == other.sequenceNr
                    && deleted == other.deleted
                    && streamId.equals(other.streamId)
                    && Arrays.equals(payload, other.payload);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, sequenceNr, deleted);
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
        return "JournalRecord[streamId=" + streamId + ", sequenceNr=" + sequenceNr + ", deleted=" + deleted + "]";
    }

    @Override
    public JournalRecord withDeleted(final boolean deleted) {
        return deleted == this.deleted ? this : new DefaultJournalRecord(streamId, sequenceNr, payload, deleted);
    }
}
