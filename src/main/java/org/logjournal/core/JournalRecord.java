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

/**
 * A journal record is one persisted unit of a stream. Records are immutable, the deleted flag is an overlay applied during
 * replay and never written by a delete request.
 *
 * @author LogJournal contributors
 */
public interface JournalRecord {
    /**
     * Indicates whether the record has been (softly) deleted.
     *
     * @return true if the record is covered by a non-permanent deletion.
     */
    boolean deleted();

    /**
     * The payload of the record. The journal never interprets it.
     *
     * @return The payload.
     */
    byte[] payload();

    /**
     * The sequence number of the record within its stream, starting at 1.
     *
     * @return The sequence number.
     */
    long sequenceNr();

    /**
     * The identifier of the stream the record belongs to.
     *
     * @return The stream id.
     */
    String streamId();

    /**
     * Creates a copy of this record with the deleted flag set to the provided value.
     *
     * @param deleted The new deleted flag.
     * @return The copy.
     */
    JournalRecord withDeleted(boolean deleted);
}
