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
 * Events are the user-facing view of journal records that get republished to event topics. An event carries the stream id,
 * the sequence number and the payload of the record it was created from.
 *
 * @author LogJournal contributors
 */
public interface Event {
    /**
     * The payload of the originating record.
     *
     * @return The payload.
     */
    byte[] payload();

    /**
     * The sequence number of the originating record.
     *
     * @return The sequence number.
     */
    long sequenceNr();

    /**
     * The stream id of the originating record, also used as the partition key when the event is published.
     *
     * @return The stream id.
     */
    String streamId();
}
