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
 * Converts journal records to and from the binary payloads stored in the journal topics.
 *
 * @author LogJournal contributors
 */
public interface RecordSerializer {
    /**
     * Deserialize a record from the given binary data.
     *
     * @param data record binary representation
     * @return the equivalent record
     * @throws SerializationException if the data is malformed
     */
    JournalRecord deserializeRecord(byte[] data);

    /**
     * Serialize the given record to binary data.
     *
     * @param record record to serialize
     * @return the equivalent binary data
     * @throws SerializationException if the record cannot be serialized
     */
    byte[] serialize(JournalRecord record);
}
