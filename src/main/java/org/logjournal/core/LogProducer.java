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
 * A producer handle to the log transport. Handles are owned by exactly one writer shard and are never shared.
 *
 * @author LogJournal contributors
 */
public interface LogProducer extends AutoCloseable {
    /**
     * Appends one record and blocks until the transport has acknowledged it.
     *
     * @param topic   The destination topic.
     * @param key     The partition key.
     * @param payload The serialized record.
     * @return The offset the record was appended at.
     * @throws TransportException If the append failed.
     */
    long append(String topic, String key, byte[] payload);

    /**
     * Flushes and closes the handle, blocking until done.
     */
    @Override
    void close();
}
