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
 * Converts events to and from the binary payloads published to event topics.
 *
 * @author LogJournal contributors
 */
public interface EventSerializer {
    /**
     * Deserialize an event from the given binary data.
     *
     * @param data event binary representation
     * @return the equivalent event
     * @throws SerializationException if the data is malformed
     */
    Event deserializeEvent(byte[] data);

    /**
     * Serialize the given event to binary data.
     *
     * @param event event to serialize
     * @return the equivalent binary data
     * @throws SerializationException if the event cannot be serialized
     */
    byte[] serialize(Event event);
}
