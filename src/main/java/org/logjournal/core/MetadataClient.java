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

import java.util.List;
import java.util.Optional;

/**
 * Resolves topic metadata from the log brokers.
 *
 * @author LogJournal contributors
 */
public interface MetadataClient {
    /**
     * Finds the leader of the journal partition of the given topic.
     *
     * @param topic        The topic.
     * @param knownBrokers The brokers to ask.
     * @return The leader or empty if the topic does not exist yet.
     * @throws TransportException If the metadata could not be resolved.
     */
    Optional<BrokerEndpoint> leaderFor(String topic, List<BrokerEndpoint> knownBrokers);

    /**
     * Queries the high-water offset of a topic partition, i.e. the offset the next appended record will get.
     *
     * @throws TransportException If the offset could not be resolved.
     */
    long offsetFor(String host, int port, String topic, int partition);
}
