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

import java.util.Properties;

/**
 * The client side of the partitioned append-only log.
 *
 * @author LogJournal contributors
 */
public interface LogTransport {
    /**
     * Opens a cursor over a topic partition.
     *
     * @param leader    The leader of the partition.
     * @param topic     The topic.
     * @param partition The partition.
     * @param offset    The first offset to read.
     * @param config    Consumer configuration.
     * @return The cursor, the caller is responsible for closing it.
     * @throws TransportException If the cursor could not be opened.
     */
    LogCursor cursor(BrokerEndpoint leader, String topic, int partition, long offset, Properties config);

    /**
     * Creates a new producer handle.
     *
     * @param config Producer configuration, including the current {@code bootstrap.servers}.
     * @return A new producer.
     */
    LogProducer producer(Properties config);
}
