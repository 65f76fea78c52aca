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


package org.logjournal.core.process;

import org.logjournal.core.BrokerEndpoint;

import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Various helper functions.
 *
 * @author LogJournal contributors
 */
final class JournalHelper {
    static final String BOOTSTRAP_SERVERS = "bootstrap.servers";

    /**
     * All journal records are appended with the same key so that they end up in the same partition of the stream's topic.
     */
    static final String STATIC_PARTITION_KEY = "static";

    private JournalHelper() {
        // empty
    }

    static String bootstrapServers(final List<BrokerEndpoint> brokers) {
        return brokers.stream().map(BrokerEndpoint::toString).collect(Collectors.joining(","));
    }

    static Properties copy(final Properties properties) {
        final Properties copy = new Properties();
        if (properties != null) {
            properties.stringPropertyNames().forEach(name -> copy.setProperty(name, properties.getProperty(name)));
        }
        return copy;
    }

    static Properties producerConfig(final Properties base, final List<BrokerEndpoint> brokers) {
        final Properties config = copy(base);
        if (!brokers.isEmpty()) {
            config.setProperty(BOOTSTRAP_SERVERS, bootstrapServers(brokers));
        }
        return config;
    }

    /**
     * The index of the shard that owns the stream. String hash codes are specified by the language so the assignment is stable
     * across restarts.
     */
    static int shardIndex(final String streamId, final int poolSize) {
        return Math.floorMod(streamId.hashCode(), poolSize);
    }
}
