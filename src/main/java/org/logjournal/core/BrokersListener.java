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

/**
 * Notified by a {@link BrokerDirectory} when the set of known brokers changes.
 *
 * @author LogJournal contributors
 */
@FunctionalInterface
public interface BrokersListener {
    /**
     * Invoked with the complete, new list of brokers. The list replaces the previous one wholesale.
     *
     * @param brokers The current brokers.
     */
    void brokersUpdated(List<BrokerEndpoint> brokers);
}
