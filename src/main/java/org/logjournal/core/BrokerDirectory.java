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

import org.logjournal.core.lifecycle.Stoppable;

import java.util.List;

/**
 * Supplies the endpoints of the log brokers and notifies listeners when the topology changes.
 *
 * @author LogJournal contributors
 */
public interface BrokerDirectory extends Stoppable {
    /**
     * Registers a listener that is notified of topology changes after {@link #start()}.
     *
     * @param listener The listener.
     */
    void addListener(BrokersListener listener);

    /**
     * Removes a previously registered listener.
     *
     * @param listener The listener.
     */
    void removeListener(BrokersListener listener);

    /**
     * Starts watching the broker topology.
     *
     * @return The brokers known at start, in directory order.
     */
    List<BrokerEndpoint> start();
}
