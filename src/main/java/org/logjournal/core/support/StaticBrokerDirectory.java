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


package org.logjournal.core.support;

import org.logjournal.core.BrokerDirectory;
import org.logjournal.core.BrokerEndpoint;
import org.logjournal.core.BrokersListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.Objects.requireNonNull;

/**
 * A broker directory with a fixed set of brokers. The topology can still be changed programmatically via
 * {@link #update(List)}, which notifies the registered listeners just like a coordination service would.
 *
 * @author LogJournal contributors
 */
public class StaticBrokerDirectory implements BrokerDirectory {
    private volatile List<BrokerEndpoint> brokers;
    private final List<BrokersListener> listeners = new CopyOnWriteArrayList<>();
    private final Logger log = LoggerFactory.getLogger(getClass());

    public StaticBrokerDirectory(final List<BrokerEndpoint> brokers) {
        this.brokers = List.copyOf(requireNonNull(brokers, "Brokers must not be null"));
    }

    public StaticBrokerDirectory(final BrokerEndpoint... brokers) {
        this(List.of(brokers));
    }

    @Override
    public void addListener(final BrokersListener listener) {
        listeners.add(requireNonNull(listener, "Listener must not be null"));
    }

    @Override
    public void removeListener(final BrokersListener listener) {
        listeners.remove(listener);
    }

    @Override
    public List<BrokerEndpoint> start() {
        return brokers;
    }

    @Override
    public void stop() {
        listeners.clear();
    }

    /**
     * Replaces the brokers and notifies the listeners.
     *
     * @param newBrokers The new brokers.
     */
    public void update(final List<BrokerEndpoint> newBrokers) {
        brokers = List.copyOf(requireNonNull(newBrokers, "Brokers must not be null"));
        log.debug("Brokers updated [brokers={}]", brokers);
        listeners.forEach(listener -> listener.brokersUpdated(brokers));
    }
}
