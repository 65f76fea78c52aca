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


package org.logjournal.cluster.hazelcast;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.core.ISet;
import com.hazelcast.core.ItemEvent;
import com.hazelcast.core.ItemListener;
import org.logjournal.core.BrokerDirectory;
import org.logjournal.core.BrokerEndpoint;
import org.logjournal.core.BrokersListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A broker directory backed by a distributed Hazelcast set. Brokers announce themselves by adding their {@code host:port} to
 * the set (see {@link #register(BrokerEndpoint)}) and every member of the cluster is notified when the set changes. The brokers
 * are reported sorted by host and port so that all members see the same order.
 *
 * @author LogJournal contributors
 */
public class HazelcastBrokerDirectory implements BrokerDirectory {
    public static final String DEFAULT_NAME = "logjournal-brokers";
    private static final Comparator<BrokerEndpoint> ORDER =
            Comparator.comparing(BrokerEndpoint::host).thenComparingInt(BrokerEndpoint::port);

    private final HazelcastInstance hz;
    private final List<BrokersListener> listeners = new CopyOnWriteArrayList<>();
    private final Logger log = LoggerFactory.getLogger(getClass());
    private String listenerId;
    private final String name;
    private final boolean shutdownOnStop;

    public HazelcastBrokerDirectory(final HazelcastInstance hz) {
        this(hz, DEFAULT_NAME, false);
    }

    /**
     * @param hz             The Hazelcast instance.
     * @param name           The name of the distributed set holding the brokers.
     * @param shutdownOnStop Shut the Hazelcast instance down when the directory is stopped.
     */
    public HazelcastBrokerDirectory(final HazelcastInstance hz, final String name, final boolean shutdownOnStop) {
        this.hz = requireNonNull(hz, "Hazelcast instance must not be null");
        this.name = requireNonNull(name, "Name must not be null");
        this.shutdownOnStop = shutdownOnStop;
    }

    @Override
    public void addListener(final BrokersListener listener) {
        listeners.add(requireNonNull(listener, "Listener must not be null"));
    }

    /**
     * The brokers currently registered.
     */
    public List<BrokerEndpoint> brokers() {
        return brokerSet().stream()
                .map(BrokerEndpoint::parse)
                .sorted(ORDER)
                .collect(Collectors.toList());
    }

    /**
     * Announces a broker to all members.
     */
    public void register(final BrokerEndpoint endpoint) {
        log.debug("Registering broker [endpoint={}]", endpoint);
        brokerSet().add(endpoint.toString());
    }

    @Override
    public void removeListener(final BrokersListener listener) {
        listeners.remove(listener);
    }

    @Override
    public synchronized List<BrokerEndpoint> start() {
        if (listenerId == null) {
            listenerId = brokerSet().addItemListener(new BrokerSetListener(), false);
            log.info("Watching brokers [set={}]", name);
        }
        return brokers();
    }

    @Override
    public synchronized void stop() {
        if (listenerId != null) {
            brokerSet().removeItemListener(listenerId);
            listenerId = null;
        }
        if (shutdownOnStop) {
            hz.getLifecycleService().shutdown();
        }
    }

    /**
     * Removes a broker for all members.
     */
    public void unregister(final BrokerEndpoint endpoint) {
        log.debug("Unregistering broker [endpoint={}]", endpoint);
        brokerSet().remove(endpoint.toString());
    }

    private ISet<String> brokerSet() {
        return hz.getSet(name);
    }

    private void notifyListeners() {
        final List<BrokerEndpoint> brokers = brokers();
        log.debug("Brokers changed [brokers={}]", brokers);
        listeners.forEach(listener -> listener.brokersUpdated(brokers));
    }

    private class BrokerSetListener implements ItemListener<String> {
        @Override
        public void itemAdded(final ItemEvent<String> event) {
            notifyListeners();
        }

        @Override
        public void itemRemoved(final ItemEvent<String> event) {
            notifyListeners();
        }
    }
}
