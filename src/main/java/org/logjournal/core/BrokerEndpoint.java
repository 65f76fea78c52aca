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

import java.io.Serializable;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Address of a log broker.
 *
 * @author LogJournal contributors
 */
public final class BrokerEndpoint implements Serializable {
    private static final long serialVersionUID = 1L;
    private final String host;
    private final int port;

    public BrokerEndpoint(final String host, final int port) {
        this.host = requireNonNull(host, "Host must not be null");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port [port=" + port + "]");
        }
        this.port = port;
    }

    /**
     * Parses an endpoint on the form {@code host:port}.
     */
    public static BrokerEndpoint parse(final String hostAndPort) {
        requireNonNull(hostAndPort, "Endpoint must not be null");
        final int separator = hostAndPort.lastIndexOf(':');
        if (separator <= 0 || separator == hostAndPort.length() - 1) {
            throw new IllegalArgumentException("Endpoint must be on the form host:port [endpoint=" + hostAndPort + "]");
        }

        try {
            return new BrokerEndpoint(
                    hostAndPort.substring(0, separator).trim(),
                    Integer.parseInt(hostAndPort.substring(separator + 1).trim()));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in endpoint [endpoint=" + hostAndPort + "]", e);
        }
    }

    @Override
    public boolean equals(final Object otherObject) {
        if (otherObject instanceof BrokerEndpoint) {
            final BrokerEndpoint other = (BrokerEndpoint) otherObject;
            return port == other.port && host.equals(other.host);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
