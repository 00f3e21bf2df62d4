/*
 * Copyright (c) the QueryDB driver authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.querydb.driver;

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * A host and port pair denoting one node of the query service, as resolved by discovery.
 *
 * @since 1.0
 */
public final class Endpoint {
    private final String host;
    private final int port;
    private final long nodeId;
    private final String stringValue;

    public Endpoint(String host, int port) {
        this(host, port, 0);
    }

    public Endpoint(String host, int port, long nodeId) {
        this.host = requireNonNull(host, "host");
        this.port = requireValidPort(port);
        this.nodeId = nodeId;
        this.stringValue = String.format("%s:%d", host, port);
    }

    /**
     * Parses an endpoint from its {@code host:port} representation.
     *
     * @param address the address string
     * @return the endpoint
     */
    public static Endpoint parse(String address) {
        requireNonNull(address, "address");
        var separator = address.lastIndexOf(':');
        if (separator <= 0 || separator == address.length() - 1) {
            throw new IllegalArgumentException("Endpoint should be in host:port format: " + address);
        }
        int port;
        try {
            port = Integer.parseInt(address.substring(separator + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Illegal port in endpoint: " + address, e);
        }
        return new Endpoint(address.substring(0, separator), port);
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    /**
     * @return the node id assigned by discovery, {@code 0} when unknown
     */
    public long nodeId() {
        return nodeId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        var that = (Endpoint) o;
        return port == that.port && host.equals(that.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return stringValue;
    }

    private static int requireValidPort(int port) {
        if (port >= 0 && port <= 65_535) {
            return port;
        }
        throw new IllegalArgumentException("Illegal port: " + port);
    }
}
