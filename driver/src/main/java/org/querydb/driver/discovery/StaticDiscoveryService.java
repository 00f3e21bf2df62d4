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
package org.querydb.driver.discovery;

import static java.util.Objects.requireNonNull;
import static org.querydb.driver.internal.util.LockUtil.executeWithLock;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.querydb.driver.Endpoint;
import org.querydb.driver.Logger;
import org.querydb.driver.Logging;
import org.querydb.driver.exceptions.ServiceUnavailableException;
import org.querydb.driver.internal.util.Futures;

/**
 * Discovery over an explicitly managed set of endpoints.
 * <p>
 * Endpoints are handed out in round robin order. Pessimized endpoints are skipped while a healthy one is left, the
 * pessimization lasts until the endpoint set is next updated.
 */
public class StaticDiscoveryService implements DiscoveryService {
    private final Lock lock = new ReentrantLock();
    private final AtomicInteger offset = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final List<Consumer<Endpoint>> removedListeners = new CopyOnWriteArrayList<>();
    private final Set<Endpoint> pessimized = new LinkedHashSet<>();
    private final Logger log;
    private volatile Endpoint[] endpoints;

    public StaticDiscoveryService(Collection<Endpoint> endpoints, Logging logging) {
        requireNonNull(endpoints, "endpoints");
        this.endpoints = new LinkedHashSet<>(endpoints).toArray(new Endpoint[0]);
        this.log = logging.getLog(getClass());
    }

    @Override
    public CompletionStage<Endpoint> endpoint() {
        if (closed.get()) {
            return Futures.failedFuture(new IllegalStateException("Discovery service is closed"));
        }
        var endpoint = executeWithLock(lock, this::nextEndpoint);
        if (endpoint == null) {
            return Futures.failedFuture(new ServiceUnavailableException("No endpoints available"));
        }
        return CompletableFuture.completedFuture(endpoint);
    }

    @Override
    public void pessimize(Endpoint endpoint) {
        var added = executeWithLock(lock, () -> contains(endpoint) && pessimized.add(endpoint));
        if (added) {
            log.warn("Endpoint %s is pessimized", endpoint);
        }
    }

    @Override
    public void addEndpointRemovedListener(Consumer<Endpoint> listener) {
        removedListeners.add(requireNonNull(listener, "listener"));
    }

    /**
     * Replace the endpoint set. Listeners are notified about every endpoint that is no longer present.
     *
     * @param newEndpoints the new endpoint set
     */
    public void updateEndpoints(Collection<Endpoint> newEndpoints) {
        requireNonNull(newEndpoints, "newEndpoints");
        var removed = executeWithLock(lock, () -> {
            var retained = new LinkedHashSet<>(newEndpoints);
            var gone = new ArrayList<Endpoint>();
            for (var endpoint : endpoints) {
                if (!retained.contains(endpoint)) {
                    gone.add(endpoint);
                }
            }
            endpoints = retained.toArray(new Endpoint[0]);
            pessimized.clear();
            return gone;
        });
        removed.forEach(this::notifyRemoved);
    }

    public void removeEndpoint(Endpoint endpoint) {
        var removed = executeWithLock(lock, () -> {
            if (!contains(endpoint)) {
                return false;
            }
            var remaining = new ArrayList<Endpoint>();
            for (var existing : endpoints) {
                if (!existing.equals(endpoint)) {
                    remaining.add(existing);
                }
            }
            endpoints = remaining.toArray(new Endpoint[0]);
            pessimized.remove(endpoint);
            return true;
        });
        if (removed) {
            notifyRemoved(endpoint);
        }
    }

    public Set<Endpoint> endpoints() {
        return executeWithLock(lock, () -> new LinkedHashSet<>(List.of(endpoints)));
    }

    public boolean isPessimized(Endpoint endpoint) {
        return executeWithLock(lock, () -> pessimized.contains(endpoint));
    }

    @Override
    public CompletionStage<Void> close() {
        closed.set(true);
        return Futures.completedWithNull();
    }

    private Endpoint nextEndpoint() {
        var current = endpoints;
        if (current.length == 0) {
            return null;
        }
        for (var i = 0; i < current.length; i++) {
            var candidate = current[next(current.length)];
            if (!pessimized.contains(candidate)) {
                return candidate;
            }
        }
        // every endpoint is pessimized, use them anyway
        return current[next(current.length)];
    }

    private int next(int divisor) {
        var index = offset.getAndIncrement();
        for (; index == Integer.MAX_VALUE; index = offset.getAndIncrement()) {
            offset.compareAndSet(Integer.MIN_VALUE, index % divisor);
        }
        return index % divisor;
    }

    private boolean contains(Endpoint endpoint) {
        for (var existing : endpoints) {
            if (existing.equals(endpoint)) {
                return true;
            }
        }
        return false;
    }

    private void notifyRemoved(Endpoint endpoint) {
        log.info("Endpoint %s was removed", endpoint);
        for (var listener : removedListeners) {
            try {
                listener.accept(endpoint);
            } catch (Throwable error) {
                log.error("Endpoint removal listener failed for " + endpoint, error);
            }
        }
    }
}
