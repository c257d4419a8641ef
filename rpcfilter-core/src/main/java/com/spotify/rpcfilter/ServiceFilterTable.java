/*
 * Copyright (c) 2015 Spotify AB.
 *
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package com.spotify.rpcfilter;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Associates service classes with their filter registries.
 * <p>
 * Registries are only ever created through {@link #forClass(Class)}, which is meant to be called
 * while services are configured. Request processing uses {@link #lookup(Class)}, which never
 * modifies the table.
 */
@Slf4j
@RequiredArgsConstructor
public class ServiceFilterTable {
    static final CoreFilterRegistry EMPTY = emptyRegistry();

    private final InheritanceMode inheritance;

    final ConcurrentMap<Class<?>, CoreFilterRegistry> registries = new ConcurrentHashMap<>();

    private volatile boolean sealed = false;

    /**
     * Get the registry of the given class for declaring filters, creating it on the first call
     * for the class.
     * <p>
     * With {@link InheritanceMode#SNAPSHOT} the new registry is a copy of the nearest ancestor's
     * registry as it is at the time of this call, even if no filter is registered afterwards.
     *
     * @throws IllegalStateException if the table is sealed.
     */
    public FilterRegistry forClass(final Class<?> service) {
        checkNotNull(service, "service");
        checkState(!sealed, "%s: service filters are sealed", service.getName());
        return registries.computeIfAbsent(service, this::newRegistry);
    }

    /**
     * Get the registry to run filters for an instance of the given class.
     *
     * @return The registry, or an empty registry if no filters apply to the class.
     */
    public FilterRegistry lookup(final Class<?> service) {
        final FilterRegistry registry = registries.get(service);

        if (registry != null) {
            return registry;
        }

        if (inheritance == InheritanceMode.SNAPSHOT) {
            return nearestAncestor(service).orElse(EMPTY);
        }

        return EMPTY;
    }

    /**
     * Seal the table and every registry in it.
     */
    public void seal() {
        sealed = true;
        registries.values().forEach(FilterRegistry::seal);
        log.debug("sealed filters of {} service(s)", registries.size());
    }

    public boolean isSealed() {
        return sealed;
    }

    private CoreFilterRegistry newRegistry(final Class<?> service) {
        if (inheritance == InheritanceMode.SNAPSHOT) {
            final Optional<CoreFilterRegistry> parent = nearestAncestor(service);

            if (parent.isPresent()) {
                log.debug("{}: inheriting filters from {}", service.getName(), parent.get());
                return CoreFilterRegistry.copyOf(service.getName(), parent.get());
            }
        }

        log.debug("{}: creating filter registry", service.getName());
        return new CoreFilterRegistry(service.getName());
    }

    private Optional<CoreFilterRegistry> nearestAncestor(final Class<?> service) {
        for (Class<?> c = service.getSuperclass(); c != null; c = c.getSuperclass()) {
            final CoreFilterRegistry registry = registries.get(c);

            if (registry != null) {
                return Optional.of(registry);
            }
        }

        return Optional.empty();
    }

    private static CoreFilterRegistry emptyRegistry() {
        final CoreFilterRegistry registry = new CoreFilterRegistry("empty");
        registry.seal();
        return registry;
    }
}
