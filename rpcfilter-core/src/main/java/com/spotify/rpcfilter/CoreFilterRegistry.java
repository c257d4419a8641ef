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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Copy-on-write filter registry.
 * <p>
 * Writers serialize on a lock and publish a new immutable list per filter type, readers never
 * lock and always see a complete list.
 */
@Slf4j
@RequiredArgsConstructor
public class CoreFilterRegistry implements FilterRegistry {
    private final String name;

    final Map<FilterType, List<FilterDefinition>> filters = new ConcurrentHashMap<>();
    /* only accessed while holding the lock */
    final Map<FilterType, Set<CallableRef>> defined = new EnumMap<>(FilterType.class);

    private final Object lock = new Object();
    private volatile boolean sealed = false;

    /**
     * Create a registry holding the same filters as the given one, in the same order and with
     * the same options.
     */
    public static CoreFilterRegistry copyOf(final String name, final FilterRegistry source) {
        final CoreFilterRegistry registry = new CoreFilterRegistry(name);

        for (final FilterType type : FilterType.values()) {
            for (final FilterDefinition filter : source.filters(type)) {
                registry.register(type, ImmutableList.of(filter.getCallable()),
                    filter.getOptions());
            }
        }

        return registry;
    }

    @Override
    public void register(
        final FilterType type, final List<CallableRef> callables, final FilterOptions options
    ) {
        checkNotNull(type, "type");
        checkNotNull(options, "options");
        checkArgument(!callables.isEmpty(), "at least one callable is required");

        for (final CallableRef callable : callables) {
            checkNotNull(callable, "callable");
        }

        synchronized (lock) {
            checkState(!sealed, "%s: filters are sealed, can not register %s filters", name,
                type);

            final Set<CallableRef> seen = defined.computeIfAbsent(type, t -> new HashSet<>());
            final ImmutableList.Builder<FilterDefinition> next = ImmutableList.builder();
            next.addAll(filters(type));

            for (final CallableRef callable : callables) {
                if (!seen.add(callable)) {
                    log.trace("{}: {} filter {} is already registered", name, type, callable);
                    continue;
                }

                next.add(new FilterDefinition(type, callable, options));
            }

            filters.put(type, next.build());
        }
    }

    @Override
    public List<FilterDefinition> filters(final FilterType type) {
        return filters.getOrDefault(type, ImmutableList.of());
    }

    @Override
    public void seal() {
        synchronized (lock) {
            if (!sealed) {
                log.debug("{}: sealing filters", name);
            }

            sealed = true;
        }
    }

    @Override
    public boolean isSealed() {
        return sealed;
    }

    @Override
    public String toString() {
        return "CoreFilterRegistry(" + name + ")";
    }
}
