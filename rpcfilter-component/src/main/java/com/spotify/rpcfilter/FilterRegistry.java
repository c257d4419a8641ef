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

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered filter declarations for a single service class.
 * <p>
 * Registries are written while a service class is being configured and only read once requests
 * are served. Implementations must make registered filters visible to concurrent readers without
 * requiring them to lock.
 */
public interface FilterRegistry {
    /**
     * Register filters of the given type.
     * <p>
     * Callables already registered for the type are silently skipped, keeping the options they
     * were first registered with.
     *
     * @param type Type of the filters.
     * @param callables Callables to register, in declaration order.
     * @param options Conditions applied to every registered callable.
     * @throws IllegalStateException if the registry is sealed.
     */
    void register(FilterType type, List<CallableRef> callables, FilterOptions options);

    /**
     * Get the filters of the given type in declaration order.
     *
     * @return An immutable list, empty if no filters of the type are registered.
     */
    List<FilterDefinition> filters(FilterType type);

    /**
     * Refuse all further registrations.
     */
    void seal();

    boolean isSealed();

    default FilterRegistry beforeFilter(final CallableRef... callables) {
        return beforeFilter(Arrays.asList(callables), FilterOptions.empty());
    }

    default FilterRegistry beforeFilter(final String... methods) {
        return beforeFilter(methods(methods), FilterOptions.empty());
    }

    default FilterRegistry beforeFilter(
        final List<CallableRef> callables, final FilterOptions options
    ) {
        register(FilterType.BEFORE, callables, options);
        return this;
    }

    default FilterRegistry afterFilter(final CallableRef... callables) {
        return afterFilter(Arrays.asList(callables), FilterOptions.empty());
    }

    default FilterRegistry afterFilter(final String... methods) {
        return afterFilter(methods(methods), FilterOptions.empty());
    }

    default FilterRegistry afterFilter(
        final List<CallableRef> callables, final FilterOptions options
    ) {
        register(FilterType.AFTER, callables, options);
        return this;
    }

    default FilterRegistry aroundFilter(final CallableRef... callables) {
        return aroundFilter(Arrays.asList(callables), FilterOptions.empty());
    }

    default FilterRegistry aroundFilter(final String... methods) {
        return aroundFilter(methods(methods), FilterOptions.empty());
    }

    default FilterRegistry aroundFilter(
        final List<CallableRef> callables, final FilterOptions options
    ) {
        register(FilterType.AROUND, callables, options);
        return this;
    }

    static List<CallableRef> methods(final String... names) {
        return Arrays
            .stream(names)
            .map(CallableRef::method)
            .collect(Collectors.collectingAndThen(Collectors.toList(), ImmutableList::copyOf));
    }
}
