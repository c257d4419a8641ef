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

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Filters of a set of service classes.
 * <p>
 * Service classes declare their filters through {@link #forClass(Class)} while they are being
 * configured, dispatchers then call {@link #run(String, Object)} (or
 * {@link AbstractFilteredService#runFilters(String)}) instead of calling endpoints directly.
 *
 * <pre>{@code
 * filters.forClass(AccountService.class)
 *     .beforeFilter("checkAuth")
 *     .aroundFilter("timeIt")
 *     .afterFilter(ImmutableList.of(CallableRef.method("logCall")),
 *         FilterOptions.builder().except("ping").build());
 * }</pre>
 */
@Slf4j
public class ServiceFilters {
    @Getter
    private final FiltersConfig config;
    private final ServiceFilterTable table;
    private final FilterRunner runner;

    public ServiceFilters(final FiltersConfig config) {
        this.config = checkNotNull(config, "config");
        this.table = new ServiceFilterTable(config.getInheritance());

        final CallableResolver resolver = new CallableResolver(config.isCacheMethodLookups());
        final ConditionEvaluator conditions = new ConditionEvaluator(resolver);
        final ChainBuilder chains = new ChainBuilder(conditions, resolver);
        this.runner = new FilterRunner(conditions, resolver, chains);
    }

    public static ServiceFilters create() {
        return new ServiceFilters(FiltersConfig.defaults());
    }

    /**
     * Registry to declare filters of the given service class in.
     *
     * @throws IllegalStateException if filters have been sealed.
     */
    public FilterRegistry forClass(final Class<?> service) {
        return table.forClass(service);
    }

    /**
     * Filters which apply to the given service class.
     */
    public FilterRegistry filtersOf(final Class<?> service) {
        return table.lookup(service);
    }

    /**
     * Run the filters of the endpoint with the given name, and the endpoint itself.
     *
     * @param endpoint Name of the endpoint method.
     * @param instance Service instance to run against.
     * @return The outcome of the invocation.
     * @throws InvalidFilterException if an applicable filter can not be called.
     * @throws UnknownEndpointException if the endpoint does not exist.
     * @throws Exception anything thrown by a filter or the endpoint.
     */
    public FilterOutcome run(final String endpoint, final Object instance) throws Exception {
        checkNotNull(endpoint, "endpoint");
        checkNotNull(instance, "instance");

        if (config.isSealOnFirstRun() && !table.isSealed()) {
            log.info("sealing service filters on first run ({})", endpoint);
            table.seal();
        }

        return runner.run(table.lookup(instance.getClass()), endpoint, instance);
    }

    /**
     * Refuse any further filter declarations.
     */
    public void seal() {
        table.seal();
    }

    public boolean isSealed() {
        return table.isSealed();
    }
}
