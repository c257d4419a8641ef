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

import com.google.common.collect.Lists;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Composes around filters into a single continuation which ends with the endpoint.
 * <p>
 * For around filters {@code [a1, a2, a3]} the built continuation behaves like
 * {@code a1(proceed = a2(proceed = a3(proceed = endpoint)))}. Filters whose conditions do not
 * pass are left out of the chain. A filter that never calls {@code proceed} prevents everything
 * inside of it from running.
 */
@Slf4j
@RequiredArgsConstructor
public class ChainBuilder {
    private final ConditionEvaluator conditions;
    private final CallableResolver resolver;

    /**
     * Build the chain.
     * <p>
     * Conditions of the filters are evaluated while building, innermost filter first. The
     * returned continuation is expected to be called exactly once.
     */
    public Continuation build(
        final String endpoint, final Object instance, final List<FilterDefinition> around
    ) throws Exception {
        Continuation current = () -> resolver.invokeEndpoint(instance, endpoint);

        for (final FilterDefinition filter : Lists.reverse(around)) {
            if (!conditions.shouldInvoke(endpoint, filter, instance)) {
                log.trace("{}: around filter {} does not apply", endpoint, filter.getCallable());
                continue;
            }

            final Continuation next = current;
            current = () -> resolver.invoke(filter.getCallable(), instance, next);
        }

        return current;
    }
}
