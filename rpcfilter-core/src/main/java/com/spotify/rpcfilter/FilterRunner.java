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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the filters of an endpoint, and the endpoint itself.
 * <p>
 * Before filters run in declaration order and any of them may halt the invocation by returning
 * exactly {@code false}, in which case nothing else runs. Otherwise the around chain is built and
 * executed with the endpoint innermost, after which every applicable after filter runs in
 * declaration order regardless of what it returns.
 * <p>
 * Nothing is caught, any exception raised by a filter or the endpoint propagates to the caller.
 */
@Slf4j
@RequiredArgsConstructor
public class FilterRunner {
    enum Phase {
        IDLE, RUNNING_BEFORE, STOPPED, RUNNING_AROUND, RUNNING_AFTER, DONE
    }

    private final ConditionEvaluator conditions;
    private final CallableResolver resolver;
    private final ChainBuilder chains;

    public FilterOutcome run(
        final FilterRegistry registry, final String endpoint, final Object instance
    ) throws Exception {
        Phase phase = Phase.IDLE;

        phase = enter(endpoint, phase, Phase.RUNNING_BEFORE);

        for (final FilterDefinition filter : registry.filters(FilterType.BEFORE)) {
            if (!conditions.shouldInvoke(endpoint, filter, instance)) {
                continue;
            }

            log.trace("{}: before {}", endpoint, filter.getCallable());

            final Object result =
                resolver.invoke(filter.getCallable(), instance, Continuation.none());

            if (Boolean.FALSE.equals(result)) {
                enter(endpoint, phase, Phase.STOPPED);
                log.debug("{}: halted by before filter {}", endpoint, filter.getCallable());
                return FilterOutcome.stopped(endpoint, filter);
            }
        }

        phase = enter(endpoint, phase, Phase.RUNNING_AROUND);

        final Object value =
            chains.build(endpoint, instance, registry.filters(FilterType.AROUND)).proceed();

        phase = enter(endpoint, phase, Phase.RUNNING_AFTER);

        for (final FilterDefinition filter : registry.filters(FilterType.AFTER)) {
            if (!conditions.shouldInvoke(endpoint, filter, instance)) {
                continue;
            }

            log.trace("{}: after {}", endpoint, filter.getCallable());
            resolver.invoke(filter.getCallable(), instance, Continuation.none());
        }

        enter(endpoint, phase, Phase.DONE);
        return FilterOutcome.done(endpoint, value);
    }

    private Phase enter(final String endpoint, final Phase from, final Phase to) {
        log.trace("{}: {} -> {}", endpoint, from, to);
        return to;
    }
}
