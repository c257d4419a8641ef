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

import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;

/**
 * Decides if a filter applies to an invocation of an endpoint.
 * <p>
 * A filter applies when all of its conditions pass:
 * <ul>
 * <li>{@code only} is empty or lists the endpoint,</li>
 * <li>{@code except} is empty or does not list the endpoint,</li>
 * <li>{@code if} is absent or evaluates to true,</li>
 * <li>{@code unless} is absent or evaluates to false.</li>
 * </ul>
 * <p>
 * Conditions are evaluated in that order and evaluation stops at the first one that fails.
 */
@RequiredArgsConstructor
public class ConditionEvaluator {
    private final CallableResolver resolver;

    public boolean shouldInvoke(
        final String endpoint, final FilterDefinition filter, final Object instance
    ) throws Exception {
        final FilterOptions options = filter.getOptions();

        return passesOnly(endpoint, options.getOnly()) &&
            passesExcept(endpoint, options.getExcept()) &&
            passesIf(options.getIfCondition(), instance) &&
            passesUnless(options.getUnlessCondition(), instance);
    }

    static boolean passesOnly(final String endpoint, final Set<String> only) {
        return only.isEmpty() || only.contains(endpoint);
    }

    static boolean passesExcept(final String endpoint, final Set<String> except) {
        return except.isEmpty() || !except.contains(endpoint);
    }

    private boolean passesIf(final Optional<CallableRef> condition, final Object instance)
        throws Exception {
        if (!condition.isPresent()) {
            return true;
        }

        return isTrue(resolver.invoke(condition.get(), instance, Continuation.none()));
    }

    private boolean passesUnless(final Optional<CallableRef> condition, final Object instance)
        throws Exception {
        if (!condition.isPresent()) {
            return true;
        }

        return !isTrue(resolver.invoke(condition.get(), instance, Continuation.none()));
    }

    /**
     * Truth value of a condition result, null is false and any non-boolean value is true.
     */
    static boolean isTrue(final Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }

        return value != null;
    }
}
