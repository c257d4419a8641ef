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

import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.Optional;
import lombok.Data;

/**
 * Conditions deciding whether a filter applies to a given endpoint invocation.
 * <p>
 * All conditions are optional and a filter applies only if every configured condition passes.
 */
@Data
public class FilterOptions {
    private static final FilterOptions EMPTY =
        new FilterOptions(ImmutableSet.of(), ImmutableSet.of(), Optional.empty(),
            Optional.empty());

    /**
     * Endpoints the filter is limited to, empty for all endpoints.
     */
    private final ImmutableSet<String> only;
    /**
     * Endpoints the filter never applies to.
     */
    private final ImmutableSet<String> except;
    /**
     * Condition which has to be true for the filter to apply.
     */
    private final Optional<CallableRef> ifCondition;
    /**
     * Condition which has to be false for the filter to apply.
     */
    private final Optional<CallableRef> unlessCondition;

    public static FilterOptions empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final ImmutableSet.Builder<String> only = ImmutableSet.builder();
        private final ImmutableSet.Builder<String> except = ImmutableSet.builder();
        private Optional<CallableRef> ifCondition = Optional.empty();
        private Optional<CallableRef> unlessCondition = Optional.empty();

        public Builder only(final String... endpoints) {
            return only(Arrays.asList(endpoints));
        }

        public Builder only(final Collection<String> endpoints) {
            this.only.addAll(endpoints);
            return this;
        }

        public Builder except(final String... endpoints) {
            return except(Arrays.asList(endpoints));
        }

        public Builder except(final Collection<String> endpoints) {
            this.except.addAll(endpoints);
            return this;
        }

        public Builder ifCondition(final CallableRef condition) {
            this.ifCondition = Optional.of(checkNotNull(condition, "condition"));
            return this;
        }

        /**
         * Shorthand for an {@code if} condition naming an instance method.
         */
        public Builder ifMethod(final String name) {
            return ifCondition(CallableRef.method(name));
        }

        public Builder unlessCondition(final CallableRef condition) {
            this.unlessCondition = Optional.of(checkNotNull(condition, "condition"));
            return this;
        }

        public Builder unlessMethod(final String name) {
            return unlessCondition(CallableRef.method(name));
        }

        public FilterOptions build() {
            return new FilterOptions(only.build(), except.build(), ifCondition,
                unlessCondition);
        }
    }
}
