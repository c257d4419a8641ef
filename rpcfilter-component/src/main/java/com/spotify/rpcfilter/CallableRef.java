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

import com.spotify.rpcfilter.function.InstanceFunction;
import com.spotify.rpcfilter.function.NullaryFilter;
import com.spotify.rpcfilter.function.UnaryFilter;
import java.util.concurrent.Callable;

/**
 * A reference to something that can be called as a filter or a filter condition.
 * <p>
 * Either an {@link InvocableRef}, which wraps a unit of code directly, or a {@link MethodRef},
 * which names an instance method that is looked up on the service at call time.
 * <p>
 * References are compared when registering filters, so that the same reference is only ever
 * registered once per filter type.
 */
public interface CallableRef {
    <R> R visit(Visitor<R> visitor);

    interface Visitor<R> {
        R visitInvocable(InvocableRef invocable);

        R visitMethod(MethodRef method);
    }

    static CallableRef of(final NullaryFilter filter) {
        return InvocableRef.nullary(filter, filter);
    }

    static <S> CallableRef of(final UnaryFilter<S> filter) {
        return InvocableRef.unary(filter, filter);
    }

    /**
     * Reference a unit which takes no arguments and never proceeds.
     */
    static CallableRef callable(final Callable<?> callable) {
        return InvocableRef.nullary(callable, proceed -> callable.call());
    }

    /**
     * Reference a unit which takes the service instance and never proceeds.
     */
    static <S> CallableRef function(final InstanceFunction<S> function) {
        return InvocableRef.<S>unary(function, (service, proceed) -> function.apply(service));
    }

    static CallableRef method(final String name) {
        return new MethodRef(name);
    }
}
