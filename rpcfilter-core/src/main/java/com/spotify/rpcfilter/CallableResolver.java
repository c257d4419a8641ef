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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;

/**
 * Calls filter references against a service instance.
 * <p>
 * Invocable references are called according to their arity, unary ones receive the instance.
 * Method references are resolved on the instance with {@link MethodLookup} and called with the
 * arguments their parameter shape asks for.
 * <p>
 * Anything thrown by the called code is rethrown as-is.
 */
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
public class CallableResolver {
    private final MethodLookup lookup;

    public CallableResolver(final boolean cacheMethodLookups) {
        this(new MethodLookup(cacheMethodLookups));
    }

    /**
     * Invoke the given reference.
     *
     * @param ref Reference to invoke.
     * @param instance Service instance to invoke the reference against.
     * @param proceed Continuation handed to the reference, {@link Continuation#none()} outside of
     * around chains.
     * @return The value returned by the reference.
     * @throws InvalidFilterException if a method reference can not be resolved on the instance.
     */
    public Object invoke(final CallableRef ref, final Object instance, final Continuation proceed)
        throws Exception {
        final Continuation prepared = ref.visit(new CallableRef.Visitor<Continuation>() {
            @Override
            public Continuation visitInvocable(final InvocableRef invocable) {
                switch (invocable.getArity()) {
                    case UNARY:
                        return () -> invocable.unary().call(instance, proceed);
                    default:
                        return () -> invocable.nullary().call(proceed);
                }
            }

            @Override
            public Continuation visitMethod(final MethodRef method) {
                final MethodLookup.FilterMethod resolved = lookup
                    .filterMethod(instance.getClass(), method.getName())
                    .orElseThrow(() -> new InvalidFilterException(method,
                        instance.getClass().getName() + ": " + method +
                            " is not callable, no instance method with a usable signature"));

                final Object[] arguments = resolved.getShape().arguments(instance, proceed);
                return () -> call(method, resolved.getMethod(), instance, arguments);
            }
        });

        return prepared.proceed();
    }

    /**
     * Invoke the endpoint with the given name on the instance.
     *
     * @throws UnknownEndpointException if the instance has no such endpoint.
     */
    public Object invokeEndpoint(final Object instance, final String endpoint) throws Exception {
        final Method method = lookup
            .endpointMethod(instance.getClass(), endpoint)
            .orElseThrow(() -> new UnknownEndpointException(endpoint, instance.getClass()));

        try {
            return method.invoke(instance);
        } catch (final InvocationTargetException e) {
            throw unwrap(e);
        } catch (final IllegalAccessException e) {
            throw new IllegalStateException(
                instance.getClass().getName() + ": endpoint " + endpoint + " is not accessible",
                e);
        }
    }

    private Object call(
        final MethodRef ref, final Method method, final Object instance, final Object[] arguments
    ) throws Exception {
        try {
            return method.invoke(instance, arguments);
        } catch (final InvocationTargetException e) {
            throw unwrap(e);
        } catch (final IllegalAccessException e) {
            throw new InvalidFilterException(ref,
                instance.getClass().getName() + ": " + ref + " is not accessible", e);
        }
    }

    static Exception unwrap(final InvocationTargetException e) {
        final Throwable cause = e.getCause();

        if (cause instanceof Error) {
            throw (Error) cause;
        }

        if (cause instanceof Exception) {
            return (Exception) cause;
        }

        return e;
    }
}
