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
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import lombok.Data;
import lombok.RequiredArgsConstructor;

/**
 * Finds the instance methods named by method references and endpoints.
 * <p>
 * Methods of any visibility are considered, starting with the class of the instance and walking
 * up through its superclasses, then the default and private methods of the interfaces they
 * implement. The first type declaring a usable method wins.
 */
@RequiredArgsConstructor
class MethodLookup {
    private final boolean cache;

    final ConcurrentMap<Key, Optional<FilterMethod>> filterMethods = new ConcurrentHashMap<>();
    final ConcurrentMap<Key, Optional<Method>> endpointMethods = new ConcurrentHashMap<>();

    /**
     * The parameter shapes a filter method may have, in order of preference.
     */
    enum Shape {
        /* (S service, Continuation proceed) */
        SERVICE_AND_PROCEED,
        /* (S service) */
        SERVICE,
        /* (Continuation proceed) */
        PROCEED,
        /* () */
        NONE;

        Object[] arguments(final Object instance, final Continuation proceed) {
            switch (this) {
                case SERVICE_AND_PROCEED:
                    return new Object[]{instance, proceed};
                case SERVICE:
                    return new Object[]{instance};
                case PROCEED:
                    return new Object[]{proceed};
                default:
                    return new Object[0];
            }
        }
    }

    @Data
    static class FilterMethod {
        private final Method method;
        private final Shape shape;
    }

    @Data
    static class Key {
        private final Class<?> type;
        private final String name;
    }

    public Optional<FilterMethod> filterMethod(final Class<?> type, final String name) {
        return lookup(filterMethods, new Key(type, name), this::findFilterMethod);
    }

    public Optional<Method> endpointMethod(final Class<?> type, final String name) {
        return lookup(endpointMethods, new Key(type, name), this::findEndpointMethod);
    }

    private <T> Optional<T> lookup(
        final ConcurrentMap<Key, Optional<T>> resolved, final Key key,
        final Function<Key, Optional<T>> find
    ) {
        if (!cache) {
            return find.apply(key);
        }

        return resolved.computeIfAbsent(key, find);
    }

    private Optional<FilterMethod> findFilterMethod(final Key key) {
        for (final Class<?> c : hierarchy(key.getType())) {
            FilterMethod best = null;

            for (final Method method : c.getDeclaredMethods()) {
                if (!isCandidate(method, key.getName())) {
                    continue;
                }

                final Optional<Shape> shape = shapeOf(method, key.getType());

                if (!shape.isPresent()) {
                    continue;
                }

                final FilterMethod candidate = new FilterMethod(method, shape.get());

                if (best == null || isPreferred(candidate, best)) {
                    best = candidate;
                }
            }

            if (best != null) {
                best.getMethod().setAccessible(true);
                return Optional.of(best);
            }
        }

        return Optional.empty();
    }

    private Optional<Method> findEndpointMethod(final Key key) {
        for (final Class<?> c : hierarchy(key.getType())) {
            for (final Method method : c.getDeclaredMethods()) {
                if (isCandidate(method, key.getName()) && method.getParameterCount() == 0) {
                    method.setAccessible(true);
                    return Optional.of(method);
                }
            }
        }

        return Optional.empty();
    }

    /**
     * The types searched for methods of the given class, in order: the class and its
     * superclasses, followed by every interface they implement, most specific first.
     */
    static List<Class<?>> hierarchy(final Class<?> type) {
        final List<Class<?>> classes = new ArrayList<>();

        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            classes.add(c);
        }

        final Set<Class<?>> interfaces = new LinkedHashSet<>();

        for (final Class<?> c : classes) {
            collectInterfaces(c, interfaces);
        }

        return ImmutableList.<Class<?>>builder().addAll(classes).addAll(interfaces).build();
    }

    private static void collectInterfaces(final Class<?> type, final Set<Class<?>> interfaces) {
        for (final Class<?> i : type.getInterfaces()) {
            if (interfaces.add(i)) {
                collectInterfaces(i, interfaces);
            }
        }
    }

    /**
     * If the candidate should be used over the current best method of the same class.
     * <p>
     * Shapes are compared first. Overloads of the same shape prefer the most specific service
     * parameter, and fall back to the name of the parameter type for unrelated types.
     */
    static boolean isPreferred(final FilterMethod candidate, final FilterMethod best) {
        final int shape = candidate.getShape().compareTo(best.getShape());

        if (shape != 0) {
            return shape < 0;
        }

        if (candidate.getMethod().getParameterCount() == 0) {
            return false;
        }

        final Class<?> a = candidate.getMethod().getParameterTypes()[0];
        final Class<?> b = best.getMethod().getParameterTypes()[0];

        if (a == b) {
            return false;
        }

        if (b.isAssignableFrom(a)) {
            return true;
        }

        if (a.isAssignableFrom(b)) {
            return false;
        }

        return a.getName().compareTo(b.getName()) < 0;
    }

    static Optional<Shape> shapeOf(final Method method, final Class<?> type) {
        final Class<?>[] parameters = method.getParameterTypes();

        switch (parameters.length) {
            case 0:
                return Optional.of(Shape.NONE);
            case 1:
                if (parameters[0] == Continuation.class) {
                    return Optional.of(Shape.PROCEED);
                }

                if (parameters[0].isAssignableFrom(type)) {
                    return Optional.of(Shape.SERVICE);
                }

                return Optional.empty();
            case 2:
                if (parameters[0] != Continuation.class && parameters[0].isAssignableFrom(type) &&
                    parameters[1] == Continuation.class) {
                    return Optional.of(Shape.SERVICE_AND_PROCEED);
                }

                return Optional.empty();
            default:
                return Optional.empty();
        }
    }

    private static boolean isCandidate(final Method method, final String name) {
        final int modifiers = method.getModifiers();

        /* abstract interface methods are implemented by one of the classes searched first */
        return method.getName().equals(name) && !Modifier.isStatic(modifiers) &&
            !Modifier.isAbstract(modifiers) && !method.isBridge() && !method.isSynthetic();
    }
}
