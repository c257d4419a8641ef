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
import static com.google.common.base.Preconditions.checkState;

import com.spotify.rpcfilter.function.NullaryFilter;
import com.spotify.rpcfilter.function.UnaryFilter;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A directly invocable unit of code.
 * <p>
 * Two references are equal if they wrap the same unit, compared by identity for lambdas.
 */
@EqualsAndHashCode(of = "unit")
public final class InvocableRef implements CallableRef {
    public enum Arity {
        NULLARY, UNARY
    }

    @Getter
    private final Object unit;
    @Getter
    private final Arity arity;

    private final NullaryFilter nullary;
    private final UnaryFilter<Object> unary;

    private InvocableRef(
        final Object unit, final Arity arity, final NullaryFilter nullary,
        final UnaryFilter<Object> unary
    ) {
        this.unit = checkNotNull(unit, "unit");
        this.arity = arity;
        this.nullary = nullary;
        this.unary = unary;
    }

    static InvocableRef nullary(final Object unit, final NullaryFilter filter) {
        return new InvocableRef(unit, Arity.NULLARY, checkNotNull(filter, "filter"), null);
    }

    @SuppressWarnings("unchecked")
    static <S> InvocableRef unary(final Object unit, final UnaryFilter<S> filter) {
        return new InvocableRef(unit, Arity.UNARY, null,
            (UnaryFilter<Object>) checkNotNull(filter, "filter"));
    }

    public NullaryFilter nullary() {
        checkState(arity == Arity.NULLARY, "not a nullary reference: %s", this);
        return nullary;
    }

    public UnaryFilter<Object> unary() {
        checkState(arity == Arity.UNARY, "not a unary reference: %s", this);
        return unary;
    }

    @Override
    public <R> R visit(final Visitor<R> visitor) {
        return visitor.visitInvocable(this);
    }

    @Override
    public String toString() {
        return "InvocableRef(" + arity + ", " + unit + ")";
    }
}
