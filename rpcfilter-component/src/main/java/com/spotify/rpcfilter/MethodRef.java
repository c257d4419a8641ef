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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import lombok.Data;

/**
 * Names an instance method of the service, resolved when the filter is invoked.
 */
@Data
public final class MethodRef implements CallableRef {
    private final String name;

    public MethodRef(final String name) {
        checkNotNull(name, "name");
        checkArgument(!name.isEmpty(), "method name must not be empty");
        this.name = name;
    }

    @Override
    public <R> R visit(final Visitor<R> visitor) {
        return visitor.visitMethod(this);
    }

    @Override
    public String toString() {
        return "#" + name;
    }
}
