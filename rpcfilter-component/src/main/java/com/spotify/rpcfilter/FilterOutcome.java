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
import lombok.AccessLevel;
import lombok.Data;
import lombok.RequiredArgsConstructor;

/**
 * The result of running the filters of an endpoint.
 */
@Data
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class FilterOutcome {
    public enum State {
        /**
         * A before filter halted the invocation, the endpoint did not run.
         */
        STOPPED,
        /**
         * All phases ran to completion.
         */
        DONE
    }

    private final String endpoint;
    private final State state;
    private final Optional<FilterDefinition> haltedBy;
    /* value returned by the outermost link of the around chain, null when stopped */
    private final Object value;

    public static FilterOutcome stopped(final String endpoint, final FilterDefinition haltedBy) {
        return new FilterOutcome(endpoint, State.STOPPED, Optional.of(haltedBy), null);
    }

    public static FilterOutcome done(final String endpoint, final Object value) {
        return new FilterOutcome(endpoint, State.DONE, Optional.empty(), value);
    }

    public boolean isStopped() {
        return state == State.STOPPED;
    }
}
