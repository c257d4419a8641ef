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

import lombok.Getter;

/**
 * Thrown when a filter, or one of its conditions, references something which can not be called
 * on the service it runs against.
 * <p>
 * References are validated lazily, so this is raised when the endpoint is invoked and the filter
 * applies, never when the filter is declared.
 */
public class InvalidFilterException extends RuntimeException {
    @Getter
    private final CallableRef reference;

    public InvalidFilterException(final CallableRef reference, final String message) {
        super(message);
        this.reference = reference;
    }

    public InvalidFilterException(
        final CallableRef reference, final String message, final Throwable cause
    ) {
        super(message, cause);
        this.reference = reference;
    }
}
