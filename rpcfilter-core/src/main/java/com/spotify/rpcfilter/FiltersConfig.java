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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import lombok.Data;

@Data
public class FiltersConfig {
    public static final InheritanceMode DEFAULT_INHERITANCE = InheritanceMode.NONE;
    public static final boolean DEFAULT_SEAL_ON_FIRST_RUN = false;
    public static final boolean DEFAULT_CACHE_METHOD_LOOKUPS = true;

    private final InheritanceMode inheritance;
    private final boolean sealOnFirstRun;
    private final boolean cacheMethodLookups;

    @JsonCreator
    public FiltersConfig(
        @JsonProperty("inheritance") final Optional<InheritanceMode> inheritance,
        @JsonProperty("sealOnFirstRun") final Optional<Boolean> sealOnFirstRun,
        @JsonProperty("cacheMethodLookups") final Optional<Boolean> cacheMethodLookups
    ) {
        this.inheritance = orElse(inheritance, DEFAULT_INHERITANCE);
        this.sealOnFirstRun = orElse(sealOnFirstRun, DEFAULT_SEAL_ON_FIRST_RUN);
        this.cacheMethodLookups = orElse(cacheMethodLookups, DEFAULT_CACHE_METHOD_LOOKUPS);
    }

    public static FiltersConfig defaults() {
        return builder().build();
    }

    /**
     * Read configuration from a JSON document.
     */
    public static FiltersConfig read(final InputStream input) throws IOException {
        return mapper().readValue(input, FiltersConfig.class);
    }

    public static ObjectMapper mapper() {
        final ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new Jdk8Module());
        return mapper;
    }

    public static Builder builder() {
        return new Builder();
    }

    /* absent creator properties may be bound as null instead of empty */
    private static <T> T orElse(final Optional<T> value, final T defaultValue) {
        if (value == null) {
            return defaultValue;
        }

        return value.orElse(defaultValue);
    }

    public static class Builder {
        private Optional<InheritanceMode> inheritance = Optional.empty();
        private Optional<Boolean> sealOnFirstRun = Optional.empty();
        private Optional<Boolean> cacheMethodLookups = Optional.empty();

        /**
         * How service classes see the filters of their superclasses.
         */
        public Builder inheritance(final InheritanceMode inheritance) {
            this.inheritance = Optional.of(inheritance);
            return this;
        }

        /**
         * Seal all filter declarations when the first endpoint is run.
         */
        public Builder sealOnFirstRun(final boolean sealOnFirstRun) {
            this.sealOnFirstRun = Optional.of(sealOnFirstRun);
            return this;
        }

        /**
         * Remember which method a method reference resolved to, per service class.
         */
        public Builder cacheMethodLookups(final boolean cacheMethodLookups) {
            this.cacheMethodLookups = Optional.of(cacheMethodLookups);
            return this;
        }

        public FiltersConfig build() {
            return new FiltersConfig(inheritance, sealOnFirstRun, cacheMethodLookups);
        }
    }
}
