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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;

public class FiltersConfigTest {
    @Test
    public void testDefaults() {
        final FiltersConfig config = FiltersConfig.defaults();

        assertEquals(InheritanceMode.NONE, config.getInheritance());
        assertFalse(config.isSealOnFirstRun());
        assertTrue(config.isCacheMethodLookups());
    }

    @Test
    public void testReadEmpty() throws IOException {
        assertEquals(FiltersConfig.defaults(), read("{}"));
    }

    @Test
    public void testRead() throws IOException {
        final FiltersConfig config = read(
            "{\"inheritance\": \"SNAPSHOT\", \"sealOnFirstRun\": true, " +
                "\"cacheMethodLookups\": false}");

        assertEquals(InheritanceMode.SNAPSHOT, config.getInheritance());
        assertTrue(config.isSealOnFirstRun());
        assertFalse(config.isCacheMethodLookups());
    }

    @Test
    public void testReadFromResource() throws IOException {
        try (final InputStream input = getClass().getResourceAsStream("/filters.json")) {
            final FiltersConfig config = FiltersConfig.read(input);

            assertEquals(InheritanceMode.SNAPSHOT, config.getInheritance());
            assertTrue(config.isSealOnFirstRun());
            assertTrue(config.isCacheMethodLookups());
        }
    }

    @Test
    public void testBuilder() {
        final FiltersConfig config = FiltersConfig
            .builder()
            .inheritance(InheritanceMode.SNAPSHOT)
            .sealOnFirstRun(true)
            .build();

        assertEquals(InheritanceMode.SNAPSHOT, config.getInheritance());
        assertTrue(config.isSealOnFirstRun());
        assertTrue(config.isCacheMethodLookups());
    }

    @Test(expected = UnrecognizedPropertyException.class)
    public void testUnknownProperty() throws IOException {
        read("{\"inherit\": \"SNAPSHOT\"}");
    }

    private FiltersConfig read(final String json) throws IOException {
        return FiltersConfig.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }
}
