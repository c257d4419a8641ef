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

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class ConditionEvaluatorTest {
    @Mock
    private CallableResolver resolver;

    private final Object instance = new Object();
    private final CallableRef condition = CallableRef.method("condition");

    private ConditionEvaluator conditions;

    @Before
    public void setup() {
        conditions = new ConditionEvaluator(resolver);
    }

    @Test
    public void testNoOptionsAlwaysApplies() throws Exception {
        assertTrue(conditions.shouldInvoke("x", filter(FilterOptions.empty()), instance));
        verifyNoInteractions(resolver);
    }

    @Test
    public void testOnly() throws Exception {
        final FilterDefinition filter = filter(FilterOptions.builder().only("x").build());

        assertTrue(conditions.shouldInvoke("x", filter, instance));
        assertFalse(conditions.shouldInvoke("y", filter, instance));
    }

    @Test
    public void testExcept() throws Exception {
        final FilterDefinition filter = filter(FilterOptions.builder().except("x").build());

        assertFalse(conditions.shouldInvoke("x", filter, instance));
        assertTrue(conditions.shouldInvoke("y", filter, instance));
    }

    @Test
    public void testOnlyAndExcept() throws Exception {
        final FilterDefinition filter =
            filter(FilterOptions.builder().only("x", "y").except("y").build());

        assertTrue(conditions.shouldInvoke("x", filter, instance));
        assertFalse(conditions.shouldInvoke("y", filter, instance));
        assertFalse(conditions.shouldInvoke("z", filter, instance));
    }

    @Test
    public void testIf() throws Exception {
        when(resolver.invoke(condition, instance, Continuation.none())).thenReturn(true, false);

        final FilterDefinition filter =
            filter(FilterOptions.builder().ifCondition(condition).build());

        assertTrue(conditions.shouldInvoke("x", filter, instance));
        assertFalse(conditions.shouldInvoke("x", filter, instance));
    }

    @Test
    public void testUnless() throws Exception {
        when(resolver.invoke(condition, instance, Continuation.none())).thenReturn(true, false);

        final FilterDefinition filter =
            filter(FilterOptions.builder().unlessCondition(condition).build());

        assertFalse(conditions.shouldInvoke("x", filter, instance));
        assertTrue(conditions.shouldInvoke("x", filter, instance));
    }

    @Test
    public void testIfAndUnless() throws Exception {
        final CallableRef unless = CallableRef.method("unless");

        when(resolver.invoke(condition, instance, Continuation.none())).thenReturn(true);
        when(resolver.invoke(unless, instance, Continuation.none())).thenReturn(null);

        final FilterDefinition filter = filter(
            FilterOptions.builder().ifCondition(condition).unlessCondition(unless).build());

        assertTrue(conditions.shouldInvoke("x", filter, instance));
    }

    @Test
    public void testConditionsNotCalledForExcludedEndpoint() throws Exception {
        final FilterDefinition filter =
            filter(FilterOptions.builder().only("x").ifCondition(condition).build());

        assertFalse(conditions.shouldInvoke("y", filter, instance));
        verify(resolver, never()).invoke(any(), any(), any());
    }

    @Test
    public void testTruthValues() {
        assertTrue(ConditionEvaluator.isTrue(Boolean.TRUE));
        assertTrue(ConditionEvaluator.isTrue("no"));
        assertTrue(ConditionEvaluator.isTrue(0));
        assertFalse(ConditionEvaluator.isTrue(Boolean.FALSE));
        assertFalse(ConditionEvaluator.isTrue(null));
    }

    private FilterDefinition filter(final FilterOptions options) {
        return new FilterDefinition(FilterType.BEFORE, CallableRef.method("filter"), options);
    }
}
