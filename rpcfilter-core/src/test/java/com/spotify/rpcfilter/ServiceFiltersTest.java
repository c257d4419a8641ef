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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class ServiceFiltersTest {
    @Test
    public void testAllPhasesRun() throws Exception {
        final ServiceFilters filters = ServiceFilters.create();
        WorkService.configure(filters);

        final WorkService service = new WorkService(filters);
        final FilterOutcome outcome = service.runFilters("doWork");

        assertEquals(FilterOutcome.State.DONE, outcome.getState());
        assertEquals("worked", outcome.getValue());
        assertEquals(
            ImmutableList.of("check_auth", "time_it-pre", "do_work", "time_it-post", "log_call"),
            service.calls);
        assertTrue(service.elapsed >= 0);
    }

    @Test
    public void testStoppedByBeforeFilter() throws Exception {
        final ServiceFilters filters = ServiceFilters.create();
        WorkService.configure(filters);

        final WorkService service = new WorkService(filters);
        service.authorized = false;

        final FilterOutcome outcome = service.runFilters("doWork");

        assertTrue(outcome.isStopped());
        assertEquals(CallableRef.method("checkAuth"),
            outcome.getHaltedBy().get().getCallable());
        assertEquals(ImmutableList.of("check_auth"), service.calls);
        assertEquals(-1L, service.elapsed);
    }

    @Test
    public void testExceptedEndpoint() throws Exception {
        final ServiceFilters filters = ServiceFilters.create();
        WorkService.configure(filters);

        final WorkService service = new WorkService(filters);
        service.runFilters("ping");

        assertEquals(ImmutableList.of("check_auth", "time_it-pre", "ping", "time_it-post"),
            service.calls);
    }

    @Test
    public void testUnconfiguredService() throws Exception {
        final ServiceFilters filters = ServiceFilters.create();
        final WorkService service = new WorkService(filters);

        assertEquals("worked", service.runFilters("doWork").getValue());
        assertEquals(ImmutableList.of("do_work"), service.calls);
        assertTrue(filters.filtersOf(WorkService.class).filters(FilterType.BEFORE).isEmpty());
    }

    @Test(expected = UnknownEndpointException.class)
    public void testUnknownEndpoint() throws Exception {
        final ServiceFilters filters = ServiceFilters.create();
        new WorkService(filters).runFilters("doesNotExist");
    }

    @Test
    public void testFiltersAreNotInheritedByDefault() throws Exception {
        final ServiceFilters filters = ServiceFilters.create();
        WorkService.configure(filters);

        final AuditedService service = new AuditedService(filters);
        service.runFilters("doWork");

        assertEquals(ImmutableList.of("do_work"), service.calls);
    }

    @Test
    public void testSnapshotInheritance() throws Exception {
        final ServiceFilters filters = new ServiceFilters(
            FiltersConfig.builder().inheritance(InheritanceMode.SNAPSHOT).build());
        WorkService.configure(filters);
        filters.forClass(AuditedService.class).afterFilter("audit");

        final AuditedService audited = new AuditedService(filters);
        audited.runFilters("doWork");

        assertEquals(
            ImmutableList.of("check_auth", "time_it-pre", "do_work", "time_it-post", "log_call",
                "audit"), audited.calls);

        final QuietService quiet = new QuietService(filters);
        quiet.runFilters("doWork");

        assertEquals(
            ImmutableList.of("check_auth", "time_it-pre", "do_work", "time_it-post", "log_call"),
            quiet.calls);
    }

    @Test
    public void testSnapshotThroughUndeclaredIntermediate() throws Exception {
        final ServiceFilters filters = new ServiceFilters(
            FiltersConfig.builder().inheritance(InheritanceMode.SNAPSHOT).build());
        WorkService.configure(filters);
        filters.forClass(TracedService.class).beforeFilter("trace");

        final TracedService traced = new TracedService(filters);
        final FilterOutcome outcome = filters.run("doWork", traced);

        assertEquals(FilterOutcome.State.DONE, outcome.getState());
        assertEquals("worked", outcome.getValue());
        assertEquals(
            ImmutableList.of("check_auth", "trace", "time_it-pre", "do_work", "time_it-post",
                "log_call"), traced.calls);

        final QuietService quiet = new QuietService(filters);
        filters.run("doWork", quiet);

        assertEquals(
            ImmutableList.of("check_auth", "time_it-pre", "do_work", "time_it-post", "log_call"),
            quiet.calls);
    }

    @Test(expected = IllegalStateException.class)
    public void testSealOnFirstRun() throws Exception {
        final ServiceFilters filters =
            new ServiceFilters(FiltersConfig.builder().sealOnFirstRun(true).build());
        final FilterRegistry registry = WorkService.configure(filters);

        assertFalse(filters.isSealed());
        new WorkService(filters).runFilters("doWork");
        assertTrue(filters.isSealed());

        registry.beforeFilter("audit");
    }

    @Test(expected = IllegalStateException.class)
    public void testSeal() {
        final ServiceFilters filters = ServiceFilters.create();
        WorkService.configure(filters);

        filters.seal();
        filters.forClass(AuditedService.class);
    }

    static class WorkService extends AbstractFilteredService {
        final List<String> calls = new ArrayList<>();

        boolean authorized = true;
        long elapsed = -1L;

        WorkService(final ServiceFilters filters) {
            super(filters);
        }

        static FilterRegistry configure(final ServiceFilters filters) {
            return filters
                .forClass(WorkService.class)
                .beforeFilter("checkAuth")
                .aroundFilter("timeIt")
                .afterFilter(FilterRegistry.methods("logCall"),
                    FilterOptions.builder().except("ping").build());
        }

        String doWork() {
            calls.add("do_work");
            return "worked";
        }

        String ping() {
            calls.add("ping");
            return "pong";
        }

        private boolean checkAuth() {
            calls.add("check_auth");
            return authorized;
        }

        private Object timeIt(final Continuation proceed) throws Exception {
            calls.add("time_it-pre");
            final long start = System.nanoTime();

            try {
                return proceed.proceed();
            } finally {
                elapsed = System.nanoTime() - start;
                calls.add("time_it-post");
            }
        }

        private void logCall(final WorkService self) {
            self.calls.add("log_call");
        }
    }

    static class AuditedService extends WorkService {
        AuditedService(final ServiceFilters filters) {
            super(filters);
        }

        void audit() {
            calls.add("audit");
        }
    }

    static class QuietService extends WorkService {
        QuietService(final ServiceFilters filters) {
            super(filters);
        }
    }

    static class TracedService extends QuietService {
        TracedService(final ServiceFilters filters) {
            super(filters);
        }

        void trace() {
            calls.add("trace");
        }
    }
}
