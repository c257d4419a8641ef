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

/**
 * How a service class relates to the filters declared on its superclasses.
 */
public enum InheritanceMode {
    /**
     * Every class has its own, independent set of filters.
     */
    NONE,
    /**
     * A class starts out with a copy of the filters of its nearest configured ancestor, taken
     * when its registry is first requested through {@link ServiceFilterTable#forClass(Class)}.
     * Later changes to the ancestor are not seen.
     * <p>
     * A class whose registry is never requested runs with the filters of its nearest configured
     * ancestor.
     */
    SNAPSHOT
}
