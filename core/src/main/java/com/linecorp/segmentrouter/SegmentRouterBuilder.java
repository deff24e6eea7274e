/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package com.linecorp.segmentrouter;

/**
 * Builds a new {@link SegmentRouter}.
 *
 * @param <V> the type of the values to register
 */
public final class SegmentRouterBuilder<V> {

    private boolean redirectTrailingSlash = RouterFlags.redirectTrailingSlash();
    private boolean concurrentRegistration = RouterFlags.concurrentRegistration();

    SegmentRouterBuilder() {}

    /**
     * Sets whether a request is redirected when it matches a route except for the trailing slash.
     * If enabled and {@code "/foo"} is registered, {@code "/foo/"} is redirected to {@code "/foo"}.
     * If {@code "/foo/"} is registered, {@code "/foo"} is redirected to {@code "/foo/"}. If both are
     * registered, no redirection occurs. Enabled by default.
     */
    public SegmentRouterBuilder<V> redirectTrailingSlash(boolean redirectTrailingSlash) {
        this.redirectTrailingSlash = redirectTrailingSlash;
        return this;
    }

    /**
     * Sets whether routes may be added while the router is matching requests. Enabled by default, in which
     * case every registration takes a write lock and every lookup takes a read lock.
     *
     * <p>Disable this only if every route is added before the router starts serving, e.g. while a server is
     * being set up on a single thread. No lock is taken on the request path then, and adding a route
     * concurrently with a lookup is a data race with undefined results.
     */
    public SegmentRouterBuilder<V> concurrentRegistration(boolean concurrentRegistration) {
        this.concurrentRegistration = concurrentRegistration;
        return this;
    }

    /**
     * Returns a newly-created {@link SegmentRouter} with no routes.
     */
    public SegmentRouter<V> build() {
        return new SegmentRouter<>(redirectTrailingSlash, concurrentRegistration);
    }
}
