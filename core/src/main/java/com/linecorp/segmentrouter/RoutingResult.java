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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;

import com.linecorp.armeria.common.annotation.Nullable;

/**
 * The result of {@link SegmentRouter#find(com.linecorp.armeria.common.HttpMethod, String)}.
 *
 * @param <V> the type of the values registered to the router
 */
public final class RoutingResult<V> {

    private static final RoutingResult<?> NOT_FOUND =
            new RoutingResult<>(RoutingResultType.NOT_FOUND, null, null, PathParams.of());

    /**
     * Returns the {@link RoutingResult} that signals that no route was found.
     */
    @SuppressWarnings("unchecked")
    public static <V> RoutingResult<V> notFound() {
        return (RoutingResult<V>) NOT_FOUND;
    }

    static <V> RoutingResult<V> matched(V value, PathParams pathParams) {
        return new RoutingResult<>(RoutingResultType.MATCHED, requireNonNull(value, "value"), null,
                                   requireNonNull(pathParams, "pathParams"));
    }

    static <V> RoutingResult<V> redirect(String redirectPath) {
        return new RoutingResult<>(RoutingResultType.REDIRECT, null,
                                   requireNonNull(redirectPath, "redirectPath"), PathParams.of());
    }

    private final RoutingResultType type;
    @Nullable
    private final V value;
    @Nullable
    private final String redirectPath;
    private final PathParams pathParams;

    private RoutingResult(RoutingResultType type, @Nullable V value, @Nullable String redirectPath,
                          PathParams pathParams) {
        this.type = type;
        this.value = value;
        this.redirectPath = redirectPath;
        this.pathParams = pathParams;
    }

    public RoutingResultType type() {
        return type;
    }

    /**
     * Returns whether a route matched the request path.
     */
    public boolean isMatched() {
        return type == RoutingResultType.MATCHED;
    }

    /**
     * Returns whether the request should be redirected to {@link #redirectPath()}.
     */
    public boolean isRedirect() {
        return type == RoutingResultType.REDIRECT;
    }

    /**
     * Returns the value of the matched route.
     *
     * @throws IllegalStateException if this result is not {@link RoutingResultType#MATCHED}
     */
    public V value() {
        checkState(value != null, "not matched: %s", type);
        return value;
    }

    /**
     * Returns the path the request should be redirected to.
     *
     * @throws IllegalStateException if this result is not {@link RoutingResultType#REDIRECT}
     */
    public String redirectPath() {
        checkState(redirectPath != null, "not a redirect: %s", type);
        return redirectPath;
    }

    /**
     * Returns the path parameters captured by the matched route. Empty unless this result is
     * {@link RoutingResultType#MATCHED}.
     */
    public PathParams pathParams() {
        return pathParams;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .omitNullValues()
                          .add("type", type)
                          .add("value", value)
                          .add("redirectPath", redirectPath)
                          .add("pathParams", pathParams.isEmpty() ? null : pathParams)
                          .toString();
    }
}
