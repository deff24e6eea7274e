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

import static java.util.Objects.requireNonNull;

import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import com.linecorp.armeria.common.annotation.Nullable;

/**
 * The path parameters captured while matching a single request, e.g. {@code {id=5}} for the request path
 * {@code "/users/5"} against the route {@code "/users/:id"}. An instance is created per match and is
 * never shared between requests.
 */
public final class PathParams {

    private static final PathParams EMPTY = new PathParams(ImmutableMap.of());

    /**
     * Returns an empty {@link PathParams}.
     */
    public static PathParams of() {
        return EMPTY;
    }

    /**
     * Returns a {@link PathParams} which contains a copy of the specified {@code params}.
     */
    public static PathParams of(Map<String, String> params) {
        requireNonNull(params, "params");
        if (params.isEmpty()) {
            return EMPTY;
        }
        return new PathParams(ImmutableMap.copyOf(params));
    }

    private final Map<String, String> params;

    private PathParams(Map<String, String> params) {
        this.params = params;
    }

    /**
     * Returns the value captured for the parameter with the specified {@code name}, or {@code null} if
     * the matched route does not declare it.
     */
    @Nullable
    public String get(String name) {
        requireNonNull(name, "name");
        return params.get(name);
    }

    /**
     * Returns the value captured for the parameter with the specified {@code name}, or
     * {@code defaultValue} if the matched route does not declare it.
     */
    public String get(String name, String defaultValue) {
        requireNonNull(defaultValue, "defaultValue");
        final String value = get(name);
        return value != null ? value : defaultValue;
    }

    /**
     * Returns whether a value was captured for the parameter with the specified {@code name}.
     */
    public boolean contains(String name) {
        requireNonNull(name, "name");
        return params.containsKey(name);
    }

    public int size() {
        return params.size();
    }

    public boolean isEmpty() {
        return params.isEmpty();
    }

    /**
     * Returns an immutable {@link Map} view of the captured parameters.
     */
    public Map<String, String> asMap() {
        return params;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PathParams)) {
            return false;
        }
        return params.equals(((PathParams) o).params);
    }

    @Override
    public int hashCode() {
        return params.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).addValue(params).toString();
    }
}
