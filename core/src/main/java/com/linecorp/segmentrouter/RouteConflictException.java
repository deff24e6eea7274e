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
 * An {@link IllegalStateException} raised when a route declares a path parameter whose name differs from
 * the one already bound at the same position, e.g. {@code "/:bar"} after {@code "/:foo"}.
 *
 * <p>Registration is not atomic. The literal segments created before the conflicting parameter was
 * reached stay in the router, but no value is bound for the rejected route.
 */
public final class RouteConflictException extends IllegalStateException {

    private static final long serialVersionUID = -5390735166472211380L;

    private final String path;
    private final String existingName;
    private final String conflictingName;

    /**
     * Creates a new instance.
     *
     * @param path the route path being registered
     * @param existingName the name of the parameter already bound at the conflicting position
     * @param conflictingName the name declared by {@code path} at the same position
     */
    public RouteConflictException(String path, String existingName, String conflictingName) {
        super("Path parameter ':" + conflictingName + "' of '" + path +
              "' is already defined as ':" + existingName + '\'');
        this.path = path;
        this.existingName = existingName;
        this.conflictingName = conflictingName;
    }

    /**
     * Returns the route path whose registration failed.
     */
    public String path() {
        return path;
    }

    /**
     * Returns the parameter name that was bound first.
     */
    public String existingName() {
        return existingName;
    }

    /**
     * Returns the parameter name that was rejected.
     */
    public String conflictingName() {
        return conflictingName;
    }
}
