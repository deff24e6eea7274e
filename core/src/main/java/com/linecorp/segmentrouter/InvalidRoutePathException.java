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
 * An {@link IllegalArgumentException} raised when a route path does not start with {@code '/'}.
 * The router is left untouched when this exception is raised.
 */
public final class InvalidRoutePathException extends IllegalArgumentException {

    private static final long serialVersionUID = 3150270478235620394L;

    private final String path;

    /**
     * Creates a new instance for the specified invalid {@code path}.
     */
    public InvalidRoutePathException(String path) {
        super("A route path must start with '/': " + path);
        this.path = path;
    }

    /**
     * Returns the rejected path.
     */
    public String path() {
        return path;
    }
}
