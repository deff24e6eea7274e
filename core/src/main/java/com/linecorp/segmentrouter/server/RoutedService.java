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
package com.linecorp.segmentrouter.server;

import static java.util.Objects.requireNonNull;

import com.linecorp.armeria.common.HttpRequest;
import com.linecorp.armeria.common.HttpResponse;
import com.linecorp.armeria.server.HttpService;
import com.linecorp.armeria.server.ServiceRequestContext;

import com.linecorp.segmentrouter.PathParams;

/**
 * A handler registered to a {@link SegmentRouterService}. Unlike {@link HttpService}, it receives the
 * {@link PathParams} captured from the request path.
 */
@FunctionalInterface
public interface RoutedService {

    /**
     * Returns a {@link RoutedService} which ignores the {@link PathParams} and delegates to the specified
     * {@link HttpService}.
     */
    static RoutedService of(HttpService service) {
        requireNonNull(service, "service");
        return (ctx, req, pathParams) -> service.serve(ctx, req);
    }

    /**
     * Serves an incoming {@link HttpRequest} matched by a route.
     *
     * @param ctx the context of the received {@link HttpRequest}
     * @param req the received {@link HttpRequest}
     * @param pathParams the path parameters captured for {@code req}, valid only for this invocation
     *
     * @return the {@link HttpResponse}
     */
    HttpResponse serve(ServiceRequestContext ctx, HttpRequest req, PathParams pathParams) throws Exception;
}
