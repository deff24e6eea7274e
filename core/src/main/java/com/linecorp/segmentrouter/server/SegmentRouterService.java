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

import java.io.OutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;

import com.linecorp.armeria.common.HttpMethod;
import com.linecorp.armeria.common.HttpRequest;
import com.linecorp.armeria.common.HttpResponse;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.annotation.Nullable;
import com.linecorp.armeria.server.HttpService;
import com.linecorp.armeria.server.ServiceRequestContext;

import com.linecorp.segmentrouter.RoutingResult;
import com.linecorp.segmentrouter.SegmentRouter;
import com.linecorp.segmentrouter.internal.PathSegments;

/**
 * An {@link HttpService} which dispatches a request to the {@link RoutedService} registered for its method
 * and path. A request that only differs from a route in the trailing slash is redirected with
 * {@code 301 Moved Permanently} for {@code GET} and {@code HEAD}, and with {@code 307 Temporary Redirect}
 * for the other methods so that the client keeps the method and the content. Any other request is
 * answered with {@code 404 Not Found}.
 *
 * <pre>{@code
 * SegmentRouterService router =
 *         SegmentRouterService.of()
 *                             .get("/users/:id", (ctx, req, params) -> HttpResponse.of(params.get("id")))
 *                             .post("/users", RoutedService.of(createUserService));
 * Server.builder()
 *       .serviceUnder("/", router)
 *       .build();
 * }</pre>
 *
 * <p>Routes are matched against {@link ServiceRequestContext#mappedPath()}, so this service can also be
 * bound under a path prefix. Routes may be added while the server is running unless the underlying
 * {@link SegmentRouter} was built with {@code concurrentRegistration(false)}.
 *
 * <p>Literal segments are compared with the path as received, still percent-encoded. The values of
 * {@link com.linecorp.segmentrouter.PathParams} are percent-decoded as UTF-8, so
 * {@code GET /users/caf%C3%A9} yields {@code id=café} and an encoded {@code %2F} ends up as a {@code '/'}
 * inside the value.
 *
 * <p>Note that Armeria merges repeated slashes in a request path before it reaches any service, so
 * {@code GET /a//b} is routed as {@code /a/b}. A route with an empty inner segment, such as
 * {@code "/a//b"}, can still be registered and looked up with
 * {@link SegmentRouter#find(HttpMethod, String)}, but it is never reached over HTTP.
 */
public final class SegmentRouterService implements HttpService {

    private static final Logger logger = LoggerFactory.getLogger(SegmentRouterService.class);

    /**
     * Returns a new {@link SegmentRouterService} backed by a {@link SegmentRouter} with the default
     * configuration.
     */
    public static SegmentRouterService of() {
        return new SegmentRouterService(SegmentRouter.of());
    }

    /**
     * Returns a new {@link SegmentRouterService} backed by the specified {@link SegmentRouter}.
     */
    public static SegmentRouterService of(SegmentRouter<RoutedService> router) {
        return new SegmentRouterService(router);
    }

    private final SegmentRouter<RoutedService> router;

    private SegmentRouterService(SegmentRouter<RoutedService> router) {
        this.router = requireNonNull(router, "router");
    }

    /**
     * Returns the {@link SegmentRouter} that holds the routes of this service.
     */
    public SegmentRouter<RoutedService> router() {
        return router;
    }

    /**
     * Registers the specified {@link RoutedService} to the route of the specified {@link HttpMethod} and
     * {@code path}. See {@link SegmentRouter#add(HttpMethod, String, Object)}.
     */
    public SegmentRouterService add(HttpMethod method, String path, @Nullable RoutedService service) {
        router.add(method, path, service);
        return this;
    }

    public SegmentRouterService get(String path, @Nullable RoutedService service) {
        return add(HttpMethod.GET, path, service);
    }

    public SegmentRouterService post(String path, @Nullable RoutedService service) {
        return add(HttpMethod.POST, path, service);
    }

    public SegmentRouterService put(String path, @Nullable RoutedService service) {
        return add(HttpMethod.PUT, path, service);
    }

    public SegmentRouterService patch(String path, @Nullable RoutedService service) {
        return add(HttpMethod.PATCH, path, service);
    }

    public SegmentRouterService delete(String path, @Nullable RoutedService service) {
        return add(HttpMethod.DELETE, path, service);
    }

    public SegmentRouterService head(String path, @Nullable RoutedService service) {
        return add(HttpMethod.HEAD, path, service);
    }

    public SegmentRouterService options(String path, @Nullable RoutedService service) {
        return add(HttpMethod.OPTIONS, path, service);
    }

    public SegmentRouterService trace(String path, @Nullable RoutedService service) {
        return add(HttpMethod.TRACE, path, service);
    }

    @Override
    public HttpResponse serve(ServiceRequestContext ctx, HttpRequest req) throws Exception {
        final HttpMethod method = ctx.method();
        final String mappedPath = ctx.mappedPath();
        final RoutingResult<RoutedService> result = router.find(method, mappedPath);
        switch (result.type()) {
            case MATCHED:
                return result.value().serve(ctx, req, result.pathParams());
            case REDIRECT:
                final String location = redirectLocation(ctx.path(), mappedPath, result.redirectPath());
                final HttpStatus status = redirectStatus(method);
                logger.debug("{} Redirecting to {} ({})", ctx, location, status);
                return HttpResponse.ofRedirect(status, location);
            default:
                logger.debug("{} No route for {} {}", ctx, method, mappedPath);
                return HttpResponse.of(HttpStatus.NOT_FOUND);
        }
    }

    /**
     * Dumps the routes of this service. See {@link SegmentRouter#dump(OutputStream)}.
     */
    public void dump(OutputStream output) {
        router.dump(output);
    }

    @VisibleForTesting
    static HttpStatus redirectStatus(HttpMethod method) {
        return method == HttpMethod.GET || method == HttpMethod.HEAD ? HttpStatus.MOVED_PERMANENTLY
                                                                     : HttpStatus.TEMPORARY_REDIRECT;
    }

    /**
     * Applies the trailing slash change between {@code mappedPath} and {@code redirectPath} to the full
     * request {@code path}, which may start with the prefix this service is bound under.
     */
    @VisibleForTesting
    static String redirectLocation(String path, String mappedPath, String redirectPath) {
        if (redirectPath.length() > mappedPath.length()) {
            return path + PathSegments.SEPARATOR;
        }
        return path.substring(0, path.length() - 1);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("router", router)
                          .toString();
    }
}
