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

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;

import com.linecorp.armeria.common.HttpMethod;
import com.linecorp.armeria.common.annotation.Nullable;

import com.linecorp.segmentrouter.RouteTree.Node;
import com.linecorp.segmentrouter.RouteTree.Walk;
import com.linecorp.segmentrouter.RouteTree.WalkState;
import com.linecorp.segmentrouter.internal.PathSegments;

/**
 * Routes an HTTP method and a request path to a registered value. Every HTTP method has its own
 * {@link RouteTree} of path segments.
 *
 * <p>A route path is a sequence of literal segments separated by '/'. A segment that starts with ':'
 * declares a path parameter named by the rest of the segment, e.g. {@code "/users/:id"}. A literal segment
 * always takes precedence over a path parameter at the same position, and a position can only have one
 * parameter name. {@code "/users"} and {@code "/users/"} are two different routes.
 *
 * <pre>{@code
 * SegmentRouter<String> router = SegmentRouter.of();
 * router.get("/users/:id", "user");
 * RoutingResult<String> result = router.find(HttpMethod.GET, "/users/5");
 * assert result.value().equals("user");
 * assert result.pathParams().get("id").equals("5");
 * }</pre>
 *
 * @param <V> the type of the registered values
 */
public final class SegmentRouter<V> {

    private static final Logger logger = LoggerFactory.getLogger(SegmentRouter.class);

    /**
     * Returns a new {@link SegmentRouter} with the default configuration from {@link RouterFlags}.
     */
    public static <V> SegmentRouter<V> of() {
        return SegmentRouter.<V>builder().build();
    }

    /**
     * Returns a new {@link SegmentRouterBuilder}.
     */
    public static <V> SegmentRouterBuilder<V> builder() {
        return new SegmentRouterBuilder<>();
    }

    private final Map<HttpMethod, RouteTree<V>> trees = new EnumMap<>(HttpMethod.class);
    private final boolean redirectTrailingSlash;
    private final boolean concurrentRegistration;
    private final Lock readLock;
    private final Lock writeLock;

    SegmentRouter(boolean redirectTrailingSlash, boolean concurrentRegistration) {
        this.redirectTrailingSlash = redirectTrailingSlash;
        this.concurrentRegistration = concurrentRegistration;
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        readLock = lock.readLock();
        writeLock = lock.writeLock();
    }

    /**
     * Returns whether a request that matches a route except for the trailing slash is redirected.
     */
    public boolean redirectTrailingSlash() {
        return redirectTrailingSlash;
    }

    /**
     * Returns whether routes may be added while requests are being matched.
     */
    public boolean concurrentRegistration() {
        return concurrentRegistration;
    }

    /**
     * Binds the specified {@code value} to the route of the specified {@link HttpMethod} and {@code path}.
     * A value bound to the same route before is replaced. A {@code null} value adds the route without
     * making it matchable, which still affects trailing-slash redirection.
     *
     * @throws InvalidRoutePathException if {@code path} does not start with '/'
     * @throws RouteConflictException if {@code path} declares a path parameter whose name differs from the
     *                                one already declared at the same position. The literal segments
     *                                added before the conflicting position are kept.
     */
    public SegmentRouter<V> add(HttpMethod method, String path, @Nullable V value) {
        requireNonNull(method, "method");
        requireNonNull(path, "path");
        if (path.isEmpty() || path.charAt(0) != PathSegments.SEPARATOR) {
            throw new InvalidRoutePathException(path);
        }

        lockForWrite();
        try {
            trees.computeIfAbsent(method, unused -> new RouteTree<>()).insert(path, value);
        } finally {
            unlockForWrite();
        }
        logger.debug("Added a route: {} {}", method, path);
        return this;
    }

    /**
     * Binds the specified {@code value} to the {@link HttpMethod#GET} route of the specified {@code path}.
     *
     * @see #add(HttpMethod, String, Object)
     */
    public SegmentRouter<V> get(String path, @Nullable V value) {
        return add(HttpMethod.GET, path, value);
    }

    /**
     * Binds the specified {@code value} to the {@link HttpMethod#POST} route of the specified {@code path}.
     *
     * @see #add(HttpMethod, String, Object)
     */
    public SegmentRouter<V> post(String path, @Nullable V value) {
        return add(HttpMethod.POST, path, value);
    }

    /**
     * Binds the specified {@code value} to the {@link HttpMethod#PUT} route of the specified {@code path}.
     *
     * @see #add(HttpMethod, String, Object)
     */
    public SegmentRouter<V> put(String path, @Nullable V value) {
        return add(HttpMethod.PUT, path, value);
    }

    /**
     * Binds the specified {@code value} to the {@link HttpMethod#PATCH} route of the specified {@code path}.
     *
     * @see #add(HttpMethod, String, Object)
     */
    public SegmentRouter<V> patch(String path, @Nullable V value) {
        return add(HttpMethod.PATCH, path, value);
    }

    /**
     * Binds the specified {@code value} to the {@link HttpMethod#DELETE} route of the specified
     * {@code path}.
     *
     * @see #add(HttpMethod, String, Object)
     */
    public SegmentRouter<V> delete(String path, @Nullable V value) {
        return add(HttpMethod.DELETE, path, value);
    }

    /**
     * Binds the specified {@code value} to the {@link HttpMethod#HEAD} route of the specified {@code path}.
     *
     * @see #add(HttpMethod, String, Object)
     */
    public SegmentRouter<V> head(String path, @Nullable V value) {
        return add(HttpMethod.HEAD, path, value);
    }

    /**
     * Binds the specified {@code value} to the {@link HttpMethod#OPTIONS} route of the specified
     * {@code path}.
     *
     * @see #add(HttpMethod, String, Object)
     */
    public SegmentRouter<V> options(String path, @Nullable V value) {
        return add(HttpMethod.OPTIONS, path, value);
    }

    /**
     * Binds the specified {@code value} to the {@link HttpMethod#TRACE} route of the specified {@code path}.
     *
     * @see #add(HttpMethod, String, Object)
     */
    public SegmentRouter<V> trace(String path, @Nullable V value) {
        return add(HttpMethod.TRACE, path, value);
    }

    /**
     * Finds the value bound to the route that matches the specified {@link HttpMethod} and request
     * {@code path}. The routes of the other methods are never consulted.
     *
     * @return a {@link RoutingResult} of {@link RoutingResultType#MATCHED} with the captured
     *         {@link PathParams}, {@link RoutingResultType#REDIRECT} with the path to redirect to if only a
     *         trailing slash differs, or {@link RoutingResultType#NOT_FOUND}
     */
    public RoutingResult<V> find(HttpMethod method, String path) {
        requireNonNull(method, "method");
        requireNonNull(path, "path");
        if (path.isEmpty() || path.charAt(0) != PathSegments.SEPARATOR) {
            return RoutingResult.notFound();
        }

        lockForRead();
        try {
            final RouteTree<V> tree = trees.get(method);
            if (tree == null) {
                return RoutingResult.notFound();
            }
            return find(tree, path);
        } finally {
            unlockForRead();
        }
    }

    private RoutingResult<V> find(RouteTree<V> tree, String path) {
        final Map<String, String> pathParams = new HashMap<>(4);
        final Walk<V> walk = tree.walk(path, pathParams);
        final Node<V> node = walk.node;
        if (walk.state == WalkState.COMPLETED && node != null && node.value != null) {
            return RoutingResult.matched(node.value, PathParams.of(pathParams));
        }
        if (walk.state == WalkState.DEAD_END || !redirectTrailingSlash) {
            return RoutingResult.notFound();
        }

        if (PathSegments.hasTrailingSeparator(path)) {
            final Node<V> previous = walk.previous;
            if (previous != null && previous.value != null) {
                return RoutingResult.redirect(path.substring(0, path.length() - 1));
            }
        } else if (node != null) {
            final Node<V> trailingSlashNode = node.children.get("");
            if (trailingSlashNode != null && trailingSlashNode.value != null) {
                return RoutingResult.redirect(path + PathSegments.SEPARATOR);
            }
        }
        return RoutingResult.notFound();
    }

    /**
     * Dumps the registered routes into the specified {@link OutputStream}, one node per line. The nodes
     * with a value are marked with '*'. The {@link OutputStream} is flushed but not closed.
     */
    public void dump(OutputStream output) {
        requireNonNull(output, "output");
        // Do not close this writer in order to keep output stream open.
        final PrintWriter p = new PrintWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
        lockForRead();
        try {
            trees.forEach((method, tree) -> tree.dump(p, method.name()));
        } finally {
            unlockForRead();
        }
        p.flush();
    }

    private void lockForRead() {
        if (concurrentRegistration) {
            readLock.lock();
        }
    }

    private void unlockForRead() {
        if (concurrentRegistration) {
            readLock.unlock();
        }
    }

    private void lockForWrite() {
        if (concurrentRegistration) {
            writeLock.lock();
        }
    }

    private void unlockForWrite() {
        if (concurrentRegistration) {
            writeLock.unlock();
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("redirectTrailingSlash", redirectTrailingSlash)
                          .add("concurrentRegistration", concurrentRegistration)
                          .toString();
    }
}
