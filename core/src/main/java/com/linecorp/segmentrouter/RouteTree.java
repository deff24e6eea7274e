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

import java.io.PrintWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSortedMap;

import com.linecorp.armeria.common.annotation.Nullable;

import com.linecorp.segmentrouter.internal.PathSegments;

/**
 * A mutable tree of path segments for a single HTTP method. Every node has literal children keyed by the
 * exact segment string and at most one parameter child, which is taken when no literal child matches.
 *
 * {@link RouteTree} uses the character ':' at the start of a segment to declare a path parameter.
 * For example,
 * <ul>
 *     <li>"/users" exactly matches the request path</li>
 *     <li>"/users/" matches only the request path with the trailing slash</li>
 *     <li>"/users/:id/books" matches the request paths like "/users/1/books" and "/users/bob/books"</li>
 * </ul>
 *
 * <p>This class is not thread-safe. {@link SegmentRouter} guards it.
 *
 * @param <V> Value type of {@link RouteTree}.
 */
final class RouteTree<V> {

    static final char PARAMETER_SIGIL = ':';

    private final Node<V> root = new Node<>();

    /**
     * Binds the specified {@code value} to the node designated by {@code path}, creating the missing
     * nodes on the way. A previously bound value is replaced.
     *
     * @param path a path that starts with '/'
     * @throws RouteConflictException if {@code path} declares a parameter whose name differs from the one
     *                                already bound at the same position. The nodes created before the
     *                                conflict was found are kept.
     */
    void insert(String path, @Nullable V value) {
        Node<V> current = root;
        for (String segment : PathSegments.split(path.substring(1))) {
            if (isParameter(segment)) {
                final String name = segment.substring(1);
                if (current.parameterChild == null) {
                    current.parameterName = name;
                    current.parameterChild = new Node<>();
                } else if (!name.equals(current.parameterName)) {
                    assert current.parameterName != null;
                    throw new RouteConflictException(path, current.parameterName, name);
                }
                current = current.parameterChild;
            } else {
                current = current.children.computeIfAbsent(segment, unused -> new Node<>());
            }
        }
        current.value = value;
    }

    /**
     * Walks down the tree along the specified {@code path}. A literal child is always preferred over the
     * parameter child. The parameters captured on the way are percent-decoded and put into
     * {@code pathParams}. Segments are split before decoding, so {@code %2F} never acts as a separator.
     *
     * @param path a path that starts with '/'
     */
    Walk<V> walk(String path, Map<String, String> pathParams) {
        final List<String> segments = PathSegments.split(path.substring(1));
        Node<V> current = root;
        Node<V> previous = null;
        for (int i = 0; i < segments.size(); i++) {
            final String segment = segments.get(i);
            previous = current;
            final Node<V> child = current.children.get(segment);
            if (child != null) {
                current = child;
                continue;
            }

            final Node<V> parameterChild = current.parameterChild;
            if (parameterChild != null && !segment.isEmpty()) {
                assert current.parameterName != null;
                pathParams.put(current.parameterName, PathSegments.decode(segment));
                current = parameterChild;
                continue;
            }

            // Dead end. Only the empty segment after a trailing '/' may still lead to a redirect.
            final boolean trailingSlash = i == segments.size() - 1 && segment.isEmpty();
            return new Walk<>(null, previous, trailingSlash ? WalkState.TRAILING_SLASH_DEAD_END
                                                            : WalkState.DEAD_END);
        }
        return new Walk<>(current, previous, WalkState.COMPLETED);
    }

    /**
     * Prints the nodes of this tree, one per line. Nodes with a value are marked with '*'.
     */
    void dump(PrintWriter p, String rootName) {
        dump(p, rootName, root, 0);
    }

    private static <V> void dump(PrintWriter p, String name, Node<V> node, int depth) {
        p.print(node.value != null ? "* " : "  ");
        p.print(Strings.repeat("  ", depth));
        p.print(name);
        p.print('\n');
        ImmutableSortedMap.copyOf(node.children).forEach(
                (segment, child) -> dump(p, PathSegments.SEPARATOR + segment, child, depth + 1));
        if (node.parameterChild != null) {
            dump(p, "/:" + node.parameterName, node.parameterChild, depth + 1);
        }
    }

    @VisibleForTesting
    Node<V> root() {
        return root;
    }

    private static boolean isParameter(String segment) {
        return segment.length() > 1 && segment.charAt(0) == PARAMETER_SIGIL;
    }

    enum WalkState {
        /**
         * Every segment was consumed.
         */
        COMPLETED,
        /**
         * No child could consume the empty segment after a trailing '/'.
         */
        TRAILING_SLASH_DEAD_END,
        /**
         * No child could consume a segment.
         */
        DEAD_END
    }

    /**
     * Where a {@link #walk(String, Map)} stopped.
     */
    static final class Walk<V> {

        @Nullable
        final Node<V> node;
        @Nullable
        final Node<V> previous;
        final WalkState state;

        Walk(@Nullable Node<V> node, @Nullable Node<V> previous, WalkState state) {
            this.node = node;
            this.previous = previous;
            this.state = requireNonNull(state, "state");
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                              .add("state", state)
                              .add("node", node)
                              .toString();
        }
    }

    static final class Node<V> {

        final Map<String, Node<V>> children = new HashMap<>();
        // The name is fixed when the parameter child is created.
        @Nullable
        String parameterName;
        @Nullable
        Node<V> parameterChild;
        @Nullable
        V value;

        @Override
        public String toString() {
            final MoreObjects.ToStringHelper toStringHelper =
                    MoreObjects.toStringHelper(this)
                               .add("children", children.keySet())
                               .add("value", value);
            if (parameterChild != null) {
                toStringHelper.add("parameter", PARAMETER_SIGIL + parameterName);
            }
            return toStringHelper.toString();
        }
    }
}
