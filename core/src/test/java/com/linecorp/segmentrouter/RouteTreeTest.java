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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.linecorp.segmentrouter.RouteTree.Node;
import com.linecorp.segmentrouter.RouteTree.Walk;
import com.linecorp.segmentrouter.RouteTree.WalkState;

class RouteTreeTest {

    @Test
    void testTreeStructure() {
        final RouteTree<String> tree = new RouteTree<>();
        tree.insert("/", "root");
        tree.insert("/users", "users");
        tree.insert("/users/", "users-slash");
        tree.insert("/users/:id", "user");
        tree.insert("/users/:id/books", "books");

        // Expectation:
        //  (root)
        //    ""            (root)
        //    users         (users)
        //      ""          (users-slash)
        //      :id         (user)
        //        books     (books)
        final Node<String> root = tree.root();
        assertThat(root.value).isNull();
        assertThat(root.children).containsOnlyKeys("", "users");
        assertThat(root.children.get("").value).isEqualTo("root");

        final Node<String> users = root.children.get("users");
        assertThat(users.value).isEqualTo("users");
        assertThat(users.children).containsOnlyKeys("");
        assertThat(users.children.get("").value).isEqualTo("users-slash");
        assertThat(users.parameterName).isEqualTo("id");
        assertThat(users.parameterChild).isNotNull();
        assertThat(users.parameterChild.value).isEqualTo("user");
        assertThat(users.parameterChild.children.get("books").value).isEqualTo("books");
    }

    @Test
    void doubleSeparatorCreatesEmptySegment() {
        final RouteTree<String> tree = new RouteTree<>();
        tree.insert("/a//b", "value");

        final Node<String> a = tree.root().children.get("a");
        assertThat(a.children).containsOnlyKeys("");
        assertThat(a.children.get("").children.get("b").value).isEqualTo("value");
    }

    @Test
    void bareSigilIsLiteral() {
        final RouteTree<String> tree = new RouteTree<>();
        tree.insert("/:", "colon");

        assertThat(tree.root().parameterChild).isNull();
        assertThat(tree.root().children.get(":").value).isEqualTo("colon");
    }

    @Test
    void sameParameterNameIsShared() {
        final RouteTree<String> tree = new RouteTree<>();
        tree.insert("/foo/:id", "a");
        tree.insert("/foo/:id/bar", "b");

        final Node<String> foo = tree.root().children.get("foo");
        assertThat(foo.parameterName).isEqualTo("id");
        assertThat(foo.parameterChild.value).isEqualTo("a");
        assertThat(foo.parameterChild.children.get("bar").value).isEqualTo("b");
    }

    @Test
    void conflictLeavesExistingRoutes() {
        final RouteTree<String> tree = new RouteTree<>();
        tree.insert("/:foo", "foo");

        assertThatThrownBy(() -> tree.insert("/:bar", "bar"))
                .isInstanceOf(RouteConflictException.class)
                .hasMessageContaining(":bar")
                .hasMessageContaining(":foo");
        assertThat(tree.root().parameterName).isEqualTo("foo");
        assertThat(tree.root().parameterChild.value).isEqualTo("foo");

        tree.insert("/x/:a/y", "a");
        assertThatThrownBy(() -> tree.insert("/x/:b/z", "b"))
                .isInstanceOfSatisfying(RouteConflictException.class, e -> {
                    assertThat(e.path()).isEqualTo("/x/:b/z");
                    assertThat(e.existingName()).isEqualTo("a");
                    assertThat(e.conflictingName()).isEqualTo("b");
                });
        final Node<String> x = tree.root().children.get("x");
        assertThat(x.parameterName).isEqualTo("a");
        assertThat(x.parameterChild.children).containsOnlyKeys("y");
    }

    @Test
    void walkCapturesParameters() {
        final RouteTree<String> tree = new RouteTree<>();
        tree.insert("/foo/:id/bar/:id2", "value");

        final Map<String, String> params = new HashMap<>();
        final Walk<String> walk = tree.walk("/foo/1/bar/2", params);
        assertThat(walk.state).isEqualTo(WalkState.COMPLETED);
        assertThat(walk.node.value).isEqualTo("value");
        assertThat(params).containsOnly(Map.entry("id", "1"), Map.entry("id2", "2"));
    }

    @Test
    void walkPrefersLiteralChild() {
        final RouteTree<String> tree = new RouteTree<>();
        tree.insert("/users/:id", "user");
        tree.insert("/users/me", "me");

        final Map<String, String> params = new HashMap<>();
        assertThat(tree.walk("/users/me", params).node.value).isEqualTo("me");
        assertThat(params).isEmpty();
        assertThat(tree.walk("/users/you", params).node.value).isEqualTo("user");
        assertThat(params).containsOnly(Map.entry("id", "you"));
    }

    @Test
    void walkDeadEnds() {
        final RouteTree<String> tree = new RouteTree<>();
        tree.insert("/a", "a");
        tree.insert("/b/:id", "b");

        Walk<String> walk = tree.walk("/c", new HashMap<>());
        assertThat(walk.state).isEqualTo(WalkState.DEAD_END);
        assertThat(walk.node).isNull();
        assertThat(walk.previous).isSameAs(tree.root());

        // An empty segment never binds to a parameter.
        walk = tree.walk("/b/", new HashMap<>());
        assertThat(walk.state).isEqualTo(WalkState.TRAILING_SLASH_DEAD_END);
        assertThat(walk.previous).isSameAs(tree.root().children.get("b"));

        walk = tree.walk("/a/x/", new HashMap<>());
        assertThat(walk.state).isEqualTo(WalkState.DEAD_END);

        walk = tree.walk("/a//", new HashMap<>());
        assertThat(walk.state).isEqualTo(WalkState.DEAD_END);
    }

    @Test
    void dump() {
        final RouteTree<String> tree = new RouteTree<>();
        tree.insert("/b", "b");
        tree.insert("/a/:id", "a");
        tree.insert("/a/x", null);

        final StringWriter out = new StringWriter();
        final PrintWriter p = new PrintWriter(out);
        tree.dump(p, "GET");
        p.flush();

        assertThat(out.toString()).isEqualTo("  GET\n" +
                                             "    /a\n" +
                                             "      /x\n" +
                                             "*     /:id\n" +
                                             "*   /b\n");
    }
}
