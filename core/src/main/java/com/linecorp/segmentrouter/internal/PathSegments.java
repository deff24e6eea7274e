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
package com.linecorp.segmentrouter.internal;

import static java.util.Objects.requireNonNull;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a request or route path into its {@code '/'}-separated segments.
 */
public final class PathSegments {

    public static final char SEPARATOR = '/';

    /**
     * Splits the specified {@code path} on {@value #SEPARATOR}. Empty segments are never removed, so
     * {@code ""} yields {@code [""]}, {@code "/"} yields {@code ["", ""]} and {@code "/foo/bar//"} yields
     * {@code ["", "foo", "bar", "", ""]}.
     */
    public static List<String> split(String path) {
        requireNonNull(path, "path");
        final List<String> segments = new ArrayList<>(4);
        int start = 0;
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == SEPARATOR) {
                segments.add(path.substring(start, i));
                start = i + 1;
            }
        }
        segments.add(path.substring(start));
        return segments;
    }

    /**
     * Returns whether the specified {@code path} ends with {@value #SEPARATOR}.
     */
    public static boolean hasTrailingSeparator(String path) {
        return !path.isEmpty() && path.charAt(path.length() - 1) == SEPARATOR;
    }

    /**
     * Percent-decodes the specified path {@code segment} as UTF-8. Unlike
     * {@link java.net.URLDecoder}, {@code '+'} is kept as is. A malformed escape sequence or a non-ASCII
     * character decodes into the replacement character U+FFFD.
     */
    public static String decode(String segment) {
        requireNonNull(segment, "segment");
        if (segment.indexOf('%') < 0) {
            return segment;
        }

        final int length = segment.length();
        final byte[] buf = new byte[length];
        int dstLen = 0;
        for (int i = 0; i < length; i++) {
            final char ch = segment.charAt(i);
            if (ch != '%') {
                buf[dstLen++] = (byte) (ch < 0x80 ? ch : 0xFF);
                continue;
            }

            final int hi = i + 1 < length ? hexValue(segment.charAt(i + 1)) : -1;
            final int lo = i + 2 < length ? hexValue(segment.charAt(i + 2)) : -1;
            if (hi < 0 || lo < 0) {
                buf[dstLen++] = (byte) 0xFF;
                continue;
            }
            buf[dstLen++] = (byte) ((hi << 4) | lo);
            i += 2;
        }
        return new String(buf, 0, dstLen, StandardCharsets.UTF_8);
    }

    private static int hexValue(char ch) {
        if (ch >= '0' && ch <= '9') {
            return ch - '0';
        }
        if (ch >= 'a' && ch <= 'f') {
            return ch - 'a' + 10;
        }
        if (ch >= 'A' && ch <= 'F') {
            return ch - 'A' + 10;
        }
        return -1;
    }

    private PathSegments() {}
}
