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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ascii;

/**
 * The default configuration of {@link SegmentRouter}, read from the following JVM system properties:
 * <ul>
 *     <li>{@code -Dcom.linecorp.segmentrouter.redirectTrailingSlash=<boolean>}, {@code true} by default.
 *         See {@link SegmentRouterBuilder#redirectTrailingSlash(boolean)}.</li>
 *     <li>{@code -Dcom.linecorp.segmentrouter.concurrentRegistration=<boolean>}, {@code true} by default.
 *         See {@link SegmentRouterBuilder#concurrentRegistration(boolean)}.</li>
 * </ul>
 */
public final class RouterFlags {

    private static final Logger logger = LoggerFactory.getLogger(RouterFlags.class);

    @VisibleForTesting
    static final String PREFIX = "com.linecorp.segmentrouter.";

    private static final boolean DEFAULT_REDIRECT_TRAILING_SLASH = true;
    private static final boolean REDIRECT_TRAILING_SLASH =
            getBoolean("redirectTrailingSlash", DEFAULT_REDIRECT_TRAILING_SLASH);

    private static final boolean DEFAULT_CONCURRENT_REGISTRATION = true;
    private static final boolean CONCURRENT_REGISTRATION =
            getBoolean("concurrentRegistration", DEFAULT_CONCURRENT_REGISTRATION);

    /**
     * Returns whether a request to a path that differs from a route only in the trailing slash is
     * redirected to that route by default.
     */
    public static boolean redirectTrailingSlash() {
        return REDIRECT_TRAILING_SLASH;
    }

    /**
     * Returns whether routes may be added while requests are being matched by default.
     */
    public static boolean concurrentRegistration() {
        return CONCURRENT_REGISTRATION;
    }

    @VisibleForTesting
    static boolean getBoolean(String name, boolean defaultValue) {
        final String fullName = PREFIX + name;
        String value = System.getProperty(fullName);
        if (value != null) {
            value = Ascii.toLowerCase(value.trim());
            if ("true".equals(value) || "false".equals(value)) {
                logger.info("{}: {} (sysprops)", name, value);
                return Boolean.parseBoolean(value);
            }
            logger.warn("{}: {} (sysprops, validation failed)", name, value);
        }
        logger.info("{}: {} (default)", name, defaultValue);
        return defaultValue;
    }

    private RouterFlags() {}
}
