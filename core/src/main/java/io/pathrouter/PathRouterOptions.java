/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2026 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.pathrouter;

import org.xnio.Option;

/**
 * Options accepted by {@link io.pathrouter.router.UrlRouter}.
 */
public class PathRouterOptions {

    /**
     * The maximum length of a normalized path that the router will attempt to match. Longer paths are treated as
     * unroutable without running any matcher.
     *
     * <code>-1</code> disables the limit.
     */
    public static final Option<Integer> MAX_PATH_LENGTH = Option.simple(PathRouterOptions.class, "MAX_PATH_LENGTH", Integer.class);

    public static final int DEFAULT_MAX_PATH_LENGTH = 8192;

    /**
     * If literal template text should be matched ignoring case. Defaults to false.
     */
    public static final Option<Boolean> CASE_INSENSITIVE = Option.simple(PathRouterOptions.class, "CASE_INSENSITIVE", Boolean.class);

    private PathRouterOptions() {

    }
}
