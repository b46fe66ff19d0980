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
package io.pathrouter.router;

import java.net.URI;
import java.util.Map;

/**
 * Handler invoked by {@link UrlRouter#dispatch(URI)} for the route that matched a URL.
 */
@FunctionalInterface
public interface RouteHandler {

    /**
     * Handles a routed URL. Called at most once per dispatch.
     *
     * @param url The URL that was dispatched.
     * @param route The route that matched.
     * @param parameters The path parameters extracted by the matched template.
     *
     * @return The outcome, or {@code null} which is treated as {@link RouteResult#SUCCEEDED}.
     */
    RouteResult handle(URI url, Route route, Map<String, String> parameters);
}
