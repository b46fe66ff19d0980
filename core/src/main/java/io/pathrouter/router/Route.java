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

import java.util.Arrays;
import java.util.Objects;

/**
 * Identity of a route registered with a {@link UrlRouter}. A route is bound to one handler and to one or more templates,
 * all of which resolve to this instance.
 *
 * <p>
 * Instances are created by {@link UrlRouter#register(java.util.List, RouteHandler)} and are immutable.
 */
public final class Route {

    private final UrlRouter router;
    private final String template;
    private final RouteHandler handler;

    Route(final UrlRouter router, final String template, final RouteHandler handler) {
        this.router = Objects.requireNonNull(router);
        this.template = Objects.requireNonNull(template);
        this.handler = Objects.requireNonNull(handler);
    }

    /**
     * Registers further templates for this route. The templates are appended after every template registered so far and
     * therefore have the lowest precedence.
     *
     * @param templates The templates.
     * @return This route.
     */
    public Route addTemplates(final String... templates) {
        router.addTemplates(this, Arrays.asList(templates));
        return this;
    }

    public UrlRouter getRouter() {
        return router;
    }

    /**
     * @return The first template the route was registered with.
     */
    public String getTemplate() {
        return template;
    }

    public RouteHandler getHandler() {
        return handler;
    }

    @Override
    public String toString() {
        return "Route{" + "template=" + template + '}';
    }
}
