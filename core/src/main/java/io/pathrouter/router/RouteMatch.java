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

import io.pathrouter.util.PathTemplateMatch;
import java.util.Map;
import java.util.Objects;

/**
 * Result of routing a URL path with {@link UrlRouter}: the route that matched, the specific template of that route that
 * matched, and the parameters extracted by the template.
 *
 * <p>
 * Instances are immutable.
 */
public class RouteMatch extends PathTemplateMatch {

    private final Route route;

    public RouteMatch(
            final Route route,
            final String matchedTemplate,
            final Map<String, String> parameters
    ) {
        super(
                Objects.requireNonNull(matchedTemplate),
                Objects.requireNonNull(parameters)
        );
        this.route = Objects.requireNonNull(route);
    }

    public Route getRoute() {
        return route;
    }

    @Override
    public String toString() {
        return "RouteMatch{" + "route=" + route + ", matchedTemplate=" + getMatchedTemplate()
                + ", parameters=" + getParameters() + '}';
    }
}
