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

import io.pathrouter.PathRouterLogger;
import io.pathrouter.PathRouterMessages;
import io.pathrouter.PathRouterOptions;
import io.pathrouter.util.CompiledPathTemplate;
import io.pathrouter.util.PathTemplateCompiler;
import io.pathrouter.util.PathTemplateUtil;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.xnio.OptionMap;

/**
 * Routes URL paths to routes registered through path templates (see {@link PathTemplateCompiler} for the template syntax).
 *
 * <p>
 * <b>Routing methodology</b>
 *
 * <p>
 * Templates are tried in the order in which they were registered and the first template that matches the whole normalized
 * path wins, even if a template registered later would be a more specific match. Given the templates
 * {@code '/items/{id}'} and {@code '/items/special'}, registered in that order, the path {@code '/items/special'} resolves to
 * the first template with {@code id=special}. Specific templates must therefore be registered before the general templates
 * that overlap them.
 *
 * <p>
 * <b>Aliases</b>
 *
 * <p>
 * Aliases are read when a template is registered. Defining or redefining an alias has no effect on templates that were
 * registered before.
 *
 * <p>
 * <b>Thread safety</b>
 *
 * <p>
 * Registration methods are synchronized and publish immutable snapshots of the alias and routing tables. Routing only reads
 * the current snapshot, so it never blocks and never observes a partially applied registration.
 */
public class UrlRouter {

    //<editor-fold defaultstate="collapsed" desc="RouteEntry inner class">
    private static class RouteEntry {

        private final CompiledPathTemplate template;
        private final Route route;

        private RouteEntry(
                final CompiledPathTemplate template,
                final Route route
        ) {
            this.template = Objects.requireNonNull(template);
            this.route = Objects.requireNonNull(route);
        }
    }

    //</editor-fold>
    //
    private final PathTemplateCompiler compiler;
    private final int maxPathLength;

    private volatile Map<String, String> aliases = Collections.emptyMap();
    private volatile List<RouteEntry> entries = List.of();

    public UrlRouter() {
        this(OptionMap.EMPTY);
    }

    /**
     * @param options Router options, see {@link PathRouterOptions}.
     */
    public UrlRouter(final OptionMap options) {
        if (options == null) {
            throw PathRouterMessages.MESSAGES.argumentCannotBeNull("options");
        }
        this.compiler = new PathTemplateCompiler(options.get(PathRouterOptions.CASE_INSENSITIVE, false));
        this.maxPathLength = options.get(PathRouterOptions.MAX_PATH_LENGTH, PathRouterOptions.DEFAULT_MAX_PATH_LENGTH);
    }

    /**
     * Defines or redefines a parameter alias. Templates registered from now on that contain {@code {alias}} or
     * {@code {alias?}} match the parameter with the specified regular expression.
     *
     * <p>
     * The expression is not validated here. An invalid expression fails the registration of the first template that uses
     * it.
     *
     * @param alias The parameter name.
     * @param pattern The regular expression, which may only contain non-capturing groups.
     * @return This router.
     */
    public synchronized UrlRouter addAlias(final String alias, final String pattern) {
        if (pattern == null) {
            throw PathRouterMessages.MESSAGES.argumentCannotBeNull("pattern");
        }
        if (!PathTemplateCompiler.isValidAliasName(alias)) {
            throw PathRouterMessages.MESSAGES.invalidAliasName(alias);
        }
        final Map<String, String> newAliases = new LinkedHashMap<>(aliases);
        newAliases.put(alias, pattern);
        this.aliases = Collections.unmodifiableMap(newAliases);
        PathRouterLogger.ROOT_LOGGER.aliasDefined(alias, pattern);
        return this;
    }

    /**
     * @return The aliases that will be applied to templates registered from now on.
     */
    public Map<String, String> getAliases() {
        return aliases;
    }

    public Route register(final String template, final RouteHandler handler) {
        if (template == null) {
            throw PathRouterMessages.MESSAGES.argumentCannotBeNull("template");
        }
        return register(List.of(template), handler);
    }

    /**
     * Registers a route. Every template is compiled immediately and appended to the routing table in the given order. All
     * templates resolve to the returned route.
     *
     * @param templates The templates, at least one.
     * @param handler The handler invoked by {@link #dispatch(URI)}.
     * @return The route.
     * @throws IllegalArgumentException If no templates are given or a template does not compile. Nothing is registered in
     * that case.
     */
    public Route register(final List<String> templates, final RouteHandler handler) {
        if (templates == null) {
            throw PathRouterMessages.MESSAGES.argumentCannotBeNull("templates");
        }
        if (handler == null) {
            throw PathRouterMessages.MESSAGES.argumentCannotBeNull("handler");
        }
        if (templates.isEmpty()) {
            throw PathRouterMessages.MESSAGES.routeTemplatesMustNotBeEmpty();
        }
        if (templates.get(0) == null) {
            throw PathRouterMessages.MESSAGES.argumentCannotBeNull("template");
        }
        final Route route = new Route(this, templates.get(0), handler);
        addTemplates(route, templates);
        return route;
    }

    /**
     * Appends templates for a route that was registered with this router.
     *
     * @param route The route.
     * @param templates The templates, at least one.
     * @return This router.
     */
    public synchronized UrlRouter addTemplates(final Route route, final List<String> templates) {
        if (route == null) {
            throw PathRouterMessages.MESSAGES.argumentCannotBeNull("route");
        }
        if (templates == null) {
            throw PathRouterMessages.MESSAGES.argumentCannotBeNull("templates");
        }
        if (route.getRouter() != this) {
            throw PathRouterMessages.MESSAGES.routeBelongsToDifferentRouter(route.getTemplate());
        }
        if (templates.isEmpty()) {
            throw PathRouterMessages.MESSAGES.routeTemplatesMustNotBeEmpty();
        }

        final Map<String, String> currentAliases = this.aliases;
        final List<RouteEntry> added = new ArrayList<>(templates.size());
        for (final String template : templates) {
            added.add(new RouteEntry(compiler.compile(template, currentAliases), route));
        }

        final List<RouteEntry> newEntries = new ArrayList<>(entries.size() + added.size());
        newEntries.addAll(entries);
        newEntries.addAll(added);
        this.entries = Collections.unmodifiableList(newEntries);

        for (final RouteEntry entry : added) {
            PathRouterLogger.ROOT_LOGGER.registeredPathTemplate(entry.template.getTemplateString(),
                    entry.template.getPattern().pattern(), entry.template.getParameterNames());
        }
        return this;
    }

    /**
     * Routes a URL string. Only the path of the URL takes part in routing.
     *
     * @param url The URL, or just a path.
     * @return The match, or an empty Optional if no route matched or the URL could not be parsed.
     */
    public Optional<RouteMatch> route(final String url) {
        final URI uri = parseUrl(url);
        if (uri == null) {
            return Optional.empty();
        }
        return route(uri);
    }

    /**
     * Routes the raw path of a URL. Scheme, authority, query and fragment are ignored and parameter values are not percent
     * decoded.
     *
     * @param url The URL.
     * @return The match, or an empty Optional if no route matched.
     */
    public Optional<RouteMatch> route(final URI url) {
        if (url == null) {
            throw PathRouterMessages.MESSAGES.argumentCannotBeNull("url");
        }
        final String rawPath = url.getRawPath();
        return routePath(rawPath == null ? "" : rawPath);
    }

    /**
     * Routes a path that has already been extracted from its URL.
     *
     * @param path The path, normalized before matching.
     * @return The match, or an empty Optional if no route matched.
     * @throws IllegalArgumentException If the path is null.
     */
    public Optional<RouteMatch> routePath(final String path) {
        if (path == null) {
            throw PathRouterMessages.MESSAGES.argumentCannotBeNull("path");
        }
        final String normalized = PathTemplateUtil.normalizePath(path);
        if (maxPathLength >= 0 && normalized.length() > maxPathLength) {
            PathRouterLogger.REQUEST_LOGGER.pathTooLong(normalized.length(), maxPathLength);
            return Optional.empty();
        }

        final List<RouteEntry> localEntries = this.entries;
        for (final RouteEntry entry : localEntries) {
            final Map<String, String> parameters = entry.template.match(normalized);
            if (parameters != null) {
                PathRouterLogger.REQUEST_LOGGER.tracef("Path %s matched template %s", normalized,
                        entry.template.getTemplateString());
                return Optional.of(new RouteMatch(entry.route, entry.template.getTemplateString(), parameters));
            }
        }
        PathRouterLogger.REQUEST_LOGGER.noRouteMatched(normalized);
        return Optional.empty();
    }

    /**
     * Routes a URL string and invokes the handler of the matching route.
     *
     * @param url The URL, or just a path.
     * @return {@link RouteResult#FAILED} if the URL could not be parsed or did not match, otherwise the result of the
     * handler.
     */
    public RouteResult dispatch(final String url) {
        final URI uri = parseUrl(url);
        if (uri == null) {
            return RouteResult.FAILED;
        }
        return dispatch(uri);
    }

    /**
     * Routes a URL and invokes the handler of the matching route.
     *
     * @param url The URL.
     * @return {@link RouteResult#FAILED} if no route matched, {@link RouteResult#SUCCEEDED} if the handler returned
     * {@code null}, otherwise the result of the handler.
     */
    public RouteResult dispatch(final URI url) {
        final Optional<RouteMatch> routed = route(url);
        if (routed.isEmpty()) {
            return RouteResult.FAILED;
        }
        final RouteMatch match = routed.get();
        final RouteResult result = match.getRoute().getHandler().handle(url, match.getRoute(), match.getParameters());
        return result == null ? RouteResult.SUCCEEDED : result;
    }

    private static URI parseUrl(final String url) {
        if (url == null) {
            throw PathRouterMessages.MESSAGES.argumentCannotBeNull("url");
        }
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            PathRouterLogger.REQUEST_LOGGER.couldNotParseUrl(url, e);
            return null;
        }
    }
}
