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
package io.pathrouter.util;

import io.pathrouter.PathRouterMessages;
import static io.pathrouter.util.PathTemplateUtil.escapeRegex;
import static io.pathrouter.util.PathTemplateUtil.normalizePath;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles URL path template strings into {@link CompiledPathTemplate}s.
 *
 * <p>
 * <b>URL path template strings</b>
 *
 * <ol>
 * <li>Templates are normalized with {@link PathTemplateUtil#normalizePath(String)}, so {@code "users/"} and
 * {@code " /users "} are the same template as {@code "/users"}.</li>
 * <li>Literal text matches itself exactly. Regular expression metacharacters in a template carry no special meaning, the
 * template {@code "/files/a.b"} does not match {@code "/files/axb"}.</li>
 * <li>{@code {name}} is a required parameter that matches one or more characters other than {@code '/'}.</li>
 * <li>{@code /{name?}} is an optional parameter. The separator and the value are optional together, the template
 * {@code "/posts/{slug?}"} matches {@code "/posts"} and {@code "/posts/hello"} but not {@code "/posts/"}.</li>
 * <li>Parameter names consist of the characters {@code [A-Za-z0-9_-]}.</li>
 * <li>A parameter whose name is a defined alias matches the alias pattern instead of the default pattern. Alias patterns
 * are regular expressions and may only contain non-capturing groups.</li>
 * <li>The characters {@code '{'}, {@code '}'} and {@code '?'} can be matched literally by preceding them with a
 * {@code '\'}, i.e. the template {@code "\{literal\}"} matches the path {@code "/{literal}"}.</li>
 * </ol>
 *
 * <p>
 * Java named groups are not used because parameter names such as {@code "post-id"} are not valid group names. The name of
 * each capture group is kept in a side list instead.
 *
 * <p>
 * Instances are immutable and thread-safe.
 */
public class PathTemplateCompiler {

    // Patterns below operate on the template after escapeRegex, where a syntactic '{' reads as "\{".
    private static final Pattern ESCAPED_RESERVED = Pattern.compile("\\\\\\\\\\\\([{}?])");
    private static final Pattern OPTIONAL_PARAMETER = Pattern.compile("(/)?\\\\\\{([A-Za-z0-9_-]+)\\\\\\?\\\\\\}");
    private static final Pattern PARAMETER = Pattern.compile("\\\\\\{([A-Za-z0-9_-]+)\\\\\\}");
    private static final Pattern ALIAS_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private static final String DEFAULT_PARAMETER_PATTERN = "([^/]+)";

    private final int flags;

    public PathTemplateCompiler() {
        this(false);
    }

    /**
     * @param caseInsensitive If literal template text should match regardless of case.
     */
    public PathTemplateCompiler(final boolean caseInsensitive) {
        this.flags = caseInsensitive ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0;
    }

    /**
     * @param alias The alias name.
     * @return True if the name can be referenced from a template as {@code {alias}}.
     */
    public static boolean isValidAliasName(final String alias) {
        return alias != null && ALIAS_NAME.matcher(alias).matches();
    }

    /**
     * Compiles a template.
     *
     * @param template The template string.
     * @param aliases Alias name to regular expression. Only read during this call.
     *
     * @return The compiled template.
     *
     * @throws IllegalArgumentException If the template, or an alias it references, does not produce a valid regular
     * expression, or if an alias introduces capture groups of its own.
     */
    public CompiledPathTemplate compile(final String template, final Map<String, String> aliases) {
        if (template == null) {
            throw PathRouterMessages.MESSAGES.argumentCannotBeNull("template");
        }
        if (aliases == null) {
            throw PathRouterMessages.MESSAGES.argumentCannotBeNull("aliases");
        }

        final String normalized = normalizePath(template);
        String expression = escapeRegex(normalized);

        // A user escaped reserved character becomes a hex escape, which later steps can not mistake for syntax.
        expression = ESCAPED_RESERVED.matcher(expression).replaceAll(
                m -> Matcher.quoteReplacement(String.format("\\x%02X", (int) m.group(1).charAt(0)))
        );

        expression = OPTIONAL_PARAMETER.matcher(expression).replaceAll(m -> {
            final String separator = m.group(1) == null ? "" : m.group(1);
            return Matcher.quoteReplacement("(?:" + separator + "\\{" + m.group(2) + "\\})?");
        });

        // Must run before substitution, aliases change the group structure.
        final List<String> parameterNames = new ArrayList<>();
        final Matcher names = PARAMETER.matcher(expression);
        while (names.find()) {
            parameterNames.add(names.group(1));
        }

        // One pass for aliases and default parameters, so text inserted by an alias is never rewritten again.
        expression = PARAMETER.matcher(expression).replaceAll(m -> {
            final String alias = aliases.get(m.group(1));
            return Matcher.quoteReplacement(alias == null ? DEFAULT_PARAMETER_PATTERN : "(" + alias + ")");
        });

        expression = "^" + expression + "$";

        final Pattern pattern;
        try {
            pattern = Pattern.compile(expression, flags);
        } catch (PatternSyntaxException e) {
            throw PathRouterMessages.MESSAGES.couldNotCompilePathTemplate(template, expression, e);
        }
        final int groupCount = pattern.matcher("").groupCount();
        if (groupCount != parameterNames.size()) {
            throw PathRouterMessages.MESSAGES.captureGroupCountMismatch(template, expression, groupCount, parameterNames.size());
        }
        return new CompiledPathTemplate(template, normalized, pattern, parameterNames);
    }
}
