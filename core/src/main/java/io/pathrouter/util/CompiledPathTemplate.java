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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A path template compiled by {@link PathTemplateCompiler}: an anchored {@link Pattern} together with the names of the
 * template parameters, in the order of the capture groups that hold their values.
 *
 * <p>
 * Instances are immutable and thread-safe.
 */
public class CompiledPathTemplate {

    private final String templateString;
    private final String normalizedTemplate;
    private final Pattern pattern;
    private final List<String> parameterNames;

    CompiledPathTemplate(
            final String templateString,
            final String normalizedTemplate,
            final Pattern pattern,
            final List<String> parameterNames
    ) {
        this.templateString = Objects.requireNonNull(templateString);
        this.normalizedTemplate = Objects.requireNonNull(normalizedTemplate);
        this.pattern = Objects.requireNonNull(pattern);
        this.parameterNames = List.copyOf(parameterNames);
    }

    /**
     * Matches an already normalized path against the whole template.
     *
     * @param normalizedPath The path, normalized with {@link PathTemplateUtil#normalizePath(String)}.
     *
     * @return The parameters extracted from the path, in template order, or {@code null} if the path does not match.
     * Parameters inside optional units that were not present in the path have no entry. A template that consists of
     * optional units only matches the root path with all units absent.
     */
    public Map<String, String> match(final String normalizedPath) {
        Matcher matcher = pattern.matcher(normalizedPath);
        if (!matcher.matches()) {
            // The root path is empty once every optional unit is left out, i.e. "/{page?}" for "/".
            if (!"/".equals(normalizedPath)) {
                return null;
            }
            matcher = pattern.matcher("");
            if (!matcher.matches()) {
                return null;
            }
        }
        if (parameterNames.isEmpty()) {
            return Collections.emptyMap();
        }
        final Map<String, String> parameters = new LinkedHashMap<>();
        for (int i = 1; i <= matcher.groupCount(); ++i) {
            final String value = matcher.group(i);
            if (value != null) {
                parameters.put(parameterNames.get(i - 1), value);
            }
        }
        return Collections.unmodifiableMap(parameters);
    }

    /**
     * @return The template string as it was supplied.
     */
    public String getTemplateString() {
        return templateString;
    }

    /**
     * @return The template after path normalization.
     */
    public String getNormalizedTemplate() {
        return normalizedTemplate;
    }

    public Pattern getPattern() {
        return pattern;
    }

    /**
     * @return Parameter names, one per capture group of {@link #getPattern()}.
     */
    public List<String> getParameterNames() {
        return parameterNames;
    }

    @Override
    public String toString() {
        return "CompiledPathTemplate{" + "template=" + templateString + ", pattern=" + pattern
                + ", parameterNames=" + parameterNames + '}';
    }
}
