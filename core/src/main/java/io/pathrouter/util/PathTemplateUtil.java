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

/**
 * Shared utility methods for compiling path templates and routing requested paths.
 */
public class PathTemplateUtil {

    /**
     * Characters that carry meaning in {@link java.util.regex.Pattern} outside of a character class.
     */
    private static final String REGEX_METACHARACTERS = "\\.[]{}()*+?^$|";

    private PathTemplateUtil() {
    }

    /**
     * Normalizes a path so that it has exactly one leading {@code '/'} and no trailing {@code '/'}. Surrounding whitespace,
     * including Unicode space characters, is removed first. A {@code null}, empty or blank path normalizes to {@code "/"}.
     *
     * <p>
     * Templates and requested paths are both normalized by this method, which is what allows a template to match every
     * spelling of the same path.
     *
     * @param path The path, may be null.
     * @return The normalized path.
     */
    public static String normalizePath(final String path) {
        if (path == null) {
            return "/";
        }
        final String trimmed = path.strip();
        int start = 0;
        int end = trimmed.length();
        while (start < end && trimmed.charAt(start) == '/') {
            ++start;
        }
        while (end > start && trimmed.charAt(end - 1) == '/') {
            --end;
        }
        if (start == end) {
            return "/";
        }
        return "/" + trimmed.substring(start, end);
    }

    /**
     * Escapes every regular expression metacharacter in the specified text so that it is matched literally. Unlike
     * {@link java.util.regex.Pattern#quote(String)} each character is escaped individually, which keeps the braces of
     * template parameters visible to later rewriting steps.
     *
     * @param text The literal text.
     * @return The escaped text.
     */
    public static String escapeRegex(final String text) {
        final StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); ++i) {
            final char c = text.charAt(i);
            if (REGEX_METACHARACTERS.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
