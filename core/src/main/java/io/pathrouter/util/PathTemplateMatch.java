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

import java.util.Map;

/**
 * The result of a path template match.
 */
public class PathTemplateMatch {

    private final String matchedTemplate;
    private final Map<String, String> parameters;

    public PathTemplateMatch(String matchedTemplate, Map<String, String> parameters) {
        this.matchedTemplate = matchedTemplate;
        this.parameters = parameters;
    }

    public String getMatchedTemplate() {
        return matchedTemplate;
    }

    /**
     * @return Parameter values in template order. Values are raw path text and are not percent decoded.
     */
    public Map<String, String> getParameters() {
        return parameters;
    }

}
