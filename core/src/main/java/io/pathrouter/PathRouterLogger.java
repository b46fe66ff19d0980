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

import java.net.URISyntaxException;
import java.util.List;

import org.jboss.logging.BasicLogger;
import org.jboss.logging.Logger;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.LogMessage;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageLogger;

import static org.jboss.logging.Logger.Level.DEBUG;

/**
 * log messages start at 5000
 */
@MessageLogger(projectCode = "PR")
public interface PathRouterLogger extends BasicLogger {

    PathRouterLogger ROOT_LOGGER = Logger.getMessageLogger(PathRouterLogger.class, PathRouterLogger.class.getPackage().getName());

    /**
     * Logger used while resolving paths. Unroutable input is expected traffic, so nothing here logs above DEBUG.
     */
    PathRouterLogger REQUEST_LOGGER = Logger.getMessageLogger(PathRouterLogger.class, PathRouterLogger.class.getPackage().getName() + ".request");

    @LogMessage(level = DEBUG)
    @Message(id = 5001, value = "Registered path template %s as expression %s with parameters %s")
    void registeredPathTemplate(String template, String expression, List<String> parameterNames);

    @LogMessage(level = DEBUG)
    @Message(id = 5002, value = "Alias %s set to pattern %s")
    void aliasDefined(String alias, String pattern);

    @LogMessage(level = DEBUG)
    @Message(id = 5003, value = "Could not parse URL %s, treating it as unroutable")
    void couldNotParseUrl(String url, @Cause URISyntaxException cause);

    @LogMessage(level = DEBUG)
    @Message(id = 5004, value = "Path of length %s exceeds the maximum path length of %s, treating it as unroutable")
    void pathTooLong(int length, int maxLength);

    @LogMessage(level = DEBUG)
    @Message(id = 5005, value = "No route matched path %s")
    void noRouteMatched(String path);
}
