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

import java.util.regex.PatternSyntaxException;

import org.jboss.logging.Messages;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageBundle;

/**
 * Exceptions thrown by the path router. Message ids stay stable across releases; retired ids are left as comments.
 */
@MessageBundle(projectCode = "PR")
public interface PathRouterMessages {

    PathRouterMessages MESSAGES = Messages.getBundle(PathRouterMessages.class);

    @Message(id = 1, value = "Argument %s cannot be null")
    IllegalArgumentException argumentCannotBeNull(String argument);

    @Message(id = 2, value = "Route templates must contain at least one template")
    IllegalArgumentException routeTemplatesMustNotBeEmpty();

    @Message(id = 3, value = "Could not compile path template %s into expression %s")
    IllegalArgumentException couldNotCompilePathTemplate(String template, String expression, @Cause PatternSyntaxException cause);

    @Message(id = 4, value = "Path template %s compiled into expression %s with %s capture groups but declares %s parameters, aliases must only use non-capturing groups")
    IllegalArgumentException captureGroupCountMismatch(String template, String expression, int groupCount, int parameterCount);

    @Message(id = 5, value = "Invalid alias name %s, alias names may only contain letters, digits, '_' and '-'")
    IllegalArgumentException invalidAliasName(String alias);

    @Message(id = 6, value = "Route %s belongs to a different router")
    IllegalArgumentException routeBelongsToDifferentRouter(String template);
}
