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

import io.pathrouter.testutils.category.UnitTest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(UnitTest.class)
public class PathTemplateCompilerTestCase {

    private final PathTemplateCompiler compiler = new PathTemplateCompiler();

    private CompiledPathTemplate compile(final String template) {
        return compiler.compile(template, Collections.emptyMap());
    }

    private static void assertMatch(
            final CompiledPathTemplate template,
            final String path,
            final Map<String, String> expectedParameters
    ) {
        final Map<String, String> actual = template.match(PathTemplateUtil.normalizePath(path));
        Assert.assertNotNull("Template " + template.getTemplateString() + " should match " + path, actual);
        Assert.assertEquals(expectedParameters, actual);
        final List<String> templateOrder = new ArrayList<>(template.getParameterNames());
        templateOrder.retainAll(actual.keySet());
        Assert.assertEquals("Parameters should keep the order of the template",
                templateOrder, new ArrayList<>(actual.keySet()));
    }

    private static void assertNoMatch(final CompiledPathTemplate template, final String path) {
        Assert.assertNull("Template " + template.getTemplateString() + " should not match " + path,
                template.match(PathTemplateUtil.normalizePath(path)));
    }

    @Test
    public void testLiteralTemplate() {
        final CompiledPathTemplate template = compile("/about/team");
        Assert.assertTrue(template.getParameterNames().isEmpty());
        assertMatch(template, "/about/team", Map.of());
        assertMatch(template, "about/team/", Map.of());
        assertNoMatch(template, "/about");
        assertNoMatch(template, "/about/team/lead");
        assertNoMatch(template, "/about/teams");
        assertNoMatch(template, "/About/team");
    }

    @Test
    public void testRootTemplate() {
        for (final String root : new String[]{"", " ", "/", "//"}) {
            final CompiledPathTemplate template = compile(root);
            Assert.assertEquals("/", template.getNormalizedTemplate());
            assertMatch(template, "/", Map.of());
            assertMatch(template, "", Map.of());
            assertNoMatch(template, "/a");
        }
    }

    @Test
    public void testTemplateIsNormalized() {
        final CompiledPathTemplate template = compile("  users/{id}/ ");
        Assert.assertEquals("  users/{id}/ ", template.getTemplateString());
        Assert.assertEquals("/users/{id}", template.getNormalizedTemplate());
        assertMatch(template, "/users/42/", Map.of("id", "42"));
    }

    @Test
    public void testRegexMetacharactersAreLiteral() {
        final CompiledPathTemplate dot = compile("/files/a.b");
        assertMatch(dot, "/files/a.b", Map.of());
        assertNoMatch(dot, "/files/axb");

        final CompiledPathTemplate symbols = compile("/x+y/(z)/[w]/$1/a|b/c*/^d");
        assertMatch(symbols, "/x+y/(z)/[w]/$1/a|b/c*/^d", Map.of());
        assertNoMatch(symbols, "/xxy/(z)/[w]/$1/a|b/c*/^d");
        assertNoMatch(symbols, "/x+y/z/[w]/$1/a/c/d");
    }

    @Test
    public void testRequiredParameter() {
        final CompiledPathTemplate template = compile("/users/{id}");
        Assert.assertEquals(List.of("id"), template.getParameterNames());
        assertMatch(template, "/users/42", Map.of("id", "42"));
        assertMatch(template, "/users/a.b-c", Map.of("id", "a.b-c"));
        assertNoMatch(template, "/users/42/extra");
        assertNoMatch(template, "/users/");
        assertNoMatch(template, "/users");
    }

    @Test
    public void testParameterInsideSegment() {
        final CompiledPathTemplate template = compile("/reports/{year}-{month}.{format}");
        Assert.assertEquals(List.of("year", "month", "format"), template.getParameterNames());
        final Map<String, String> parameters = template.match("/reports/2024-05.pdf");
        Assert.assertNotNull(parameters);
        Assert.assertEquals("pdf", parameters.get("format"));
    }

    @Test
    public void testParameterNames() {
        final CompiledPathTemplate template = compile("/{post-id}/{Post_ID2}");
        Assert.assertEquals(List.of("post-id", "Post_ID2"), template.getParameterNames());
        assertMatch(template, "/1/2", Map.of("post-id", "1", "Post_ID2", "2"));

        // Not a parameter name, so the braces are matched literally.
        final CompiledPathTemplate literal = compile("/{not valid}");
        Assert.assertTrue(literal.getParameterNames().isEmpty());
        assertMatch(literal, "/{not valid}", Map.of());
    }

    @Test
    public void testOptionalParameter() {
        final CompiledPathTemplate template = compile("/posts/{slug?}");
        Assert.assertEquals(List.of("slug"), template.getParameterNames());

        final Map<String, String> absent = template.match("/posts");
        Assert.assertNotNull(absent);
        Assert.assertFalse(absent.containsKey("slug"));

        assertMatch(template, "/posts/hello-world", Map.of("slug", "hello-world"));
        assertNoMatch(template, "/postshello");
        assertNoMatch(template, "/posts/hello/world");
    }

    @Test
    public void testMultipleOptionalParameters() {
        final CompiledPathTemplate template = compile("/archive/{year?}/{month?}");
        Assert.assertEquals(List.of("year", "month"), template.getParameterNames());
        assertMatch(template, "/archive", Map.of());
        assertMatch(template, "/archive/2024", Map.of("year", "2024"));
        assertMatch(template, "/archive/2024/05", Map.of("year", "2024", "month", "05"));
        assertNoMatch(template, "/archive/2024/05/01");
    }

    @Test
    public void testOptionalOnlyTemplateMatchesRoot() {
        final CompiledPathTemplate single = compile("/{page?}");
        final Map<String, String> root = single.match("/");
        Assert.assertNotNull(root);
        Assert.assertFalse(root.containsKey("page"));
        assertMatch(single, "/x", Map.of("page", "x"));
        assertNoMatch(single, "/x/y");

        final CompiledPathTemplate pair = compile("/{a?}/{b?}");
        assertMatch(pair, "/", Map.of());
        assertMatch(pair, "/x", Map.of("a", "x"));
        assertMatch(pair, "/x/y", Map.of("a", "x", "b", "y"));

        // The retry on the empty path must not let required parameters match the root.
        assertNoMatch(compile("/{id}"), "/");
        assertNoMatch(compile("/{id}/{page?}"), "/");
    }

    @Test
    public void testRequiredAndOptionalParameters() {
        final CompiledPathTemplate template = compile("/users/{id}/posts/{slug?}");
        assertMatch(template, "/users/7/posts", Map.of("id", "7"));
        assertMatch(template, "/users/7/posts/first", Map.of("id", "7", "slug", "first"));
    }

    @Test
    public void testAlias() {
        final Map<String, String> aliases = Map.of("id", "[0-9]+");
        final CompiledPathTemplate template = compiler.compile("/users/{id}", aliases);
        assertNoMatch(template, "/users/abc");
        assertMatch(template, "/users/7", Map.of("id", "7"));
    }

    @Test
    public void testAliasAppliesToOptionalParameter() {
        final CompiledPathTemplate template = compiler.compile("/page/{num?}", Map.of("num", "\\d+"));
        assertMatch(template, "/page", Map.of());
        assertMatch(template, "/page/3", Map.of("num", "3"));
        assertNoMatch(template, "/page/three");
    }

    @Test
    public void testAliasMayMatchSeparators() {
        final CompiledPathTemplate template = compiler.compile("/static/{file}", Map.of("file", ".+"));
        assertMatch(template, "/static/css/site.css", Map.of("file", "css/site.css"));
    }

    @Test
    public void testAliasKeepsParameterOrder() {
        final CompiledPathTemplate template = compiler.compile("/{a}/{id}/{b}", Map.of("id", "[0-9]{1,3}"));
        Assert.assertEquals(List.of("a", "id", "b"), template.getParameterNames());
        assertMatch(template, "/x/5/y", Map.of("a", "x", "id", "5", "b", "y"));
        assertNoMatch(template, "/x/5555/y");
    }

    @Test
    public void testAliasWithNonCapturingGroup() {
        final CompiledPathTemplate template = compiler.compile("/{format}/{id}", Map.of("format", "(?:json|xml)"));
        assertMatch(template, "/json/1", Map.of("format", "json", "id", "1"));
        assertNoMatch(template, "/yaml/1");
    }

    @Test
    public void testAliasWithCapturingGroupIsRejected() {
        final IllegalArgumentException e = Assert.assertThrows(IllegalArgumentException.class,
                () -> compiler.compile("/{format}/{id}", Map.of("format", "(json|xml)")));
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("/{format}/{id}"));
    }

    @Test
    public void testInvalidAliasPatternIsRejected() {
        final IllegalArgumentException e = Assert.assertThrows(IllegalArgumentException.class,
                () -> compiler.compile("/users/{id}", Map.of("id", "[0-9")));
        Assert.assertTrue(e.getCause() instanceof PatternSyntaxException);
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("/users/{id}"));
    }

    @Test
    public void testUnusedAliasIsIgnored() {
        final CompiledPathTemplate template = compiler.compile("/users/{id}", Map.of("other", "[0-9"));
        assertMatch(template, "/users/abc", Map.of("id", "abc"));
    }

    @Test
    public void testEscapedBraces() {
        final CompiledPathTemplate template = compile("\\{literal\\}");
        Assert.assertTrue(template.getParameterNames().isEmpty());
        assertMatch(template, "/{literal}", Map.of());
        assertNoMatch(template, "/literal");
        assertNoMatch(template, "/anything");
    }

    @Test
    public void testEscapedQuestionMark() {
        final CompiledPathTemplate question = compile("/faq\\?");
        assertMatch(question, "/faq?", Map.of());
        assertNoMatch(question, "/faq");

        final CompiledPathTemplate notOptional = compile("/posts/{slug\\?}");
        Assert.assertTrue(notOptional.getParameterNames().isEmpty());
        assertMatch(notOptional, "/posts/{slug?}", Map.of());
        assertNoMatch(notOptional, "/posts");
    }

    @Test
    public void testEscapedBracesNextToParameter() {
        final CompiledPathTemplate template = compile("/\\{{name}\\}");
        Assert.assertEquals(List.of("name"), template.getParameterNames());
        assertMatch(template, "/{abc}", Map.of("name", "abc"));
        assertNoMatch(template, "/abc");
    }

    @Test
    public void testCaseInsensitive() {
        final CompiledPathTemplate sensitive = compile("/Users/{id}");
        assertNoMatch(sensitive, "/users/1");

        final CompiledPathTemplate insensitive = new PathTemplateCompiler(true).compile("/Users/{id}", Map.of());
        assertMatch(insensitive, "/users/AbC", Map.of("id", "AbC"));
        assertMatch(insensitive, "/USERS/1", Map.of("id", "1"));
    }

    @Test
    public void testCompileIsDeterministic() {
        final Map<String, String> aliases = Map.of("id", "[0-9]+", "slug", "[a-z-]+");
        final String template = "/users/{id}/posts/{slug?}/{rest}";
        final CompiledPathTemplate first = compiler.compile(template, aliases);
        final CompiledPathTemplate second = compiler.compile(template, aliases);
        Assert.assertEquals(first.getParameterNames(), second.getParameterNames());
        Assert.assertEquals(first.getPattern().pattern(), second.getPattern().pattern());
        for (final String path : new String[]{"/users/1/posts/a-b/x", "/users/1/posts/x", "/users/a/posts/b/c"}) {
            Assert.assertEquals(first.match(path), second.match(path));
        }
    }

    @Test
    public void testNullArguments() {
        Assert.assertThrows(IllegalArgumentException.class, () -> compiler.compile(null, Map.of()));
        Assert.assertThrows(IllegalArgumentException.class, () -> compiler.compile("/a", null));
    }

    @Test
    public void testAliasNames() {
        Assert.assertTrue(PathTemplateCompiler.isValidAliasName("id"));
        Assert.assertTrue(PathTemplateCompiler.isValidAliasName("post-id_2"));
        Assert.assertFalse(PathTemplateCompiler.isValidAliasName(null));
        Assert.assertFalse(PathTemplateCompiler.isValidAliasName(""));
        Assert.assertFalse(PathTemplateCompiler.isValidAliasName("post id"));
        Assert.assertFalse(PathTemplateCompiler.isValidAliasName("id?"));
    }
}
