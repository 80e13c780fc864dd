/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.leadflow.workflow.parser;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PlaceholderResolverTest {

    private static final String PROPERTY = "leadflow.test.placeholder";

    @AfterEach
    void tearDown() {
        System.clearProperty(PROPERTY);
    }

    @Test
    void testExplicitVariables() {
        PlaceholderResolver resolver = new PlaceholderResolver(Map.of("API_KEY", "secret", "PORT", 8080));

        assertEquals("key=secret port=8080", resolver.resolve("key={{API_KEY}} port={{ PORT }}"));
    }

    @Test
    void testUnresolvedPlaceholderIsKeptVerbatim() {
        PlaceholderResolver resolver = new PlaceholderResolver();

        assertEquals("token={{LEADFLOW_SURELY_UNDEFINED_VAR}}",
                resolver.resolve("token={{LEADFLOW_SURELY_UNDEFINED_VAR}}"));
    }

    @Test
    void testSystemPropertyFallback() {
        System.setProperty(PROPERTY, "from-property");

        assertEquals("from-property", new PlaceholderResolver().resolve("{{" + PROPERTY + "}}"));
    }

    @Test
    void testEnvironmentFallback() {
        String path = System.getenv("PATH");
        assumeTrue(path != null);

        assertEquals(path, new PlaceholderResolver().resolve("{{PATH}}"));
    }

    @Test
    void testExplicitVariablesTakePrecedence() {
        System.setProperty(PROPERTY, "from-property");
        PlaceholderResolver resolver = new PlaceholderResolver(Map.of(PROPERTY, "explicit"));

        assertEquals("explicit", resolver.resolve("{{" + PROPERTY + "}}"));
    }

    @Test
    void testReplacementWithRegexCharacters() {
        PlaceholderResolver resolver = new PlaceholderResolver(Map.of("PASSWORD", "a$1\\b"));

        assertEquals("a$1\\b", resolver.resolve("{{PASSWORD}}"));
    }

    @Test
    void testNestedStructures() {
        PlaceholderResolver resolver = new PlaceholderResolver(Map.of("HOST", "api.example.com"));
        Map<String, Object> config = Map.of(
                "endpoint", "https://{{HOST}}/v1",
                "retries", 3,
                "headers", Map.of("Host", "{{HOST}}"),
                "mirrors", List.of("{{HOST}}", "backup"));

        Map<String, Object> resolved = resolver.resolveMap(config);

        assertEquals("https://api.example.com/v1", resolved.get("endpoint"));
        assertEquals(3, resolved.get("retries"));
        assertEquals(Map.of("Host", "api.example.com"), resolved.get("headers"));
        assertEquals(List.of("api.example.com", "backup"), resolved.get("mirrors"));
    }

    @Test
    void testNullHandling() {
        PlaceholderResolver resolver = new PlaceholderResolver(null);

        assertNull(resolver.resolve(null));
        assertTrue(resolver.resolveMap(null).isEmpty());
        assertFalse(resolver.hasPlaceholders(null));
    }

    @Test
    void testPlaceholderNames() {
        PlaceholderResolver resolver = new PlaceholderResolver();

        assertTrue(resolver.hasPlaceholders("x {{A}}"));
        assertFalse(resolver.hasPlaceholders("plain text"));
        assertEquals(Set.of("A", "B"), resolver.getPlaceholderNames("{{A}} and {{ B }} and {{A}}"));
    }
}
