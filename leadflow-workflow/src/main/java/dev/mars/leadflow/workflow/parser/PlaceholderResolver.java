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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{NAME}}} placeholders. Names are looked up in the explicit
 * variables, then environment variables, then system properties. A placeholder
 * that cannot be resolved is left as written.
 */
public class PlaceholderResolver {

    static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{([^}]+)\\}\\}");

    private final Map<String, Object> variables;

    public PlaceholderResolver() {
        this(Map.of());
    }

    public PlaceholderResolver(Map<String, Object> variables) {
        this.variables = new HashMap<>(variables != null ? variables : Map.of());
    }

    public String resolve(String template) {
        if (template == null) {
            return null;
        }

        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            Object value = lookup(matcher.group(1).trim());
            String replacement = value != null ? value.toString() : matcher.group(0);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Resolves strings anywhere inside nested maps and lists. Other values are returned unchanged.
     */
    public Object resolveValue(Object value) {
        if (value instanceof String) {
            return resolve((String) value);
        }
        if (value instanceof Map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                resolved.put(String.valueOf(entry.getKey()), resolveValue(entry.getValue()));
            }
            return resolved;
        }
        if (value instanceof List) {
            List<Object> resolved = new ArrayList<>();
            for (Object item : (List<?>) value) {
                resolved.add(resolveValue(item));
            }
            return resolved;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> resolveMap(Map<String, Object> map) {
        return map != null ? (Map<String, Object>) resolveValue(map) : new LinkedHashMap<>();
    }

    public boolean hasPlaceholders(String template) {
        return template != null && PLACEHOLDER_PATTERN.matcher(template).find();
    }

    public Set<String> getPlaceholderNames(String template) {
        if (template == null) {
            return Set.of();
        }
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1).trim());
        }
        return names;
    }

    private Object lookup(String name) {
        if (variables.containsKey(name)) {
            return variables.get(name);
        }
        String envValue = System.getenv(name);
        if (envValue != null) {
            return envValue;
        }
        return System.getProperty(name);
    }
}
