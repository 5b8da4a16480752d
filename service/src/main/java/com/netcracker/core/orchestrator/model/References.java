package com.netcracker.core.orchestrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds and substitutes {@code ${type.name.attribute}} references in attribute values.
 * <p>
 * Values are the JSON-like structures produced by Jackson: strings, numbers, booleans, {@code null},
 * lists and string-keyed maps. References are recognised inside strings at any nesting depth.
 * A string consisting of exactly one reference is replaced by the referenced value as is,
 * so non-string outputs keep their type; otherwise the referenced value is interpolated as text.
 */
public final class References {
    private static final Pattern REFERENCE_PATTERN =
            Pattern.compile("\\$\\{([a-z][a-z-]*)\\.([A-Za-z0-9_-]+)\\.([A-Za-z0-9_-]+)}");

    private References() {
    }

    public static Set<Reference> collect(Object value) {
        Set<Reference> references = new LinkedHashSet<>();
        collect(value, references);
        return references;
    }

    public static Set<Reference> collect(Map<String, Object> attributes) {
        Set<Reference> references = new LinkedHashSet<>();
        attributes.values().forEach(value -> collect(value, references));
        return references;
    }

    public static Map<String, Object> substitute(Map<String, Object> attributes, Function<Reference, Object> resolver) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        attributes.forEach((name, value) -> resolved.put(name, substitute(value, resolver)));
        return Collections.unmodifiableMap(resolved);
    }

    public static Object substitute(Object value, Function<Reference, Object> resolver) {
        if (value instanceof String text) {
            return substituteText(text, resolver);
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            list.forEach(item -> resolved.add(substitute(item, resolver)));
            return Collections.unmodifiableList(resolved);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((key, item) -> resolved.put(String.valueOf(key), substitute(item, resolver)));
            return Collections.unmodifiableMap(resolved);
        }
        return value;
    }

    public static Map<String, Object> immutableCopy(Map<String, Object> attributes) {
        if (attributes == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    private static void collect(Object value, Set<Reference> references) {
        if (value instanceof String text) {
            Matcher matcher = REFERENCE_PATTERN.matcher(text);
            while (matcher.find()) {
                references.add(toReference(matcher));
            }
        } else if (value instanceof List<?> list) {
            list.forEach(item -> collect(item, references));
        } else if (value instanceof Map<?, ?> map) {
            map.values().forEach(item -> collect(item, references));
        }
    }

    private static Object substituteText(String text, Function<Reference, Object> resolver) {
        Matcher matcher = REFERENCE_PATTERN.matcher(text);
        if (matcher.matches()) {
            return resolver.apply(toReference(matcher));
        }
        matcher.reset();
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Object replacement = resolver.apply(toReference(matcher));
            matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(replacement)));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static Reference toReference(Matcher matcher) {
        return new Reference(matcher.group(1), matcher.group(2), matcher.group(3));
    }
}
