package com.example.framegen_backend.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the parameter schema from template markup.
 *
 * <p>Placeholder syntax: {@code {{name}}}, {@code {{name=default}}}, {@code {{name:type}}} and
 * {@code {{name:type=default}}}. The first occurrence of a name defines its type and default;
 * later occurrences only take part in substitution.
 */
public final class PlaceholderParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlaceholderParser.class);

    /** Groups: 1 = name, 2 = type (optional), 3 = default literal (optional). */
    static final Pattern PLACEHOLDER = Pattern.compile(
            "\\{\\{([a-zA-Z_][a-zA-Z0-9_]*)(?::([a-z]+))?(?:=([^}]+))?\\}\\}");

    /** Filled by the caller on every render, never exposed as template parameters. */
    public static final Set<String> RESERVED_NAMES = Set.of(
            "title", "text", "image",
            "content_title", "content_author", "content_subtitle", "content_genre");

    private PlaceholderParser() {
    }

    /**
     * @param template raw template markup
     * @return declarations keyed by name, in order of first occurrence
     */
    public static Map<String, ParamDeclaration> parse(String template) {
        if (template == null || template.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, ParamDeclaration> params = new LinkedHashMap<>();
        Matcher m = PLACEHOLDER.matcher(template);
        while (m.find()) {
            String name = m.group(1);
            if (RESERVED_NAMES.contains(name) || params.containsKey(name)) {
                continue;
            }
            String typeToken = m.group(2) != null ? m.group(2) : ParamType.TEXT.token();
            ParamType type = ParamType.fromToken(typeToken).orElseGet(() -> {
                LOGGER.warn("Unknown parameter type '{}' for '{}', defaulting to 'text'", typeToken, name);
                return ParamType.TEXT;
            });
            Object defaultValue = ParamValueCoercer.coerceDefault(type, m.group(3));
            params.put(name, ParamDeclaration.of(name, type, defaultValue));
        }
        if (!params.isEmpty()) {
            LOGGER.debug("Parsed {} custom parameter(s) from template: {}", params.size(), params.keySet());
        }
        return Collections.unmodifiableMap(params);
    }
}
