package com.example.framegen_backend.template;

import java.util.Map;
import java.util.regex.Matcher;

/**
 * Replaces every placeholder occurrence in template markup.
 *
 * <p>Precedence per occurrence: the context value when the key is present (even if null), then the
 * inline default literal exactly as written, then the empty string. Values are not HTML-escaped.
 */
public final class PlaceholderSubstitutor {

    private PlaceholderSubstitutor() {
    }

    public static String substitute(String template, Map<String, ?> values) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        Map<String, ?> context = values != null ? values : Map.of();
        Matcher m = PlaceholderParser.PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement(replacementFor(m, context)));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static String replacementFor(Matcher m, Map<String, ?> context) {
        String name = m.group(1);
        if (context.containsKey(name)) {
            return ParamValueCoercer.stringify(context.get(name));
        }
        // unparsed literal, so a color written as ff0000 stays ff0000
        String literal = m.group(3);
        return literal != null ? literal : "";
    }
}
