package com.example.framegen_backend.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts placeholder default literals into their declared type and turns context values back
 * into markup text.
 */
public final class ParamValueCoercer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ParamValueCoercer.class);

    /** Plain decimal integers; single underscores may group digits. */
    private static final Pattern INTEGER_LITERAL = Pattern.compile("[+-]?\\d+(?:_\\d+)*");
    /** Decimal fractions with optional exponent; no hex, suffixes or named values. */
    private static final Pattern DECIMAL_LITERAL = Pattern.compile(
            "[+-]?(?=\\.?\\d)(?:\\d+(?:_\\d+)*)?\\.(?:\\d+(?:_\\d+)*)?(?:[eE][+-]?\\d+(?:_\\d+)*)?");

    private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "on");
    static final String DEFAULT_COLOR = "#000000";

    private ParamValueCoercer() {
    }

    /**
     * Parses a default literal for the given type. A missing literal yields the type's zero value.
     *
     * @param type    declared placeholder type
     * @param literal text after {@code =} in the placeholder, or null when absent
     * @return String for text/color, Integer (Long or BigInteger when wider) or Double for number, Boolean for bool
     */
    public static Object coerceDefault(ParamType type, @Nullable String literal) {
        if (literal == null) {
            return zeroValue(type);
        }
        return switch (type) {
            case NUMBER -> parseNumber(literal);
            case BOOL -> TRUTHY.contains(literal.toLowerCase(Locale.ROOT));
            case COLOR -> literal.startsWith("#") ? literal : "#" + literal;
            case TEXT -> literal;
        };
    }

    public static Object zeroValue(ParamType type) {
        return switch (type) {
            case TEXT -> "";
            case NUMBER -> 0;
            case COLOR -> DEFAULT_COLOR;
            case BOOL -> Boolean.FALSE;
        };
    }

    /**
     * Renders a context value for substitution. Booleans become the lowercase words
     * {@code true}/{@code false}.
     */
    public static String stringify(@Nullable Object value) {
        if (value == null) return "";
        if (value instanceof Boolean b) return b ? "true" : "false";
        return String.valueOf(value);
    }

    private static Number parseNumber(String literal) {
        String trimmed = literal.trim();
        boolean decimal = literal.contains(".");
        if (!(decimal ? DECIMAL_LITERAL : INTEGER_LITERAL).matcher(trimmed).matches()) {
            LOGGER.warn("Invalid number value '{}', using 0", literal);
            return 0;
        }
        String digits = trimmed.replace("_", "");
        if (decimal) {
            return Double.parseDouble(digits);
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException overflow) {
            try {
                return Long.parseLong(digits);
            } catch (NumberFormatException wider) {
                return new BigInteger(digits);
            }
        }
    }
}
