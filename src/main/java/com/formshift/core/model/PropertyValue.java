package com.formshift.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A typed property value as read from the source form.
 * <p>
 * The raw text is kept verbatim; the {@link Type} tag records how it was classified.
 * String literals are stored unquoted.
 *
 * @param type classification of the value
 * @param raw  textual form of the value
 */
public record PropertyValue(Type type, String raw) {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?[FfDdMm]?");

    public enum Type { TEXT, NUMBER, BOOLEAN, OPAQUE }

    public PropertyValue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(raw, "raw");
    }

    public static PropertyValue text(String value) {
        return new PropertyValue(Type.TEXT, value);
    }

    public static PropertyValue number(Number value) {
        return new PropertyValue(Type.NUMBER, String.valueOf(value));
    }

    public static PropertyValue bool(boolean value) {
        return new PropertyValue(Type.BOOLEAN, String.valueOf(value));
    }

    public static PropertyValue opaque(String expression) {
        return new PropertyValue(Type.OPAQUE, expression);
    }

    /**
     * Classifies a source expression: quoted strings become {@code TEXT} (unescaped),
     * numeric literals {@code NUMBER}, {@code true}/{@code false} {@code BOOLEAN}, and
     * anything else {@code OPAQUE}.
     */
    public static PropertyValue infer(String expression) {
        String expr = expression == null ? "" : expression.trim();
        if (expr.length() >= 2 && expr.startsWith("\"") && expr.endsWith("\"")) {
            return text(unescape(expr.substring(1, expr.length() - 1)));
        }
        if ("true".equals(expr) || "false".equals(expr)) {
            return bool(Boolean.parseBoolean(expr));
        }
        if (NUMBER.matcher(expr).matches()) {
            return new PropertyValue(Type.NUMBER, stripSuffix(expr));
        }
        return opaque(expr);
    }

    /** Last dotted segment of the raw value, e.g. {@code Top} for {@code DockStyle.Top}. */
    public String simpleName() {
        int dot = raw.lastIndexOf('.');
        return dot >= 0 ? raw.substring(dot + 1) : raw;
    }

    public boolean asBoolean() {
        return Boolean.parseBoolean(raw);
    }

    private static String stripSuffix(String number) {
        char last = number.charAt(number.length() - 1);
        return Character.isLetter(last) ? number.substring(0, number.length() - 1) : number;
    }

    private static String unescape(String s) {
        return s.replace("\\\"", "\"").replace("\\\\", "\\");
    }

    @Override
    public String toString() {
        return raw;
    }
}
