package com.optmodeler.core.session;

import com.optmodeler.core.expression.IndexKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One value reported by the solver.
 *
 * @param entityName rendered name of the entity or statement, possibly workspace-prefixed
 * @param key member key, {@link IndexKey#EMPTY} for scalars
 * @param value reported value
 */
public record ValueRow(String entityName, IndexKey key, double value) {

    public ValueRow {
        Objects.requireNonNull(entityName, "entityName must not be null");
        key = key == null ? IndexKey.EMPTY : key;
    }

    /**
     * Parses a qualified name such as {@code x['a',1]} or {@code total}.
     *
     * @param qualifiedName name with optional bracketed key
     * @param value reported value
     * @return parsed row
     * @throws IllegalArgumentException if the brackets or quotes are malformed
     */
    public static ValueRow parse(String qualifiedName, double value) {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        String text = qualifiedName.strip();
        int open = text.indexOf('[');
        if (open < 0) {
            return new ValueRow(text, IndexKey.EMPTY, value);
        }
        if (!text.endsWith("]")) {
            throw new IllegalArgumentException("Unbalanced brackets in '" + qualifiedName + "'");
        }
        String name = text.substring(0, open).strip();
        List<Object> elements = splitKey(text.substring(open + 1, text.length() - 1), qualifiedName);
        return new ValueRow(name, new IndexKey(elements), value);
    }

    private static List<Object> splitKey(String body, String original) {
        List<Object> elements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        boolean wasQuoted = false;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\'') {
                if (quoted && i + 1 < body.length() && body.charAt(i + 1) == '\'') {
                    current.append('\'');
                    i++;
                } else {
                    quoted = !quoted;
                    wasQuoted = true;
                }
            } else if (c == ',' && !quoted) {
                elements.add(element(current.toString(), wasQuoted));
                current.setLength(0);
                wasQuoted = false;
            } else if (quoted || !Character.isWhitespace(c)) {
                current.append(c);
            }
        }
        if (quoted) {
            throw new IllegalArgumentException("Unterminated quote in '" + original + "'");
        }
        elements.add(element(current.toString(), wasQuoted));
        return elements;
    }

    private static Object element(String text, boolean quoted) {
        if (quoted) {
            return text;
        }
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Empty key element");
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException notLong) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException notNumber) {
                return text;
            }
        }
    }
}
