package org.txc.appsec.json;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Normalized form of a JSON value the API types loosely: a single string, a list of strings, or nothing.
 */
public final class FlexibleValue {

    public enum Kind { TEXT, LIST, EMPTY }

    private static final FlexibleValue EMPTY = new FlexibleValue(Kind.EMPTY, null, Collections.emptyList());

    private final Kind kind;
    private final String text;
    private final List<String> items;

    private FlexibleValue(Kind kind, String text, List<String> items) {
        this.kind = kind;
        this.text = text;
        this.items = items;
    }

    public static FlexibleValue text(String text) {
        return new FlexibleValue(Kind.TEXT, Objects.requireNonNull(text), Collections.singletonList(text));
    }

    public static FlexibleValue list(List<String> items) {
        return new FlexibleValue(Kind.LIST, null, List.copyOf(items));
    }

    public static FlexibleValue empty() {
        return EMPTY;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the string for TEXT values, {@code null} otherwise
     */
    public String asText() {
        return text;
    }

    /**
     * @return the elements for LIST values, a singleton for TEXT values, {@code null} for EMPTY
     */
    public List<String> asList() {
        return kind == Kind.EMPTY ? null : items;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlexibleValue that = (FlexibleValue) o;
        return kind == that.kind && Objects.equals(text, that.text) && Objects.equals(items, that.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, items);
    }

    @Override
    public String toString() {
        return "FlexibleValue{" + "kind=" + kind + ", text='" + text + '\'' + ", items=" + items + '}';
    }
}
