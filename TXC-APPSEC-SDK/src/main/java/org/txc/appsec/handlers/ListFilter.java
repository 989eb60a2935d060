package org.txc.appsec.handlers;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Client-side narrowing of list responses for endpoints that have no server-side filter.
 */
public final class ListFilter {

    private ListFilter() {}

    /**
     * Keeps the entries whose key equals {@code wanted}, in their original order.
     * An unset filter (null, blank text or numeric zero) returns {@code items} unchanged.
     */
    public static <T, K> List<T> retain(List<T> items, K wanted, Function<T, K> keyExtractor) {
        if (isUnset(wanted)) {
            return items;
        }
        List<T> kept = new ArrayList<>();
        if (items == null) {
            return kept;
        }
        for (T item : items) {
            if (item != null && Objects.equals(keyExtractor.apply(item), wanted)) {
                kept.add(item);
            }
        }
        return kept;
    }

    static boolean isUnset(Object wanted) {
        if (wanted == null) {
            return true;
        }
        if (wanted instanceof CharSequence) {
            return wanted.toString().isBlank();
        }
        if (wanted instanceof Number) {
            return ((Number) wanted).longValue() == 0;
        }
        return false;
    }
}
