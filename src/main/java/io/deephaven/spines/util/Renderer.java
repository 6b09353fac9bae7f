package io.deephaven.spines.util;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Helpers for building error and diagnostic messages.
 */
public final class Renderer {
    private Renderer() {}

    /**
     * Render a collection as a comma-separated list.
     *
     * @param items The items.
     * @return The items joined by ", ".
     */
    public static String renderList(Collection<?> items) {
        return items.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
