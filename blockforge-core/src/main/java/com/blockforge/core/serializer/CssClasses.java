package com.blockforge.core.serializer;

import java.util.StringJoiner;

/**
 * Naming rules for the CSS classes derived from block attributes.
 *
 * <p>The same slug rules are used by the theme descriptor: a palette entry with slug
 * {@code primary} is addressed as {@code has-primary-background-color}.
 */
public final class CssClasses {

    private CssClasses() {
        // Utility class
    }

    /**
     * Text alignment class.
     *
     * @param align alignment value (left, center, right)
     * @return {@code has-text-align-{align}} or {@code ""} when no alignment is set
     */
    public static String textAlign(Object align) {
        String value = BlockMarkup.text(align);
        return value.isEmpty() ? "" : "has-text-align-" + value;
    }

    /**
     * Background color class for a palette slug.
     *
     * @param slug palette slug
     * @return {@code has-{slug}-background-color} or {@code ""} when no slug is set
     */
    public static String backgroundColor(Object slug) {
        String value = BlockMarkup.text(slug);
        return value.isEmpty() ? "" : "has-" + value + "-background-color";
    }

    /**
     * Joins class names with single spaces, skipping empty contributions.
     *
     * @param classes class names in output order (base class first)
     * @return space-separated class list
     */
    public static String join(String... classes) {
        StringJoiner joiner = new StringJoiner(" ");
        for (String cssClass : classes) {
            if (cssClass != null && !cssClass.isBlank()) {
                joiner.add(cssClass.trim());
            }
        }
        return joiner.toString();
    }
}
