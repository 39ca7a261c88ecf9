package com.blockforge.core.pattern;

import java.util.List;

/**
 * A named composition strategy of a section type.
 *
 * <p>Implemented by the layout enums nested in each generator; the id is the value accepted in
 * section definitions (e.g. {@code split-left}).
 */
public interface LayoutVariant {

    /**
     * Returns the layout identifier.
     *
     * @return lowercase, hyphenated layout id
     */
    String id();

    /**
     * Returns alternative ids that resolve to this layout.
     *
     * @return alias ids, empty by default
     */
    default List<String> aliases() {
        return List.of();
    }
}
