package com.blockforge.core.pattern;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Declared section types.
 *
 * <p>Gallery and contact are declared but not composed yet: requesting them yields a
 * "coming soon" placeholder instead of no result.
 */
public enum SectionType {
    HERO("hero", true),
    FEATURES("features", true),
    CTA("cta", true, "call-to-action"),
    TESTIMONIALS("testimonials", true),
    FOOTER("footer", true),
    PRICING("pricing", true),
    TEAM("team", true),
    STATS("stats", true, "statistics"),
    LOGOS("logos", true, "logo-cloud"),
    FAQ("faq", true),
    GALLERY("gallery", false),
    CONTACT("contact", false);

    private final String id;
    private final boolean implemented;
    private final List<String> aliases;

    SectionType(String id, boolean implemented, String... aliases) {
        this.id = id;
        this.implemented = implemented;
        this.aliases = List.of(aliases);
    }

    public String id() {
        return id;
    }

    /**
     * Whether a generator composes this section type.
     *
     * @return false for declared-only types
     */
    public boolean isImplemented() {
        return implemented;
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * Returns the id with its first letter capitalized (e.g. {@code Gallery}).
     *
     * @return display label
     */
    public String label() {
        return Character.toUpperCase(id.charAt(0)) + id.substring(1);
    }

    /**
     * Resolves a section type by id or alias, ignoring case and surrounding whitespace.
     *
     * @param value section type id or alias
     * @return matching type, or empty if the value is not declared
     */
    public static Optional<SectionType> fromId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SectionType type : values()) {
            if (type.id.equals(normalized) || type.aliases.contains(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
