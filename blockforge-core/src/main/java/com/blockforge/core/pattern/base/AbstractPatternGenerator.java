package com.blockforge.core.pattern.base;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.pattern.LayoutVariant;
import com.blockforge.core.pattern.PatternGenerator;
import com.blockforge.core.pattern.SectionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Base class for pattern generators with a closed set of layout variants.
 *
 * <p>Subclasses declare their layouts as an enum implementing {@link LayoutVariant} and pass one
 * composition strategy per constant. The strategy table is checked at construction: a layout
 * without a strategy is a programming error and fails with {@link IllegalStateException}, so
 * dispatch is total at runtime.
 *
 * <p>Layout resolution:
 * <ul>
 *   <li>Ids and layout aliases are matched case-insensitively after trimming</li>
 *   <li>{@code null}, blank and unknown ids select the default layout</li>
 * </ul>
 *
 * @param <C> section configuration type
 * @param <L> layout enum
 */
public abstract class AbstractPatternGenerator<C, L extends Enum<L> & LayoutVariant> implements PatternGenerator<C> {

    private static final Logger log = LoggerFactory.getLogger(AbstractPatternGenerator.class);

    private final SectionType sectionType;
    private final String displayName;
    private final Class<C> configType;
    private final Class<L> layoutType;
    private final L defaultLayout;
    private final Map<L, Function<C, BlockNode>> strategies;

    /**
     * Creates a generator with its layout strategy table.
     *
     * @param sectionType section type composed by this generator
     * @param displayName human-readable name
     * @param configType configuration record type
     * @param layoutType layout enum type
     * @param defaultLayout layout used for missing or unknown ids
     * @param strategies one composition strategy per layout constant
     * @throws IllegalStateException if a layout constant has no strategy
     */
    protected AbstractPatternGenerator(
        SectionType sectionType,
        String displayName,
        Class<C> configType,
        Class<L> layoutType,
        L defaultLayout,
        Map<L, Function<C, BlockNode>> strategies
    ) {
        this.sectionType = Objects.requireNonNull(sectionType, "sectionType must not be null");
        this.displayName = Objects.requireNonNull(displayName, "displayName must not be null");
        this.configType = Objects.requireNonNull(configType, "configType must not be null");
        this.layoutType = Objects.requireNonNull(layoutType, "layoutType must not be null");
        this.defaultLayout = Objects.requireNonNull(defaultLayout, "defaultLayout must not be null");
        Objects.requireNonNull(strategies, "strategies must not be null");

        EnumMap<L, Function<C, BlockNode>> table = new EnumMap<>(layoutType);
        table.putAll(strategies);
        for (L layout : layoutType.getEnumConstants()) {
            if (table.get(layout) == null) {
                throw new IllegalStateException(
                    "No composition strategy for layout '" + layout.id() + "' of section '" + sectionType.id() + "'");
            }
        }
        this.strategies = table;
    }

    @Override
    public String getId() {
        return sectionType.id();
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }

    @Override
    public SectionType getSectionType() {
        return sectionType;
    }

    @Override
    public Class<C> getConfigType() {
        return configType;
    }

    @Override
    public List<String> getLayouts() {
        return Arrays.stream(layoutType.getEnumConstants())
            .map(LayoutVariant::id)
            .toList();
    }

    @Override
    public String getDefaultLayout() {
        return defaultLayout.id();
    }

    @Override
    public BlockNode generate(C config, String layout) {
        Objects.requireNonNull(config, "config must not be null");
        L resolved = resolveLayout(layout);
        log.debug("Composing {} section with layout '{}'", sectionType.id(), resolved.id());
        return strategies.get(resolved).apply(config);
    }

    /**
     * Resolves a layout id to its enum constant.
     *
     * @param layout layout id, may be null
     * @return matching layout, or the default layout
     */
    public L resolveLayout(String layout) {
        if (layout == null || layout.isBlank()) {
            return defaultLayout;
        }
        return findLayout(layout).orElseGet(() -> {
            log.debug("Unknown {} layout '{}', falling back to '{}'", sectionType.id(), layout, defaultLayout.id());
            return defaultLayout;
        });
    }

    @Override
    public boolean supportsLayout(String layout) {
        return layout != null && findLayout(layout).isPresent();
    }

    private Optional<L> findLayout(String layout) {
        String normalized = layout.trim();
        return Arrays.stream(layoutType.getEnumConstants())
            .filter(candidate -> candidate.id().equalsIgnoreCase(normalized)
                || candidate.aliases().stream().anyMatch(normalized::equalsIgnoreCase))
            .findFirst();
    }
}
