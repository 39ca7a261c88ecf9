package com.blockforge.core.pattern;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.CoreBlock;
import com.blockforge.core.model.section.SectionInput;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Maps section types to their pattern generators and builds section blocks from untyped input.
 *
 * <p>Result of {@link #createPattern(SectionInput)}:
 * <ul>
 *   <li>Type not declared in {@link SectionType}: {@link Optional#empty()}</li>
 *   <li>Declared type without a generator: a placeholder group with "coming soon" text</li>
 *   <li>Otherwise: the generator's block tree for the converted configuration</li>
 * </ul>
 *
 * <p>Raw configuration maps are converted to the generator's configuration record with Jackson;
 * unknown properties are ignored.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PatternRegistry registry = PatternRegistry.discover();
 * Optional<BlockNode> hero = registry.createPattern(
 *     SectionInput.of("hero", Map.of("heading", "Welcome", "subheading", "Fresh bread daily")));
 * }</pre>
 */
public class PatternRegistry {

    private static final Logger log = LoggerFactory.getLogger(PatternRegistry.class);

    private static final String PLACEHOLDER_SUFFIX = " section coming soon";

    private final Map<SectionType, PatternGenerator<?>> generators;
    private final ObjectMapper objectMapper;

    /**
     * Creates a registry from explicit generators.
     *
     * @param generators generators to register; a later generator replaces an earlier one for
     *                   the same section type
     */
    public PatternRegistry(Collection<? extends PatternGenerator<?>> generators) {
        Objects.requireNonNull(generators, "generators must not be null");
        Map<SectionType, PatternGenerator<?>> byType = new EnumMap<>(SectionType.class);
        for (PatternGenerator<?> generator : generators) {
            PatternGenerator<?> previous = byType.put(generator.getSectionType(), generator);
            if (previous != null) {
                log.warn("Generator {} replaces {} for section '{}'",
                    generator.getClass().getSimpleName(), previous.getClass().getSimpleName(), generator.getId());
            }
        }
        this.generators = Collections.unmodifiableMap(byType);
        this.objectMapper = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    /**
     * Creates a registry with all generators found on the classpath.
     *
     * @return registry of discovered generators
     */
    public static PatternRegistry discover() {
        log.debug("Discovering pattern generators via ServiceLoader");
        List<PatternGenerator<?>> found = new ArrayList<>();
        for (PatternGenerator<?> generator : ServiceLoader.load(PatternGenerator.class)) {
            log.debug("Found pattern generator: {} ({})", generator.getId(), generator.getDisplayName());
            found.add(generator);
        }
        log.debug("Discovered {} pattern generators", found.size());
        return new PatternRegistry(found);
    }

    /**
     * Gets the generator for a section type.
     *
     * @param type section type
     * @return generator, or empty if the type has none
     */
    public Optional<PatternGenerator<?>> getGenerator(SectionType type) {
        return Optional.ofNullable(generators.get(type));
    }

    /**
     * Returns all registered generators in section declaration order.
     *
     * @return generators
     */
    public List<PatternGenerator<?>> getGenerators() {
        return List.copyOf(generators.values());
    }

    /**
     * Builds the block tree of a section.
     *
     * @param input section type, optional layout and raw configuration
     * @return root block, or empty if the section type is not declared
     * @throws IllegalArgumentException if the configuration cannot be converted to the
     *                                  generator's configuration type
     */
    public Optional<BlockNode> createPattern(SectionInput input) {
        Objects.requireNonNull(input, "input must not be null");

        Optional<SectionType> type = SectionType.fromId(input.type());
        if (type.isEmpty()) {
            log.debug("Unknown section type '{}'", input.type());
            return Optional.empty();
        }

        PatternGenerator<?> generator = generators.get(type.get());
        if (generator == null) {
            log.debug("No generator for section '{}', emitting placeholder", type.get().id());
            return Optional.of(placeholder(type.get()));
        }

        return Optional.of(generate(generator, input.config(), input.layout()));
    }

    /**
     * Builds the placeholder block of a declared section type without a generator.
     *
     * @param type section type
     * @return group containing one centered "coming soon" paragraph
     */
    public static BlockNode placeholder(SectionType type) {
        BlockNode text = BlockNode.leaf(CoreBlock.PARAGRAPH.blockName(), Map.of("align", "center"),
            type.label() + PLACEHOLDER_SUFFIX);
        return BlockNode.container(CoreBlock.GROUP.blockName(), Map.of(
            "layout", Map.of("type", "constrained"),
            "style", Map.of("spacing", Map.of("padding", Map.of("top", "60px", "bottom", "60px")))
        ), List.of(text));
    }

    private <C> BlockNode generate(PatternGenerator<C> generator, Map<String, Object> rawConfig, String layout) {
        C config;
        try {
            config = objectMapper.convertValue(rawConfig, generator.getConfigType());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Invalid configuration for section '" + generator.getId() + "': " + e.getMessage(), e);
        }
        return generator.generate(config, layout);
    }
}
