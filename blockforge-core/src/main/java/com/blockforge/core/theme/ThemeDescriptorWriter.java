package com.blockforge.core.theme;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.Objects;

/**
 * Writes theme descriptors as pretty-printed JSON. Absent values are not written.
 */
public final class ThemeDescriptorWriter {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .serializationInclusion(JsonInclude.Include.NON_NULL)
        .build();

    private ThemeDescriptorWriter() {
    }

    /**
     * Serializes a descriptor.
     *
     * @param descriptor theme descriptor
     * @return JSON text
     */
    public static String write(ThemeDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        try {
            return MAPPER.writeValueAsString(descriptor);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize theme descriptor", e);
        }
    }
}
