package com.blockforge.core.theme;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * One configured palette color.
 *
 * <p>Accepted in configuration either as a bare color string or as an object:
 * <pre>{@code
 * colors:
 *   primary: "#0055ff"                                  # name derived from the slug
 *   brand-dark: { color: "#111827", name: "Ink" }       # name used verbatim
 * }</pre>
 *
 * @param color color value, passed through without validation
 * @param name display name, or null to derive it from the slug
 */
@JsonDeserialize(using = ColorEntry.Deserializer.class)
public record ColorEntry(String color, String name) {

    /**
     * Creates an entry whose display name is derived from its slug.
     *
     * @param color color value
     * @return color entry
     */
    public static ColorEntry of(String color) {
        return new ColorEntry(color, null);
    }

    /**
     * Reads a color entry from a scalar or an object.
     */
    public static class Deserializer extends StdDeserializer<ColorEntry> {

        public Deserializer() {
            super(ColorEntry.class);
        }

        @Override
        public ColorEntry deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            if (parser.currentToken().isScalarValue()) {
                return ColorEntry.of(parser.getText());
            }
            if (parser.isExpectedStartObjectToken()) {
                JsonNode node = context.readTree(parser);
                return new ColorEntry(text(node, "color"), text(node, "name"));
            }
            return (ColorEntry) context.handleUnexpectedToken(ColorEntry.class, parser);
        }

        private static String text(JsonNode node, String field) {
            JsonNode value = node.get(field);
            return value == null || value.isNull() ? null : value.asText();
        }
    }
}
