package com.svparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for AST serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = SvTreeJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(Parser.parse(text));
 * Source source = mapper.readValue(json, Source.class);
 * </pre>
 */
public final class SvTreeJackson {

    private SvTreeJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for AST serialization/deserialization.
     *
     * The returned mapper:
     * - Serializes AST nodes with loc property (instead of startLine/startCol/endLine/endCol)
     * - Handles polymorphic Node types via the "type" property
     * - Leaves absent optional fields (superClass, width, sensitivity, ...) out of the output
     * - Transforms loc fields during deserialization
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Absent optionals stay absent instead of turning into nulls or empty strings
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
