package com.jsdesugar.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances that write rewritten trees as ESTree JSON.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = DesugarJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(rewrittenProgram);
 * </pre>
 */
public final class DesugarJackson {

    private DesugarJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for AST export and options loading.
     *
     * The returned mapper:
     * - Writes every node with type, start, end and loc
     * - Leaves out null fields except those ESTree always carries (id, alternate, ...)
     * - Uses JavaScript-compatible number serialization for literals
     * - Ignores unknown keys when reading option documents
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Null fields that ESTree requires are forced back in by the mixins in AstModule
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
