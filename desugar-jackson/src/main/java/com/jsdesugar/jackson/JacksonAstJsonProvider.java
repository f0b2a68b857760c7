package com.jsdesugar.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsdesugar.ast.Node;
import com.jsdesugar.json.AstJsonException;
import com.jsdesugar.json.AstJsonProvider;
import com.jsdesugar.json.AstJsonSerializer;
import com.jsdesugar.json.RewriteOptionsReader;
import com.jsdesugar.rewrite.RewriteOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final RewriteOptionsReader optionsReader;

    public JacksonAstJsonProvider() {
        this(DesugarJackson.createObjectMapper());
    }

    JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.optionsReader = new JacksonOptionsReader(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public RewriteOptionsReader getOptionsReader() {
        return optionsReader;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }
    }

    private static class JacksonOptionsReader implements RewriteOptionsReader {
        private final ObjectMapper mapper;

        JacksonOptionsReader(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public RewriteOptions read(String json) throws AstJsonException {
            OptionsDocument document;
            try {
                document = mapper.readValue(json, OptionsDocument.class);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to read rewrite options", e);
            }
            if (document == null) {
                throw new AstJsonException("Rewrite options must be a JSON object, got: " + json);
            }
            return document.toOptions();
        }

        @Override
        public RewriteOptions read(Path file) throws AstJsonException {
            String json;
            try {
                json = Files.readString(file);
            } catch (IOException e) {
                throw new AstJsonException("Failed to read rewrite options from " + file, e);
            }
            return read(json);
        }
    }
}
