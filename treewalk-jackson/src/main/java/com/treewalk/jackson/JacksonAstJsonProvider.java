package com.treewalk.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.treewalk.ast.Node;
import com.treewalk.json.AstJsonException;
import com.treewalk.json.AstJsonProvider;
import com.treewalk.json.AstJsonSerializer;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;

    public JacksonAstJsonProvider() {
        this.mapper = TreewalkJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
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
                throw new AstJsonException("Failed to serialize " + node.type() + " node", e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.type() + " node", e);
            }
        }
    }
}
