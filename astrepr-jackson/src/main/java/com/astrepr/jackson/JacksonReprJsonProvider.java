package com.astrepr.jackson;

import com.astrepr.json.ReprJsonException;
import com.astrepr.json.ReprJsonProvider;
import com.astrepr.json.ReprJsonSerializer;
import com.astrepr.tree.ReprNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Jackson-based implementation of ReprJsonProvider.
 */
public class JacksonReprJsonProvider implements ReprJsonProvider {

    private final ReprJsonSerializer serializer;

    public JacksonReprJsonProvider() {
        this.serializer = new JacksonSerializer(ReprJackson.createObjectMapper());
    }

    @Override
    public ReprJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements ReprJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(ReprNode node) throws ReprJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (Exception e) {
                throw new ReprJsonException("Failed to serialize " + node.kind() + " node", e);
            }
        }

        @Override
        public String serializePretty(ReprNode node) throws ReprJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (Exception e) {
                throw new ReprJsonException("Failed to serialize " + node.kind() + " node", e);
            }
        }
    }
}
