package com.astrepr.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for ObjectMapper instances that write repr trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = ReprJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(ReprParser.parse(text));
 * </pre>
 */
public final class ReprJackson {

    private ReprJackson() {
        // Utility class
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.registerModule(new ReprModule());
        return mapper;
    }
}
