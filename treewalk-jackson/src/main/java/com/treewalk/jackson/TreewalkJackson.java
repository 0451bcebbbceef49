package com.treewalk.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for ObjectMapper instances that write node trees as ESTree-shaped JSON.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = TreewalkJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(result.program());
 * </pre>
 */
public final class TreewalkJackson {

    private TreewalkJackson() {
    }

    /**
     * Creates a mapper that writes {@code type} first, then {@code start}, {@code end} and a
     * {@code loc} object of lines, then the kind's own fields. Absent optional children are
     * omitted except where {@link AstModule} keeps them as explicit nulls.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.registerModule(new AstModule());
        return mapper;
    }
}
