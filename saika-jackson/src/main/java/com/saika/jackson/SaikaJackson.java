package com.saika.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Builds the {@link ObjectMapper} shared by syntax tree conversion and dialect loading.
 *
 * <p>Trees are written with a {@code "type"} member on every node and without absent optional
 * children. Dialect files are edited by hand, so the mapper also accepts Java-style comments
 * and trailing commas.</p>
 */
public final class SaikaJackson {

    private SaikaJackson() {
    }

    public static ObjectMapper createObjectMapper() {
        return JsonMapper.builder()
            .addModule(new ParameterNamesModule())
            .addModule(new AstModule())
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS, JsonReadFeature.ALLOW_TRAILING_COMMA)
            .build();
    }
}
