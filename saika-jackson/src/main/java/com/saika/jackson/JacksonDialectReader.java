package com.saika.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.saika.Dialect;
import com.saika.TokenType;
import com.saika.json.AstJsonException;
import com.saika.json.DialectJsonReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Reads a {@link Dialect} from JSON with Jackson's tree model.
 */
public class JacksonDialectReader implements DialectJsonReader {

    private static final Logger log = LoggerFactory.getLogger(JacksonDialectReader.class);

    private static final String EXTENDS_DEFAULTS = "defaults";

    private final ObjectMapper mapper;

    public JacksonDialectReader() {
        this(SaikaJackson.createObjectMapper());
    }

    public JacksonDialectReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Dialect read(String json) throws AstJsonException {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AstJsonException("Failed to read dialect", e);
        }
        if (root == null || !root.isObject()) {
            throw new AstJsonException("Dialect document must be a JSON object");
        }

        boolean layered = EXTENDS_DEFAULTS.equals(root.path("extends").asText(null));
        Dialect base = Dialect.defaults();

        Map<String, TokenType> keywords = layered ? new HashMap<>(base.keywords()) : new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = root.path("keywords").fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            keywords.put(entry.getKey(), tokenType(entry.getKey(), entry.getValue().asText()));
        }

        Map<String, String> typeNames = layered ? new HashMap<>(base.typeNames()) : new HashMap<>();
        root.path("typeNames").fields()
            .forEachRemaining(entry -> typeNames.put(entry.getKey(), entry.getValue().asText()));

        Set<String> aliases = layered ? new HashSet<>(base.entryPointAliases()) : new HashSet<>();
        root.path("entryPointAliases").forEach(alias -> aliases.add(alias.asText()));

        log.debug("Read dialect with {} keywords, {} type names, {} entry point aliases",
            keywords.size(), typeNames.size(), aliases.size());
        return Dialect.of(keywords, typeNames, aliases);
    }

    private static TokenType tokenType(String spelling, String name) {
        try {
            return TokenType.valueOf(name);
        } catch (IllegalArgumentException e) {
            throw new AstJsonException("Unknown token type '" + name + "' for keyword '" + spelling + "'", e);
        }
    }
}
