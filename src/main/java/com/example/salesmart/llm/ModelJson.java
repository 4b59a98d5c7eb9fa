package com.example.salesmart.llm;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads JSON out of model text. Models in JSON mode still wrap answers in
 * ``` / ```json fences now and then.
 */
public final class ModelJson {

    private static final Logger log = LoggerFactory.getLogger(ModelJson.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern FENCED_BLOCK = Pattern.compile("```[A-Za-z]*[ \\t]*\\n?(.*?)```", Pattern.DOTALL);

    private ModelJson() {
    }

    /**
     * Body of the first fenced block, wherever it starts; the trimmed text when
     * there is no fence. An unclosed fence runs to the end of the text.
     */
    public static String stripCodeFence(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        int open = trimmed.indexOf("```");
        if (open < 0) {
            return trimmed;
        }
        Matcher m = FENCED_BLOCK.matcher(trimmed);
        if (m.find(open)) {
            return m.group(1).trim();
        }
        String rest = trimmed.substring(open + 3);
        int firstNewline = rest.indexOf('\n');
        return (firstNewline < 0 ? rest.replaceFirst("^[A-Za-z]+", "") : rest.substring(firstNewline + 1)).trim();
    }

    /**
     * @return the top-level JSON object, or empty for blank / non-JSON / non-object text
     */
    public static Optional<JsonNode> parseObject(String text) {
        String body = stripCodeFence(text);
        if (body.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(body);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("[ModelJson] unparsable model output (first 200 chars): {}",
                    body.substring(0, Math.min(200, body.length())));
            return Optional.empty();
        }
    }

    public static String write(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize prompt payload", e);
        }
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
