package com.example.salesmart.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.salesmart.config.DiscoveryProperties;
import com.example.salesmart.llm.ModelJson;
import com.example.salesmart.llm.ModelResponse;
import com.example.salesmart.llm.ResilientModelCaller;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Free text + project context -> (query, filter text, maxProducts).
 * maxProducts is never taken from the model as-is: absent means the
 * configured default, present is clamped to the allowed range.
 */
@Component
public class NaturalLanguageIntentParser {

    private static final Logger log = LoggerFactory.getLogger(NaturalLanguageIntentParser.class);

    private final ResilientModelCaller modelCaller;
    private final DiscoveryProperties props;

    public NaturalLanguageIntentParser(ResilientModelCaller modelCaller, DiscoveryProperties props) {
        this.modelCaller = modelCaller;
        this.props = props;
    }

    public DiscoveryIntent parse(String rawText, ProjectContext project, DiscoveryDeadline deadline) {
        deadline.check(DiscoveryStage.PARSE_INTENT);
        ModelResponse response = modelCaller.call(buildPrompt(rawText, project), null, true,
                deadline.cap(modelCaller.defaultTimeout()), deadline.guard(DiscoveryStage.PARSE_INTENT));

        JsonNode root = ModelJson.parseObject(response.text())
                .orElseThrow(() -> new DiscoveryAbortException(DiscoveryErrorType.PARSING_FAILED,
                        "Could not understand the request: the model returned no readable JSON"));

        String query = root.path("query").isTextual() ? root.get("query").asText().trim() : "";
        if (query.isEmpty()) {
            throw new DiscoveryAbortException(DiscoveryErrorType.PARSING_FAILED,
                    "Could not understand the request: no search query was found");
        }

        JsonNode filterNode = root.get("filter_criteria");
        String filterText = filterNode != null && filterNode.isTextual() && !filterNode.asText().isBlank()
                ? filterNode.asText().trim()
                : null;

        int maxProducts = resolveMaxProducts(root.get("max_products"));
        log.info("[IntentParser] query='{}' hasFilter={} maxProducts={}", query, filterText != null, maxProducts);
        return new DiscoveryIntent(query, filterText, maxProducts);
    }

    int resolveMaxProducts(JsonNode node) {
        if (node == null || node.isNull()) {
            return props.getDefaultMaxProducts();
        }
        int requested;
        if (node.isNumber()) {
            requested = node.asInt();
        } else if (node.isTextual() && node.asText().trim().matches("\\d+")) {
            requested = Integer.parseInt(node.asText().trim());
        } else {
            log.warn("[IntentParser] ignoring non-numeric max_products={}", node);
            return props.getDefaultMaxProducts();
        }
        return props.clampMaxProducts(requested);
    }

    private String buildPrompt(String rawText, ProjectContext project) {
        return """
                You turn a shopper's request (usually Vietnamese) into a product search for
                Vietnamese marketplaces.

                Project context:
                %s

                User request:
                "%s"

                Answer with JSON only:
                {
                  "query": "short product search phrase, without numbers of items, ratings or prices",
                  "filter_criteria": "the filtering conditions in the user's words (price, rating, reviews, sales, platform, brand, mall...), or null when there are none",
                  "max_products": number of products the user wants, or null when not stated
                }
                """.formatted(ModelJson.write(project.toPromptMap()), rawText.replace("\"", "'"));
    }
}
