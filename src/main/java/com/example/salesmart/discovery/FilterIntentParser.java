package com.example.salesmart.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.salesmart.llm.ModelJson;
import com.example.salesmart.llm.ModelResponse;
import com.example.salesmart.llm.ResilientModelCaller;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Free-text filter conditions -> {@link FilterCriteria}.
 */
@Component
public class FilterIntentParser {

    private static final Logger log = LoggerFactory.getLogger(FilterIntentParser.class);
    private static final int RAW_PREVIEW = 200;

    private final ResilientModelCaller modelCaller;

    public FilterIntentParser(ResilientModelCaller modelCaller) {
        this.modelCaller = modelCaller;
    }

    public FilterCriteria parse(String filterText, DiscoveryDeadline deadline) {
        deadline.check(DiscoveryStage.PARSE_CRITERIA);
        ModelResponse response = modelCaller.call(buildPrompt(filterText), null, true,
                deadline.cap(modelCaller.defaultTimeout()), deadline.guard(DiscoveryStage.PARSE_CRITERIA));

        JsonNode root = ModelJson.parseObject(response.text()).orElse(null);
        if (root == null) {
            throw failure(filterText, "the model returned no readable JSON", response.text());
        }
        FilterCriteria criteria;
        try {
            criteria = FilterCriteriaReader.read(root);
        } catch (IllegalArgumentException e) {
            throw failure(filterText, e.getMessage(), response.text());
        }
        log.info("[FilterParser] criteria={}", criteria.toMap());
        return criteria;
    }

    private static DiscoveryAbortException failure(String filterText, String reason, String raw) {
        String preview = raw == null ? "" : raw.substring(0, Math.min(RAW_PREVIEW, raw.length()));
        log.warn("[FilterParser] rejected criteria for '{}': {} raw={}", filterText, reason, preview);
        return new DiscoveryAbortException(DiscoveryErrorType.INTENT_PARSING_FAILED,
                "Could not parse filter criteria '" + filterText + "': " + reason);
    }

    private String buildPrompt(String filterText) {
        return """
                Extract product filter criteria from the text below (usually Vietnamese).

                Text:
                "%s"

                Answer with one JSON object. Include only the keys the text actually states:
                  min_price, max_price            number, VND ("500k" = 500000, "2 triệu" = 2000000)
                  min_rating, max_rating          number between 0 and 5
                  min_review_count, max_review_count   integer
                  min_sales_count, max_sales_count     integer
                  min_trust_score, max_trust_score     number
                  platforms                       list of "lazada", "tiki", "shopee"
                  is_mall                         boolean
                  is_verified_seller              boolean
                  required_keywords, excluded_keywords   list of strings
                  required_brands, excluded_brands       list of strings
                  seller_locations                list of strings
                  trust_badge_types               list of strings
                Return {} when the text states no usable condition.
                """.formatted(filterText.replace("\"", "'"));
    }
}
