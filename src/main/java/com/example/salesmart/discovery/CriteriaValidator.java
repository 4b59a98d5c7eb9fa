package com.example.salesmart.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.salesmart.llm.ModelJson;
import com.example.salesmart.llm.ModelResponse;
import com.example.salesmart.llm.ResilientModelCaller;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Second model opinion: do the extracted criteria still say what the user
 * wrote? A negative or unreadable verdict stops the run.
 */
@Component
public class CriteriaValidator {

    private static final Logger log = LoggerFactory.getLogger(CriteriaValidator.class);

    static final String DEFAULT_REASON = "The extracted criteria do not match your request";
    static final String UNREADABLE_VERDICT = "Could not read validation verdict";

    private static final JsonNode VERDICT_SCHEMA = verdictSchema();

    private final ResilientModelCaller modelCaller;

    public CriteriaValidator(ResilientModelCaller modelCaller) {
        this.modelCaller = modelCaller;
    }

    public void validate(String filterText, FilterCriteria criteria, DiscoveryDeadline deadline) {
        deadline.check(DiscoveryStage.VALIDATE_CRITERIA);
        ModelResponse response = modelCaller.call(buildPrompt(filterText, criteria), VERDICT_SCHEMA, true,
                deadline.cap(modelCaller.defaultTimeout()), deadline.guard(DiscoveryStage.VALIDATE_CRITERIA));

        JsonNode verdict = ModelJson.parseObject(response.text()).orElse(null);
        if (verdict == null) {
            throw rejected(UNREADABLE_VERDICT, criteria);
        }
        if (verdict.path("is_valid").isBoolean() && verdict.get("is_valid").booleanValue()) {
            log.info("[CriteriaValidator] accepted criteria={}", criteria.toMap());
            return;
        }
        String reason = verdict.path("reason").isTextual() && !verdict.get("reason").asText().isBlank()
                ? verdict.get("reason").asText().trim()
                : DEFAULT_REASON;
        throw rejected(reason, criteria);
    }

    private static DiscoveryAbortException rejected(String reason, FilterCriteria criteria) {
        log.info("[CriteriaValidator] rejected: {}", reason);
        return new DiscoveryAbortException(DiscoveryErrorType.CRITERIA_VALIDATION_FAILED, reason,
                criteria.toMap(), null);
    }

    private String buildPrompt(String filterText, FilterCriteria criteria) {
        return """
                You check whether extracted filter criteria faithfully represent what a user asked for.

                User text:
                "%s"

                Extracted criteria:
                %s

                Answer with JSON: {"is_valid": true|false, "reason": "why not, when invalid"}.
                Mark it invalid when a condition is wrong, invented, or an important one is missing.
                """.formatted(filterText.replace("\"", "'"), ModelJson.write(criteria.toMap()));
    }

    private static JsonNode verdictSchema() {
        ObjectNode schema = ModelJson.mapper().createObjectNode();
        schema.put("type", "OBJECT");
        ObjectNode props = schema.putObject("properties");
        props.putObject("is_valid").put("type", "BOOLEAN");
        props.putObject("reason").put("type", "STRING");
        schema.putArray("required").add("is_valid");
        return schema;
    }
}
