package com.example.salesmart.discovery;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.salesmart.config.DiscoveryProperties;
import com.example.salesmart.llm.ModelJson;
import com.example.salesmart.llm.ModelResponse;
import com.example.salesmart.llm.ResilientModelCaller;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Asks the model for products worth crawling, each with marketplace search links.
 */
@Component
public class ProductSearchAgent {

    private static final Logger log = LoggerFactory.getLogger(ProductSearchAgent.class);

    private final ResilientModelCaller modelCaller;
    private final DiscoveryProperties props;

    public ProductSearchAgent(ResilientModelCaller modelCaller, DiscoveryProperties props) {
        this.modelCaller = modelCaller;
        this.props = props;
    }

    /**
     * @throws DiscoveryAbortException NO_PRODUCTS_FOUND when nothing usable came back
     */
    public List<RecommendedProduct> search(DiscoveryIntent intent, FilterCriteria criteria, ProjectContext project,
            Set<Platform> platforms, DiscoveryDeadline deadline) {
        deadline.check(DiscoveryStage.SEARCH);
        int limit = intent.maxProducts() * props.getSearchMultiplier();
        ModelResponse response = modelCaller.call(buildPrompt(intent, criteria, project, platforms, limit), null,
                true, deadline.cap(modelCaller.defaultTimeout()), deadline.guard(DiscoveryStage.SEARCH));

        List<RecommendedProduct> products = ModelJson.parseObject(response.text())
                .map(root -> readProducts(root, limit))
                .orElse(List.of());
        if (products.isEmpty()) {
            throw new DiscoveryAbortException(DiscoveryErrorType.NO_PRODUCTS_FOUND,
                    "The product search returned no products for '" + intent.query() + "'");
        }
        log.info("[Search] query='{}' recommended={}", intent.query(), products.size());
        return products;
    }

    static List<RecommendedProduct> readProducts(JsonNode root, int limit) {
        List<RecommendedProduct> out = new ArrayList<>();
        for (JsonNode p : root.path("products")) {
            if (out.size() >= limit) {
                break;
            }
            String name = p.path("name").asText("").trim();
            String url = p.path("url").isTextual() ? p.get("url").asText().trim() : null;
            Map<String, String> urls = new LinkedHashMap<>();
            JsonNode urlsNode = p.path("urls");
            for (Iterator<Map.Entry<String, JsonNode>> it = urlsNode.fields(); it.hasNext();) {
                Map.Entry<String, JsonNode> e = it.next();
                if (e.getValue().isTextual() && !e.getValue().asText().isBlank()) {
                    urls.put(e.getKey(), e.getValue().asText().trim());
                }
            }
            if (!name.isEmpty() || (url != null && !url.isEmpty()) || !urls.isEmpty()) {
                out.add(new RecommendedProduct(name, url == null || url.isEmpty() ? null : url, urls));
            }
        }
        return out;
    }

    private String buildPrompt(DiscoveryIntent intent, FilterCriteria criteria, ProjectContext project,
            Set<Platform> platforms, int limit) {
        StringBuilder templates = new StringBuilder();
        for (Platform p : platforms) {
            templates.append("  ").append(p.tag()).append(": ")
                    .append(SearchLinkExtractor.searchUrlTemplate(p).formatted("<keywords>")).append('\n');
        }
        return """
                You are a sourcing assistant for Vietnamese e-commerce.
                Suggest up to %d concrete products matching the search below, and for each one
                a marketplace search link built from these templates:
                %s
                Search: "%s"
                Project: %s (category: %s)
                Filter criteria: %s

                Answer with JSON only:
                {"products": [{"name": "...", "urls": {"<platform>": "<search link>"}}]}
                Use only the platforms listed above.
                """.formatted(limit, templates, intent.query().replace("\"", "'"),
                project.name(), project.targetProductCategory() == null ? "" : project.targetProductCategory(),
                ModelJson.write(criteria.toMap()));
    }
}
