package com.example.salesmart.discovery;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.salesmart.discovery.crawler.NormalizedCandidate;
import com.example.salesmart.llm.ModelJson;
import com.example.salesmart.llm.ModelResponse;
import com.example.salesmart.llm.ResilientModelCaller;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Top-K selection when the filtered set is larger than the budget.
 *
 * The model answers with candidate ids (list positions). Unknown and repeated
 * ids are dropped, and the pick is topped up in the original order, so the
 * result is always {@code min(budget, |filtered|)} members of the input.
 */
@Component
public class ProductRankingSelector {

    private static final Logger log = LoggerFactory.getLogger(ProductRankingSelector.class);

    private final ResilientModelCaller modelCaller;

    public ProductRankingSelector(ResilientModelCaller modelCaller) {
        this.modelCaller = modelCaller;
    }

    public List<NormalizedCandidate> select(List<NormalizedCandidate> filtered, String query,
            FilterCriteria criteria, int budget, DiscoveryDeadline deadline) {
        if (filtered.size() <= budget) {
            return List.copyOf(filtered);
        }
        deadline.check(DiscoveryStage.RANK);

        List<Integer> ids;
        try {
            ModelResponse response = modelCaller.call(buildPrompt(filtered, query, criteria, budget), null, true,
                    deadline.cap(modelCaller.defaultTimeout()), deadline.guard(DiscoveryStage.RANK));
            ids = ModelJson.parseObject(response.text()).map(ProductRankingSelector::readIds).orElse(List.of());
        } catch (DiscoveryCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[Ranking] model ranking failed, truncating to {}: {}", budget, e.getMessage());
            return List.copyOf(filtered.subList(0, budget));
        }
        return assemble(filtered, ids, budget);
    }

    static List<NormalizedCandidate> assemble(List<NormalizedCandidate> filtered, List<Integer> ids, int budget) {
        Set<Integer> picked = new LinkedHashSet<>();
        int rejected = 0;
        for (Integer id : ids) {
            if (picked.size() >= budget) {
                break;
            }
            if (id == null || id < 0 || id >= filtered.size() || !picked.add(id)) {
                rejected++;
            }
        }
        int fromModel = picked.size();
        for (int i = 0; i < filtered.size() && picked.size() < budget; i++) {
            picked.add(i);
        }
        List<NormalizedCandidate> out = new ArrayList<>(picked.size());
        for (Integer i : picked) {
            out.add(filtered.get(i));
        }
        log.info("[Ranking] selected={} fromModel={} rejectedIds={} toppedUp={}",
                out.size(), fromModel, rejected, out.size() - fromModel);
        return List.copyOf(out);
    }

    static List<Integer> readIds(JsonNode root) {
        List<Integer> ids = new ArrayList<>();
        for (JsonNode n : root.path("selected_ids")) {
            if (n.canConvertToInt() && n.isIntegralNumber()) {
                ids.add(n.intValue());
            } else if (n.isTextual() && n.asText().trim().matches("\\d+")) {
                ids.add(Integer.parseInt(n.asText().trim()));
            } else {
                ids.add(null);
            }
        }
        return ids;
    }

    private String buildPrompt(List<NormalizedCandidate> filtered, String query, FilterCriteria criteria,
            int budget) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < filtered.size(); i++) {
            NormalizedCandidate c = filtered.get(i);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", i);
            row.put("name", c.name());
            row.put("platform", c.platform().tag());
            row.put("price", c.price());
            row.put("rating", c.rating());
            row.put("review_count", c.reviewCount());
            row.put("sales_count", c.salesCount());
            row.put("brand", c.brand());
            rows.add(row);
        }
        return """
                Pick the %d best products for the shopper from the candidates below.
                Prefer relevance to the search, then rating, review count and sales.

                Search: "%s"
                Criteria: %s

                Candidates:
                %s

                Answer with JSON only: {"selected_ids": [ids of the chosen candidates, best first]}
                Use only ids from the list. Return exactly %d ids.
                """.formatted(budget, query.replace("\"", "'"), ModelJson.write(criteria.toMap()),
                ModelJson.write(rows), budget);
    }
}
