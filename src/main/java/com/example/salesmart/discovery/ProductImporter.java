package com.example.salesmart.discovery;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import com.example.salesmart.discovery.crawler.NormalizedCandidate;
import com.example.salesmart.entity.DiscoveredProduct;
import com.example.salesmart.repo.DiscoveredProductRepository;
import com.example.salesmart.service.StateTransitionService;

/**
 * Persists the selected candidates, keyed by (project, normalized product URL).
 *
 * Each row is saved in its own transaction: a failed row is counted and
 * skipped, rows already saved stay saved.
 */
@Service
public class ProductImporter {

    private static final Logger log = LoggerFactory.getLogger(ProductImporter.class);

    private final DiscoveredProductRepository repository;
    private final StateTransitionService transitions;

    public ProductImporter(DiscoveredProductRepository repository, StateTransitionService transitions) {
        this.repository = repository;
        this.transitions = transitions;
    }

    public ImportOutcome importProducts(Long projectId, List<NormalizedCandidate> selected, String runId) {
        List<String> keys = selected.stream().map(NormalizedCandidate::key).distinct().toList();
        Set<String> existing = keys.isEmpty()
                ? new HashSet<>()
                : new HashSet<>(repository.findExistingKeys(projectId, keys));
        Set<String> seenKeys = new HashSet<>();

        List<Long> importedIds = new ArrayList<>();
        int duplicates = 0;
        int failures = 0;

        for (NormalizedCandidate c : selected) {
            if (existing.contains(c.key()) || !seenKeys.add(c.key())) {
                duplicates++;
                log.debug("[Import] duplicate skipped project={} url={}", projectId, c.productUrl());
                continue;
            }
            DiscoveredProduct saved;
            try {
                saved = repository.saveAndFlush(toEntity(projectId, c, runId));
            } catch (DataIntegrityViolationException e) {
                duplicates++;
                log.warn("[Import] constraint violation project={} url={}: {}", projectId, c.productUrl(),
                        e.getMostSpecificCause().getMessage());
                continue;
            } catch (RuntimeException e) {
                failures++;
                log.warn("[Import] save failed project={} url={}", projectId, c.productUrl(), e);
                continue;
            }
            importedIds.add(saved.getId());
            try {
                transitions.log(StateTransitionService.ENTITY_DISCOVERED_PRODUCT, saved.getId(), null, "NEW",
                        "AUTO_DISCOVERY_IMPORT", c.platform().tag() + " " + c.productUrl(), "SYSTEM", runId);
            } catch (RuntimeException e) {
                log.warn("[Import] audit log failed for product={}", saved.getId(), e);
            }
        }

        log.info("[Import] project={} selected={} imported={} duplicates={} failures={}",
                projectId, selected.size(), importedIds.size(), duplicates, failures);
        return new ImportOutcome(List.copyOf(importedIds), duplicates, failures);
    }

    static DiscoveredProduct toEntity(Long projectId, NormalizedCandidate c, String runId) {
        DiscoveredProduct p = new DiscoveredProduct();
        p.setProjectId(projectId);
        p.setPlatform(c.platform().tag());
        p.setProductName(c.name());
        p.setProductUrl(c.productUrl());
        p.setProductKey(c.key());
        p.setPriceCurrent(c.price());
        p.setRatingScore(c.rating());
        p.setReviewCount(c.reviewCount());
        p.setSalesCount(c.salesCount());
        p.setMall(c.mall());
        p.setBrand(c.brand());
        p.setSellerLocation(c.sellerLocation());
        p.setKeywords(new ArrayList<>(c.keywords()));
        p.setImageUrls(new ArrayList<>(c.imageUrls()));
        p.setSourceSearchUrl(c.sourceSearchUrl());
        p.setDiscoveryRunId(runId);
        return p;
    }
}
