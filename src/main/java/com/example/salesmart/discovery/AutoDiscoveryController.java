package com.example.salesmart.discovery;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.salesmart.discovery.crawler.CrawlerDispatcher;
import com.example.salesmart.discovery.crawler.ProductDetail;
import com.example.salesmart.dto.discovery.AutoDiscoveryRequest;
import com.example.salesmart.dto.discovery.LegacyAutoDiscoveryRequest;
import com.example.salesmart.dto.discovery.ProductDetailRequest;

import jakarta.validation.Valid;

/**
 * Auto-discovery API. 200 with the envelope on success, 400 with the
 * envelope on any pipeline error.
 */
@RestController
@RequestMapping("/products/auto-discovery")
public class AutoDiscoveryController {

    private final AutoDiscoveryOrchestrator orchestrator;
    private final CrawlerDispatcher crawlerDispatcher;

    public AutoDiscoveryController(AutoDiscoveryOrchestrator orchestrator, CrawlerDispatcher crawlerDispatcher) {
        this.orchestrator = orchestrator;
        this.crawlerDispatcher = crawlerDispatcher;
    }

    /**
     * POST /products/auto-discovery/execute
     * Free-text request, parsed by the model, then search through import.
     */
    @PostMapping("/execute")
    public ResponseEntity<DiscoveryResult> execute(@Valid @RequestBody AutoDiscoveryRequest body) {
        return respond(orchestrator.discoverFromNaturalLanguage(body.projectId(), body.userInput()));
    }

    /**
     * POST /products/auto-discovery/execute-legacy
     */
    @PostMapping("/execute-legacy")
    public ResponseEntity<DiscoveryResult> executeLegacy(@Valid @RequestBody LegacyAutoDiscoveryRequest body) {
        return respond(orchestrator.discover(body.projectId(), body.userQuery(), body.filterCriteria(),
                body.maxProducts()));
    }

    /**
     * POST /products/auto-discovery/product-details
     * Product page details and reviews for a crawled product link.
     */
    @PostMapping("/product-details")
    public ResponseEntity<ProductDetail> productDetails(@Valid @RequestBody ProductDetailRequest body) {
        return ResponseEntity.ok(crawlerDispatcher.crawlDetails(body.productUrl()));
    }

    private static ResponseEntity<DiscoveryResult> respond(DiscoveryResult result) {
        return ResponseEntity.status(result.isSuccess() ? HttpStatus.OK : HttpStatus.BAD_REQUEST).body(result);
    }
}
