package com.example.salesmart.discovery;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import com.example.salesmart.config.DiscoveryProperties;
import com.example.salesmart.discovery.crawler.CrawlBudget;
import com.example.salesmart.discovery.crawler.CrawlOutcome;
import com.example.salesmart.discovery.crawler.CrawlerDispatcher;
import com.example.salesmart.discovery.crawler.NormalizedCandidate;
import com.example.salesmart.service.ProjectService;
import com.example.salesmart.service.StateTransitionService;

/**
 * Auto-discovery pipeline:
 * validate -> project -> intent -> criteria -> search -> crawl -> filter -> rank -> import.
 *
 * Stops at the first terminal failure and always answers with a
 * {@link DiscoveryResult}, carrying the counts reached so far.
 */
@Service
public class AutoDiscoveryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AutoDiscoveryOrchestrator.class);

    private final DiscoveryProperties props;
    private final ProjectService projectService;
    private final NaturalLanguageIntentParser intentParser;
    private final FilterIntentParser filterParser;
    private final CriteriaValidator criteriaValidator;
    private final PlatformPolicy platformPolicy;
    private final ProductSearchAgent searchAgent;
    private final SearchLinkExtractor linkExtractor;
    private final CrawlerDispatcher crawlerDispatcher;
    private final ProductFilterEngine filterEngine;
    private final ProductRankingSelector rankingSelector;
    private final ProductImporter importer;
    private final StateTransitionService transitions;

    public AutoDiscoveryOrchestrator(
            DiscoveryProperties props,
            ProjectService projectService,
            NaturalLanguageIntentParser intentParser,
            FilterIntentParser filterParser,
            CriteriaValidator criteriaValidator,
            PlatformPolicy platformPolicy,
            ProductSearchAgent searchAgent,
            SearchLinkExtractor linkExtractor,
            CrawlerDispatcher crawlerDispatcher,
            ProductFilterEngine filterEngine,
            ProductRankingSelector rankingSelector,
            ProductImporter importer,
            StateTransitionService transitions) {
        this.props = props;
        this.projectService = projectService;
        this.intentParser = intentParser;
        this.filterParser = filterParser;
        this.criteriaValidator = criteriaValidator;
        this.platformPolicy = platformPolicy;
        this.searchAgent = searchAgent;
        this.linkExtractor = linkExtractor;
        this.crawlerDispatcher = crawlerDispatcher;
        this.filterEngine = filterEngine;
        this.rankingSelector = rankingSelector;
        this.importer = importer;
        this.transitions = transitions;
    }

    public DiscoveryResult discoverFromNaturalLanguage(Long projectId, String rawText) {
        return run(DiscoveryRequest.naturalLanguage(projectId, rawText),
                DiscoveryDeadline.after(props.getRunTimeout()));
    }

    public DiscoveryResult discover(Long projectId, String query, String filterText, Integer maxProducts) {
        return run(DiscoveryRequest.structured(projectId, query, filterText, maxProducts),
                DiscoveryDeadline.after(props.getRunTimeout()));
    }

    /**
     * Runs one discovery. The caller keeps {@code deadline} to cancel the run
     * from another thread.
     */
    public DiscoveryResult run(DiscoveryRequest request, DiscoveryDeadline deadline) {
        String runId = UUID.randomUUID().toString();
        MDC.put("runId", runId);
        RunState st = new RunState(runId);
        DiscoveryResult result;
        try {
            result = execute(request, deadline, st);
        } catch (DiscoveryAbortException e) {
            log.info("[Discovery] aborted stage={} type={} message={}", st.stage, e.getErrorType().code(),
                    e.getMessage());
            result = st.error(e.getErrorType(), e.getMessage(),
                    e.getExtractedCriteria() != null ? e.getExtractedCriteria() : st.criteria,
                    e.getSuggestedPlatforms());
        } catch (DiscoveryCancelledException e) {
            log.warn("[Discovery] stopped stage={}: {}", st.stage, e.getMessage());
            result = st.error(DiscoveryErrorType.EXECUTION_ERROR, e.getMessage(), st.criteria, null);
        } catch (RuntimeException e) {
            log.error("[Discovery] failed stage={}", st.stage, e);
            result = st.error(DiscoveryErrorType.EXECUTION_ERROR,
                    "Discovery failed during " + st.stage + ": " + e.getMessage(), st.criteria, null);
        }
        try {
            audit(request.projectId(), result);
        } finally {
            MDC.remove("runId");
        }
        return result;
    }

    private DiscoveryResult execute(DiscoveryRequest request, DiscoveryDeadline deadline, RunState st) {
        st.stage = DiscoveryStage.VALIDATE_INPUT;
        validateInput(request);

        st.stage = DiscoveryStage.LOAD_PROJECT;
        ProjectContext project = projectService.findContext(request.projectId())
                .orElseThrow(() -> new DiscoveryAbortException(DiscoveryErrorType.PROJECT_NOT_FOUND,
                        "Project not found: " + request.projectId()));

        DiscoveryIntent intent;
        if (request.isNaturalLanguage()) {
            if (!project.isComplete()) {
                throw new DiscoveryAbortException(DiscoveryErrorType.PROJECT_INCOMPLETE,
                        "Project has no target product. Set target_product_name on the project first.");
            }
            st.stage = DiscoveryStage.PARSE_INTENT;
            intent = intentParser.parse(request.rawText().trim(), project, deadline);
        } else {
            int maxProducts = request.maxProducts() != null ? request.maxProducts() : props.getDefaultMaxProducts();
            String filterText = request.filterText() == null || request.filterText().isBlank()
                    ? null
                    : request.filterText().trim();
            intent = new DiscoveryIntent(request.query().trim(), filterText, maxProducts);
        }
        log.info("[Discovery] start project={} query='{}' maxProducts={}", project.id(), intent.query(),
                intent.maxProducts());

        FilterCriteria criteria = FilterCriteria.none();
        if (intent.hasFilter()) {
            st.stage = DiscoveryStage.PARSE_CRITERIA;
            criteria = filterParser.parse(intent.filterText(), deadline);
            st.criteria = criteria.toMap();
            rejectDisabledPlatforms(criteria);

            st.stage = DiscoveryStage.VALIDATE_CRITERIA;
            criteriaValidator.validate(intent.filterText(), criteria, deadline);
        }

        st.stage = DiscoveryStage.SEARCH;
        Set<Platform> allowed = allowedPlatforms(criteria);
        List<RecommendedProduct> recommended = searchAgent.search(intent, criteria, project, allowed, deadline);
        List<String> searchUrls = linkExtractor.extract(recommended, allowed, intent.query());

        st.stage = DiscoveryStage.CRAWL;
        CrawlOutcome crawl = crawlerDispatcher.crawl(searchUrls, new CrawlBudget(props.getGlobalCrawlCap()),
                deadline);
        List<NormalizedCandidate> crawled = crawl.candidates();
        st.found = crawled.size();
        if (crawled.isEmpty()) {
            throw new DiscoveryAbortException(DiscoveryErrorType.CRAWL_FAILED,
                    "No products could be crawled from " + searchUrls.size() + " search link(s) ("
                            + crawl.sourcesFailed() + " failed). The links may be invalid, the platform may be"
                            + " blocking requests, or the network is down. Please try again later.");
        }

        st.stage = DiscoveryStage.FILTER;
        List<NormalizedCandidate> filtered = filterEngine.filter(crawled, criteria);
        st.filtered = filtered.size();

        st.stage = DiscoveryStage.RANK;
        List<NormalizedCandidate> selected = rankingSelector.select(filtered, intent.query(), criteria,
                intent.maxProducts(), deadline);
        if (selected.isEmpty()) {
            throw new DiscoveryAbortException(DiscoveryErrorType.NO_PRODUCTS_AFTER_FILTER,
                    "No product matched the criteria after filtering. Try less strict criteria.");
        }

        st.stage = DiscoveryStage.IMPORT;
        deadline.check(DiscoveryStage.IMPORT);
        ImportOutcome outcome = importer.importProducts(project.id(), selected, st.runId);
        st.importedIds = outcome.importedIds();
        if (outcome.importedIds().isEmpty()) {
            throw new DiscoveryAbortException(DiscoveryErrorType.IMPORT_FAILED,
                    "No product could be imported (" + outcome.duplicates() + " duplicate, "
                            + outcome.failures() + " failed).");
        }

        String message = "Imported " + outcome.importedCount() + " product(s)";
        if (outcome.skipped() > 0) {
            message += " (" + outcome.skipped() + " skipped: " + outcome.duplicates() + " duplicate, "
                    + outcome.failures() + " failed)";
        }
        log.info("[Discovery] done project={} found={} filtered={} selected={} imported={}",
                project.id(), st.found, st.filtered, selected.size(), outcome.importedCount());
        return st.success(message);
    }

    private void validateInput(DiscoveryRequest request) {
        if (request.projectId() == null) {
            throw invalid("projectId is required");
        }
        int maxLength = props.getMaxInputLength();
        if (request.isNaturalLanguage()) {
            if (request.rawText() == null || request.rawText().isBlank()) {
                throw invalid("Input must not be empty");
            }
            if (request.rawText().length() > maxLength) {
                throw new DiscoveryAbortException(DiscoveryErrorType.INPUT_TOO_LONG,
                        "Input is too long (max " + maxLength + " characters)");
            }
            return;
        }
        if (request.query() == null || request.query().isBlank()) {
            throw invalid("Search query must not be empty");
        }
        if (request.query().length() > maxLength
                || (request.filterText() != null && request.filterText().length() > maxLength)) {
            throw new DiscoveryAbortException(DiscoveryErrorType.INPUT_TOO_LONG,
                    "Input is too long (max " + maxLength + " characters)");
        }
        if (request.maxProducts() != null && !props.isWithinProductRange(request.maxProducts())) {
            throw invalid("maxProducts must be between " + props.getMaxProductsMin() + " and "
                    + props.getMaxProductsMax());
        }
    }

    private void rejectDisabledPlatforms(FilterCriteria criteria) {
        if (!criteria.hasPlatforms()) {
            return;
        }
        Set<Platform> disabled = platformPolicy.disabledPlatforms();
        Set<Platform> requestedDisabled = EnumSet.noneOf(Platform.class);
        for (Platform p : criteria.getPlatforms()) {
            if (disabled.contains(p)) {
                requestedDisabled.add(p);
            }
        }
        if (requestedDisabled.isEmpty()) {
            return;
        }
        List<Platform> substitutes = platformPolicy.substitutesFor(criteria.getPlatforms());
        throw new DiscoveryAbortException(DiscoveryErrorType.UNSUPPORTED_PLATFORM,
                "Scraping is not available for " + PlatformPolicy.describe(requestedDisabled)
                        + ". Please search on " + PlatformPolicy.describe(substitutes) + " instead.",
                criteria.toMap(), substitutes);
    }

    private Set<Platform> allowedPlatforms(FilterCriteria criteria) {
        Set<Platform> allowed = EnumSet.noneOf(Platform.class);
        allowed.addAll(platformPolicy.enabledPlatforms());
        if (criteria.hasPlatforms()) {
            allowed.retainAll(criteria.getPlatforms());
        }
        return allowed;
    }

    private void audit(Long projectId, DiscoveryResult result) {
        try {
            transitions.log(StateTransitionService.ENTITY_DISCOVERY_RUN, projectId != null ? projectId : 0L,
                    null, result.isSuccess() ? "COMPLETED" : "FAILED",
                    result.errorType() != null ? result.errorType().code() : "OK",
                    result.message(), "SYSTEM", result.runId());
        } catch (RuntimeException e) {
            log.warn("[Discovery] could not audit run {}", result.runId(), e);
        }
    }

    private static DiscoveryAbortException invalid(String message) {
        return new DiscoveryAbortException(DiscoveryErrorType.INVALID_INPUT, message);
    }

    /** What the run has reached so far; feeds the envelope on any exit. */
    private static final class RunState {
        final String runId;
        DiscoveryStage stage = DiscoveryStage.VALIDATE_INPUT;
        Integer found;
        Integer filtered;
        List<Long> importedIds;
        Map<String, Object> criteria;

        RunState(String runId) {
            this.runId = runId;
        }

        DiscoveryResult success(String message) {
            Map<String, Object> extracted = criteria == null || criteria.isEmpty() ? null : criteria;
            return new DiscoveryResult(DiscoveryResult.SUCCESS, message, null, null, found, filtered,
                    importedIds.size(), importedIds, extracted, null, runId);
        }

        DiscoveryResult error(DiscoveryErrorType type, String message, Map<String, Object> extracted,
                List<Platform> suggested) {
            Integer importedCount = importedIds != null ? importedIds.size() : null;
            return new DiscoveryResult(DiscoveryResult.ERROR, message, type, stage, found, filtered,
                    importedCount, importedIds, extracted, suggested, runId);
        }
    }
}
