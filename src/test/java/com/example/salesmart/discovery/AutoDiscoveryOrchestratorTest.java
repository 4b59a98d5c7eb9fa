package com.example.salesmart.discovery;

import static com.example.salesmart.discovery.CandidateFixtures.candidate;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.slf4j.MDC;

import com.example.salesmart.config.DiscoveryProperties;
import com.example.salesmart.discovery.crawler.CrawlOutcome;
import com.example.salesmart.discovery.crawler.CrawlerDispatcher;
import com.example.salesmart.discovery.crawler.NormalizedCandidate;
import com.example.salesmart.llm.ResilientModelCaller;
import com.example.salesmart.ops.SystemFlagService;
import com.example.salesmart.service.ProjectService;
import com.example.salesmart.service.StateTransitionService;
import com.fasterxml.jackson.databind.ObjectMapper;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AutoDiscoveryOrchestratorTest {

    private static final ProjectContext PROJECT = new ProjectContext(1L, "Coffee shop", null, "Cà phê hòa tan",
            "Đồ uống", new BigDecimal("5000000"), "VND", "ACTIVE", "DISCOVERY");
    private static final ProjectContext INCOMPLETE = new ProjectContext(2L, "Draft", null, " ", null, null, null,
            null, null);

    @Mock
    private ProjectService projectService;
    @Mock
    private NaturalLanguageIntentParser intentParser;
    @Mock
    private FilterIntentParser filterParser;
    @Mock
    private CriteriaValidator criteriaValidator;
    @Mock
    private SystemFlagService flags;
    @Mock
    private ProductSearchAgent searchAgent;
    @Mock
    private CrawlerDispatcher crawlerDispatcher;
    @Mock
    private ResilientModelCaller modelCaller;
    @Mock
    private ProductImporter importer;
    @Mock
    private StateTransitionService transitions;

    private AutoDiscoveryOrchestrator orchestrator;

    private final List<NormalizedCandidate> crawled = List.of(
            candidate("Cà phê G7", "89000", 4.8, 1500),
            candidate("Nescafé 3in1", "65000", 4.6, 800),
            candidate("Vinacafe", "70000", 4.2, 300),
            candidate("Cà phê Mê Trang", "120000", null, null));

    @BeforeEach
    void setUp() {
        DiscoveryProperties props = new DiscoveryProperties();
        orchestrator = new AutoDiscoveryOrchestrator(
                props,
                projectService,
                intentParser,
                filterParser,
                criteriaValidator,
                new PlatformPolicy(props, flags),
                searchAgent,
                new SearchLinkExtractor(),
                crawlerDispatcher,
                new ProductFilterEngine(),
                new ProductRankingSelector(modelCaller),
                importer,
                transitions);

        when(projectService.findContext(1L)).thenReturn(Optional.of(PROJECT));
        when(projectService.findContext(2L)).thenReturn(Optional.of(INCOMPLETE));
        when(searchAgent.search(any(), any(), any(), any(), any())).thenReturn(List.of(
                new RecommendedProduct("G7", null, Map.of("tiki", "https://tiki.vn/search?q=g7"))));
        when(crawlerDispatcher.crawl(anyList(), any(), any())).thenReturn(new CrawlOutcome(crawled, 1, 0));
    }

    @Test
    void structuredRun_importsSelection() {
        when(importer.importProducts(eq(1L), anyList(), anyString()))
                .thenReturn(new ImportOutcome(List.of(10L, 11L, 12L), 1, 0));

        DiscoveryResult result = orchestrator.discover(1L, "cà phê", null, 5);

        assertTrue(result.isSuccess());
        assertEquals("Imported 3 product(s) (1 skipped: 1 duplicate, 0 failed)", result.message());
        assertEquals(4, result.foundCount());
        assertEquals(4, result.filteredCount());
        assertEquals(3, result.importedCount());
        assertEquals(List.of(10L, 11L, 12L), result.importedIds());
        assertNull(result.errorType());
        assertNull(result.extractedCriteria());
        assertNotNull(result.runId());
        verifyNoInteractions(intentParser, filterParser, criteriaValidator);
        verify(searchAgent).search(any(), any(), eq(PROJECT), eq(EnumSet.of(Platform.LAZADA, Platform.TIKI)),
                any());
        verify(crawlerDispatcher).crawl(eq(List.of("https://tiki.vn/search?q=g7")), any(), any());
        verify(transitions).log(eq(StateTransitionService.ENTITY_DISCOVERY_RUN), eq(1L), isNull(),
                eq("COMPLETED"), eq("OK"), anyString(), eq("SYSTEM"), eq(result.runId()));
        assertNull(MDC.get("runId"));
    }

    @Test
    void naturalLanguageRun_appliesParsedCriteria() {
        when(intentParser.parse(anyString(), eq(PROJECT), any()))
                .thenReturn(new DiscoveryIntent("cà phê hòa tan", "rating 4.5+, max price 500000", 5));
        when(filterParser.parse(eq("rating 4.5+, max price 500000"), any())).thenReturn(FilterCriteria.builder()
                .minRating(4.5)
                .maxPrice(new BigDecimal("500000"))
                .build());
        when(importer.importProducts(eq(1L), anyList(), anyString()))
                .thenReturn(new ImportOutcome(List.of(21L, 22L), 0, 0));

        DiscoveryResult result = orchestrator.discoverFromNaturalLanguage(1L,
                "tìm 5 sản phẩm cà phê hòa tan, rating 4.5+, max price 500000");

        assertTrue(result.isSuccess());
        assertEquals("Imported 2 product(s)", result.message());
        assertEquals(4, result.foundCount());
        assertEquals(2, result.filteredCount());
        assertEquals(4.5, result.extractedCriteria().get("min_rating"));
        verify(criteriaValidator).validate(eq("rating 4.5+, max price 500000"), any(), any());
        verify(importer).importProducts(eq(1L), eq(List.of(crawled.get(0), crawled.get(1))), anyString());
    }

    @Test
    void criteriaMatchingNothing_isNoProductsAfterFilter() {
        when(filterParser.parse(anyString(), any())).thenReturn(FilterCriteria.builder().minRating(5.0).build());

        DiscoveryResult result = orchestrator.discover(1L, "cà phê", "chỉ 5 sao", 5);

        assertFalse(result.isSuccess());
        assertEquals(DiscoveryErrorType.NO_PRODUCTS_AFTER_FILTER, result.errorType());
        assertEquals(DiscoveryStage.RANK, result.failedStage());
        assertEquals(4, result.foundCount());
        assertEquals(0, result.filteredCount());
        assertNull(result.importedCount());
        verifyNoInteractions(importer);
    }

    @Test
    void disabledPlatform_isRejectedWithSuggestions() throws Exception {
        when(filterParser.parse(anyString(), any())).thenReturn(FilterCriteria.builder()
                .platforms(Set.of(Platform.SHOPEE))
                .maxPrice(new BigDecimal("200000"))
                .build());

        DiscoveryResult result = orchestrator.discover(1L, "cà phê", "trên shopee dưới 200k", 5);

        assertEquals(DiscoveryErrorType.UNSUPPORTED_PLATFORM, result.errorType());
        assertEquals(DiscoveryStage.PARSE_CRITERIA, result.failedStage());
        assertEquals(List.of(Platform.LAZADA, Platform.TIKI), result.suggestedPlatforms());
        assertEquals(List.of("shopee"), result.extractedCriteria().get("platforms"));
        assertTrue(result.message().contains("shopee"));
        verifyNoInteractions(criteriaValidator, searchAgent, crawlerDispatcher);

        String json = new ObjectMapper().writeValueAsString(result);
        assertTrue(json.contains("\"errorType\":\"platform_not_supported\""));
        assertTrue(json.contains("\"suggestedPlatforms\":[\"lazada\",\"tiki\"]"));
        assertFalse(json.contains("importedIds"));
    }

    @Test
    void runtimeFlagCanEnableShopee() {
        when(flags.get(PlatformPolicy.DISABLED_PLATFORMS_FLAG)).thenReturn("");
        when(filterParser.parse(anyString(), any()))
                .thenReturn(FilterCriteria.builder().platforms(Set.of(Platform.SHOPEE)).build());

        DiscoveryResult result = orchestrator.discover(1L, "cà phê", "trên shopee", 5);

        // crawled fixtures are all Tiki listings, so the Shopee-only filter drops them
        assertEquals(DiscoveryErrorType.NO_PRODUCTS_AFTER_FILTER, result.errorType());
        verify(searchAgent).search(any(), any(), any(), eq(EnumSet.of(Platform.SHOPEE)), any());
        verify(crawlerDispatcher).crawl(eq(List.of("https://shopee.vn/search?keyword=c%C3%A0%20ph%C3%AA")), any(),
                any());
    }

    @Test
    void invalidInput() {
        assertEquals(DiscoveryErrorType.INVALID_INPUT, orchestrator.discoverFromNaturalLanguage(1L, "  ").errorType());
        assertEquals(DiscoveryErrorType.INVALID_INPUT, orchestrator.discoverFromNaturalLanguage(null, "x").errorType());
        assertEquals(DiscoveryErrorType.INVALID_INPUT, orchestrator.discover(1L, "cà phê", null, 0).errorType());
        assertEquals(DiscoveryErrorType.INVALID_INPUT, orchestrator.discover(1L, "cà phê", null, 21).errorType());
        assertEquals(DiscoveryErrorType.INVALID_INPUT, orchestrator.discover(1L, " ", null, 5).errorType());

        DiscoveryResult result = orchestrator.discover(1L, "", null, 5);
        assertEquals(DiscoveryStage.VALIDATE_INPUT, result.failedStage());
        assertNull(result.foundCount());
        verifyNoInteractions(projectService);
    }

    @Test
    void inputTooLong() {
        String longText = "cà phê ".repeat(400);

        assertEquals(DiscoveryErrorType.INPUT_TOO_LONG,
                orchestrator.discoverFromNaturalLanguage(1L, longText).errorType());
        assertEquals(DiscoveryErrorType.INPUT_TOO_LONG, orchestrator.discover(1L, "cà phê", longText, 5).errorType());
    }

    @Test
    void projectNotFoundOrIncomplete() {
        when(projectService.findContext(99L)).thenReturn(Optional.empty());

        assertEquals(DiscoveryErrorType.PROJECT_NOT_FOUND, orchestrator.discover(99L, "cà phê", null, 5).errorType());
        assertEquals(DiscoveryErrorType.PROJECT_INCOMPLETE,
                orchestrator.discoverFromNaturalLanguage(2L, "tìm cà phê").errorType());
        verifyNoInteractions(intentParser);
    }

    @Test
    void incompleteProjectIsFineForStructuredEntry() {
        when(importer.importProducts(eq(2L), anyList(), anyString()))
                .thenReturn(new ImportOutcome(List.of(5L), 0, 0));

        assertTrue(orchestrator.discover(2L, "cà phê", null, null).isSuccess());
    }

    @Test
    void unexpectedFailure_isExecutionErrorWithStage() {
        when(searchAgent.search(any(), any(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        DiscoveryResult result = orchestrator.discover(1L, "cà phê", null, 5);

        assertEquals(DiscoveryErrorType.EXECUTION_ERROR, result.errorType());
        assertEquals(DiscoveryStage.SEARCH, result.failedStage());
        assertTrue(result.message().contains("SEARCH"));
        verify(transitions).log(eq(StateTransitionService.ENTITY_DISCOVERY_RUN), eq(1L), isNull(),
                eq("FAILED"), eq("execution_error"), anyString(), eq("SYSTEM"), anyString());
    }

    @Test
    void nothingCrawled_isCrawlFailed() {
        when(crawlerDispatcher.crawl(anyList(), any(), any())).thenReturn(new CrawlOutcome(List.of(), 1, 1));

        DiscoveryResult result = orchestrator.discover(1L, "cà phê", null, 5);

        assertEquals(DiscoveryErrorType.CRAWL_FAILED, result.errorType());
        assertEquals(0, result.foundCount());
        assertNull(result.filteredCount());
    }

    @Test
    void nothingImported_isImportFailed() {
        when(importer.importProducts(eq(1L), anyList(), anyString()))
                .thenReturn(new ImportOutcome(List.of(), 4, 0));

        DiscoveryResult result = orchestrator.discover(1L, "cà phê", null, 5);

        assertEquals(DiscoveryErrorType.IMPORT_FAILED, result.errorType());
        assertEquals(0, result.importedCount());
    }

    @Test
    void cancelledRun_stopsBeforeImport() {
        DiscoveryDeadline deadline = DiscoveryDeadline.unbounded();
        deadline.cancel();

        DiscoveryResult result = orchestrator.run(DiscoveryRequest.structured(1L, "cà phê", null, 5), deadline);

        assertEquals(DiscoveryErrorType.EXECUTION_ERROR, result.errorType());
        assertEquals(DiscoveryStage.IMPORT, result.failedStage());
        verifyNoInteractions(importer);
    }

    @Test
    void auditFailureDoesNotChangeResult() {
        when(importer.importProducts(eq(1L), anyList(), anyString()))
                .thenReturn(new ImportOutcome(List.of(1L), 0, 0));
        doThrow(new RuntimeException("db down")).when(transitions)
                .log(anyString(), any(), any(), anyString(), anyString(), anyString(), anyString(), anyString());

        assertTrue(orchestrator.discover(1L, "cà phê", null, 5).isSuccess());
    }
}
