package com.example.salesmart.discovery.crawler;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.salesmart.discovery.Platform;

@Component
public class CandidateNormalizer {

    private static final Logger log = LoggerFactory.getLogger(CandidateNormalizer.class);

    static final int MAX_KEYWORDS = 10;

    private static final Set<String> STOP_WORDS = Set.of(
            "và", "của", "cho", "với", "từ", "đến", "có", "là", "một", "các", "những", "loại",
            "the", "and", "for", "with");

    /**
     * @return empty when the listing has no name or no known platform
     */
    public Optional<NormalizedCandidate> normalize(CrawledCandidate raw, String sourceUrl) {
        if (raw == null || raw.name() == null || raw.name().isBlank()) {
            log.debug("[Normalize] dropped nameless listing from {}", sourceUrl);
            return Optional.empty();
        }
        Platform platform = raw.platform() != null ? raw.platform() : Platform.fromUrl(sourceUrl).orElse(null);
        if (platform == null) {
            log.debug("[Normalize] dropped listing with unknown platform url={}", sourceUrl);
            return Optional.empty();
        }
        String name = raw.name().trim();
        String productUrl = raw.link() != null && !raw.link().isBlank() ? raw.link().trim() : sourceUrl;

        return Optional.of(new NormalizedCandidate(
                platform,
                name,
                productUrl,
                ScrapedValueParser.parsePrice(raw.rawPrice()),
                ScrapedValueParser.parseRating(raw.rawRating()),
                ScrapedValueParser.parseIntCount(raw.rawReviewCount()),
                ScrapedValueParser.parseCount(raw.rawSold()),
                Boolean.TRUE.equals(raw.mall()),
                null,
                blankToNull(raw.brand()),
                blankToNull(raw.sellerLocation()),
                null,
                null,
                extractKeywords(name),
                raw.imageUrl() != null && !raw.imageUrl().isBlank() ? List.of(raw.imageUrl()) : List.of(),
                sourceUrl));
    }

    static List<String> extractKeywords(String name) {
        List<String> keywords = new ArrayList<>();
        for (String token : name.toLowerCase(Locale.ROOT).split("\\s+")) {
            String word = token.replaceAll("^[\\p{Punct}]+|[\\p{Punct}]+$", "");
            if (word.length() > 2 && !STOP_WORDS.contains(word) && !keywords.contains(word)) {
                keywords.add(word);
                if (keywords.size() == MAX_KEYWORDS) {
                    break;
                }
            }
        }
        return List.copyOf(keywords);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
