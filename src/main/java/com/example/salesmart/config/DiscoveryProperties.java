package com.example.salesmart.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import com.example.salesmart.discovery.Platform;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * discovery.* settings. Defaults match a single interactive run.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "discovery")
public class DiscoveryProperties {

    /** Hard ceiling on candidates crawled in one run. */
    @Min(1)
    private int globalCrawlCap = 20;

    @Min(1)
    private int maxProductsMin = 1;

    @Min(1)
    private int maxProductsMax = 20;

    /** Used when the model leaves maxProducts out. */
    @Min(1)
    private int defaultMaxProducts = 10;

    @Min(1)
    private int maxInputLength = 2000;

    /** Platforms kept in the enum but refused at request time. */
    private List<Platform> disabledPlatforms = new ArrayList<>(List.of(Platform.SHOPEE));

    /** Suggested when every requested platform is disabled. */
    private List<Platform> fallbackPlatforms = new ArrayList<>(List.of(Platform.LAZADA, Platform.TIKI));

    @NotNull
    private Duration crawlTimeout = Duration.ofSeconds(45);

    @Min(1)
    private int crawlThreads = 4;

    @NotNull
    private Duration runTimeout = Duration.ofMinutes(5);

    /** Search asks for maxProducts * searchMultiplier recommendations. */
    @Min(1)
    private int searchMultiplier = 2;

    @Min(0)
    private int reviewLimit = 30;

    public int clampMaxProducts(int requested) {
        return Math.max(maxProductsMin, Math.min(maxProductsMax, requested));
    }

    public boolean isWithinProductRange(int requested) {
        return requested >= maxProductsMin && requested <= maxProductsMax;
    }
}
