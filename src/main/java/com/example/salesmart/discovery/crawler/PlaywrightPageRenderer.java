package com.example.salesmart.discovery.crawler;

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;

/**
 * Headless Chromium via Playwright. Playwright objects are not thread safe,
 * so every render owns its own driver and browser.
 */
@Component
public class PlaywrightPageRenderer implements PageRenderer {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightPageRenderer.class);

    private static final double NAVIGATION_TIMEOUT_MS = 30_000;

    @Override
    public String render(String url, Duration settle) {
        long started = System.currentTimeMillis();
        try (Playwright playwright = Playwright.create();
                Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                        .setHeadless(true)
                        .setArgs(List.of("--disable-blink-features=AutomationControlled",
                                "--no-sandbox", "--disable-dev-shm-usage")));
                BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                        .setLocale("vi-VN"))) {
            Page page = context.newPage();
            page.navigate(url, new Page.NavigateOptions().setTimeout(NAVIGATION_TIMEOUT_MS));
            page.waitForTimeout(settle.toMillis());
            String html = page.content();
            log.debug("[Render] url={} chars={} took={}ms", url, html.length(), System.currentTimeMillis() - started);
            return html;
        } catch (PlaywrightException e) {
            throw new ScrapeException("Page render failed for " + url + ": " + e.getMessage(), e);
        }
    }
}
