package com.example.salesmart.discovery.crawler;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

class CrawlBudgetTest {

    @Test
    void reserveNeverExceedsCap() {
        CrawlBudget budget = new CrawlBudget(20);

        assertEquals(8, budget.reserve(8));
        assertEquals(8, budget.reserve(8));
        assertEquals(4, budget.reserve(8));
        assertEquals(0, budget.reserve(8));
        assertEquals(20, budget.used());
    }

    @Test
    void refundMakesUnitsAvailableAgain() {
        CrawlBudget budget = new CrawlBudget(10);
        budget.reserve(10);
        budget.refund(3);

        assertEquals(3, budget.remaining());
        assertEquals(3, budget.reserve(5));

        budget.refund(100);
        assertEquals(10, budget.remaining());
    }

    @Test
    void concurrentReservationsSumToCap() throws Exception {
        CrawlBudget budget = new CrawlBudget(20);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                tasks.add(() -> budget.reserve(3));
            }
            int total = 0;
            for (Future<Integer> f : pool.invokeAll(tasks)) {
                total += f.get();
            }
            assertEquals(20, total);
            assertEquals(0, budget.remaining());
        } finally {
            pool.shutdownNow();
        }
    }
}
