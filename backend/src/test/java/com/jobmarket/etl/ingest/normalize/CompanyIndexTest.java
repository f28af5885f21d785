package com.jobmarket.etl.ingest.normalize;

import com.jobmarket.etl.config.PipelineProperties;
import com.jobmarket.etl.ingest.model.CompanyRef;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CompanyIndexTest {

    private final CompanyNameNormalizer normalizer = new CompanyNameNormalizer(new PipelineProperties());

    @Test
    void keyIgnoresCaseSpacingNoiseAndTrailingPunctuation() {
        assertEquals("dice", normalizer.comparisonKey("Jobs via Dice"));
        assertEquals("dice", normalizer.comparisonKey("  DICE. "));
        assertEquals("acme analytics", normalizer.comparisonKey("Acme   Analytics"));
        assertEquals("jobs viable", normalizer.comparisonKey("Jobs Viable"));
    }

    @Test
    void fullWidthCharactersFoldToTheSameKey() {
        assertEquals(normalizer.comparisonKey("Acme"), normalizer.comparisonKey("Ａｃｍｅ"));
    }

    @Test
    void nameMadeOnlyOfNoiseKeepsItsKey() {
        assertEquals("jobs via", normalizer.comparisonKey("Jobs via"));
    }

    @Test
    void noisyVariantFirstStillPrefersCleanDisplayName() {
        CompanyIndex index = new CompanyIndex(normalizer);
        index.resolve("Jobs via Dice", null, null);
        index.resolve("Dice", "https://dice.example", null);

        CompanyRef ref = index.canonical("dice");
        assertEquals("Dice", ref.displayName());
        assertEquals("https://dice.example", ref.website());
        assertEquals(1, index.size());
    }

    @Test
    void cleanVariantFirstIsKept() {
        CompanyIndex index = new CompanyIndex(normalizer);
        index.resolve("Dice", null, null);
        CompanyRef second = index.resolve("Jobs via Dice", "https://dice.example", "https://dice.example/logo.png");

        assertEquals("Dice", second.displayName());
        assertEquals("https://dice.example/logo.png", second.logoUrl());
    }

    @Test
    void firstWebsiteSeenWins() {
        CompanyIndex index = new CompanyIndex(normalizer);
        index.resolve("Acme", "https://first.example", null);
        index.resolve("ACME", "https://second.example", null);

        assertEquals("https://first.example", index.canonical("acme").website());
    }

    @Test
    void blankNameIsRefused() {
        CompanyIndex index = new CompanyIndex(normalizer);
        assertThrows(IllegalArgumentException.class, () -> index.resolve("  ", null, null));
    }

    @Test
    void concurrentResolutionCreatesOneEntryPerKey() {
        CompanyIndex index = new CompanyIndex(normalizer);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<CompanyRef>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String name = i % 2 == 0 ? "Jobs via Dice" : "dice";
                futures.add(CompletableFuture.supplyAsync(() -> index.resolve(name, null, null), executor));
            }
            futures.forEach(CompletableFuture::join);
        } finally {
            executor.shutdownNow();
        }

        assertThat(index.size()).isEqualTo(1);
        assertThat(index.canonical("dice").displayName()).isEqualTo("dice");
    }
}
