package com.jobmarket.etl.ingest.normalize;

import com.jobmarket.etl.ingest.model.CompanyRef;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;

/**
 * Batch-scoped registry of canonical companies. Workers resolve names concurrently; all state is
 * guarded by a single lock.
 *
 * <p>The display name converges on the same value whatever order the variants arrive in: a
 * variant without a noise prefix wins, then the shorter one, then the lexicographically smaller.
 * Callers that need the final display name should read it through {@link #canonical(String)}
 * once every record has been resolved.
 */
public class CompanyIndex {
    private final CompanyNameNormalizer normalizer;
    private final Object lock = new Object();
    private final Map<String, Entry> entries = new HashMap<>();
    private final Comparator<String> displayPreference;

    public CompanyIndex(CompanyNameNormalizer normalizer) {
        this.normalizer = normalizer;
        this.displayPreference = Comparator
            .comparing((String name) -> normalizer.hasNoisePrefix(name))
            .thenComparingInt(String::length)
            .thenComparing(Comparator.naturalOrder());
    }

    public CompanyRef resolve(String name, String website, String logoUrl) {
        String key = normalizer.comparisonKey(name);
        if (key == null) {
            throw new IllegalArgumentException("company name is blank");
        }
        String displayName = name.trim();
        synchronized (lock) {
            Entry entry = entries.get(key);
            if (entry == null) {
                entry = new Entry(displayName);
                entries.put(key, entry);
            } else if (displayPreference.compare(displayName, entry.displayName) < 0) {
                entry.displayName = displayName;
            }
            if (entry.website == null && hasText(website)) {
                entry.website = website.trim();
            }
            if (entry.logoUrl == null && hasText(logoUrl)) {
                entry.logoUrl = logoUrl.trim();
            }
            return entry.toRef(key);
        }
    }

    public CompanyRef canonical(String nameKey) {
        synchronized (lock) {
            Entry entry = entries.get(nameKey);
            return entry == null ? null : entry.toRef(nameKey);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static final class Entry {
        private String displayName;
        private String website;
        private String logoUrl;

        private Entry(String displayName) {
            this.displayName = displayName;
        }

        private CompanyRef toRef(String key) {
            return new CompanyRef(key, displayName, website, logoUrl);
        }
    }
}
