package com.jobmarket.etl.ingest.normalize;

import com.jobmarket.etl.config.PipelineProperties;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives the comparison key under which company name variants are merged. Keys are what the
 * {@code companies.name_key} unique constraint is enforced on.
 */
@Component
public class CompanyNameNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\p{Punct}\\s]+$");

    private final List<String> noisePrefixes;

    public CompanyNameNormalizer(PipelineProperties properties) {
        List<String> prefixes = new ArrayList<>();
        for (String prefix : properties.getCompany().getNoisePrefixes()) {
            String normalized = fold(prefix);
            if (normalized != null) {
                // a prefix only matches on a word boundary
                prefixes.add(normalized + " ");
            }
        }
        this.noisePrefixes = List.copyOf(prefixes);
    }

    public String comparisonKey(String name) {
        String folded = fold(name);
        if (folded == null) {
            return null;
        }
        String key = stripNoise(folded);
        key = TRAILING_PUNCTUATION.matcher(key).replaceAll("");
        if (key.isEmpty()) {
            key = TRAILING_PUNCTUATION.matcher(folded).replaceAll("");
        }
        return key.isEmpty() ? folded : key;
    }

    public boolean hasNoisePrefix(String name) {
        String folded = fold(name);
        return folded != null && !stripNoise(folded).equals(folded);
    }

    private String stripNoise(String folded) {
        String current = folded;
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String prefix : noisePrefixes) {
                if (current.startsWith(prefix) && current.length() > prefix.length()) {
                    current = current.substring(prefix.length()).trim();
                    stripped = true;
                }
            }
        }
        return current;
    }

    private String fold(String value) {
        if (value == null) {
            return null;
        }
        String normalized = Normalizer.normalize(value, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ").trim();
        return normalized.isEmpty() ? null : normalized;
    }
}
