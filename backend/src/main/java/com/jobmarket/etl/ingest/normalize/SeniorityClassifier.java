package com.jobmarket.etl.ingest.normalize;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Buckets a job title into a seniority level by keyword. Levels are tested in declaration order,
 * so "Principal Engineer" lands in Executive and "Junior Analyst" in Junior.
 */
@Component
public class SeniorityClassifier {
    public static final String EXECUTIVE = "Executive";
    public static final String SENIOR = "Senior";
    public static final String MID = "Mid";
    public static final String JUNIOR = "Junior";
    public static final String UNKNOWN = "Unknown";

    private static final Map<String, Pattern> LEVELS = new LinkedHashMap<>();

    static {
        LEVELS.put(EXECUTIVE, keywords(List.of(
            "ceo", "cfo", "coo", "cto", "chief", "president", "vp", "vice president", "director", "principal")));
        LEVELS.put(SENIOR, keywords(List.of("senior", "sr", "lead", "staff", "manager")));
        LEVELS.put(JUNIOR, keywords(List.of(
            "junior", "jr", "entry", "entry-level", "associate", "intern", "internship", "apprentice")));
        LEVELS.put(MID, keywords(List.of("mid", "mid-level", "analyst", "engineer", "specialist", "coordinator")));
    }

    public String classify(String title) {
        if (title == null || title.isBlank()) {
            return UNKNOWN;
        }
        String lowered = title.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Pattern> level : LEVELS.entrySet()) {
            if (level.getValue().matcher(lowered).find()) {
                return level.getKey();
            }
        }
        return MID;
    }

    private static Pattern keywords(List<String> words) {
        StringBuilder alternation = new StringBuilder();
        for (String word : words) {
            if (alternation.length() > 0) {
                alternation.append('|');
            }
            alternation.append(Pattern.quote(word));
        }
        return Pattern.compile("(?<![a-z0-9])(?:" + alternation + ")(?![a-z0-9])");
    }
}
