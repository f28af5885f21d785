package com.jobmarket.etl.ingest.skills;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmarket.etl.ingest.model.SkillCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class SkillTaxonomyLoader {
    private static final Logger log = LoggerFactory.getLogger(SkillTaxonomyLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public SkillTaxonomyLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    public SkillTaxonomy load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Skill taxonomy not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            SkillTaxonomy taxonomy = parse(objectMapper.readTree(in));
            log.info("Loaded skill taxonomy with {} skills from {}", taxonomy.size(), location);
            return taxonomy;
        } catch (IOException e) {
            throw new IllegalStateException("Skill taxonomy at " + location + " could not be read", e);
        }
    }

    SkillTaxonomy parse(JsonNode root) {
        JsonNode skills = root == null ? null : root.path("skills");
        if (skills == null || !skills.isArray()) {
            throw new IllegalStateException("Skill taxonomy must contain a 'skills' array");
        }
        List<SkillTaxonomy.SkillDefinition> definitions = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode entry : skills) {
            String name = entry.path("name").asText("").trim();
            if (name.isEmpty()) {
                throw new IllegalStateException("Skill taxonomy entry without a name: " + entry);
            }
            if (!seen.add(name.toLowerCase(Locale.ROOT))) {
                log.warn("Duplicate skill taxonomy entry ignored: {}", name);
                continue;
            }
            List<String> aliases = new ArrayList<>();
            for (JsonNode alias : entry.path("aliases")) {
                aliases.add(alias.asText());
            }
            boolean matchName = entry.path("matchName").asBoolean(true);
            definitions.add(SkillTaxonomy.definition(name, category(entry.path("category").asText(null)), matchName, aliases));
        }
        return new SkillTaxonomy(definitions);
    }

    private SkillCategory category(String value) {
        if (value == null || value.isBlank()) {
            return SkillCategory.UNCATEGORIZED;
        }
        try {
            return SkillCategory.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown skill category {}, using UNCATEGORIZED", value);
            return SkillCategory.UNCATEGORIZED;
        }
    }
}
