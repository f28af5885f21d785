package com.jobmarket.etl.ingest.skills;

import com.jobmarket.etl.config.PipelineProperties;
import com.jobmarket.etl.ingest.model.DecodedJobRecord;
import com.jobmarket.etl.ingest.model.ExtractedSkill;
import com.jobmarket.etl.ingest.model.HighlightType;
import com.jobmarket.etl.ingest.model.JobHighlight;
import com.jobmarket.etl.ingest.util.ReasonCodes;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pulls canonical skills out of a record's highlight blocks, or out of its description when the
 * record has no highlights object at all. Qualifications mark a skill as required. The benefits
 * block is stored but never scanned.
 */
@Component
public class SkillExtractor {
    private final SkillTaxonomy taxonomy;
    private final PipelineProperties properties;

    public SkillExtractor(SkillTaxonomy taxonomy, PipelineProperties properties) {
        this.taxonomy = taxonomy;
        this.properties = properties;
    }

    public SkillExtraction extract(DecodedJobRecord record, String descriptionPlain) {
        Map<String, ExtractedSkill> skills = new LinkedHashMap<>();
        List<JobHighlight> highlights = new ArrayList<>();
        List<String> flags = new ArrayList<>();

        Map<String, List<String>> blocks = record.highlights();
        if (blocks == null) {
            collect(descriptionPlain, false, skills);
        } else {
            boolean unknownSeen = false;
            for (Map.Entry<String, List<String>> block : blocks.entrySet()) {
                HighlightType type = HighlightType.fromSourceKey(block.getKey());
                if (type == null) {
                    unknownSeen = true;
                    continue;
                }
                int lineNumber = 1;
                for (String line : block.getValue()) {
                    highlights.add(new JobHighlight(type, lineNumber++, line));
                    if (type == HighlightType.QUALIFICATIONS) {
                        collect(line, true, skills);
                    } else if (type == HighlightType.RESPONSIBILITIES) {
                        collect(line, false, skills);
                    }
                }
            }
            if (unknownSeen) {
                flags.add(ReasonCodes.UNKNOWN_HIGHLIGHT_TYPE);
            }
        }

        if (skills.isEmpty()) {
            flags.add(ReasonCodes.NO_SKILLS_EXTRACTED);
        } else if (skills.size() > properties.getSkills().getMaxSkillsPerJob()) {
            flags.add(ReasonCodes.EXCESSIVE_SKILL_COUNT);
        }
        return new SkillExtraction(List.copyOf(skills.values()), List.copyOf(highlights), List.copyOf(flags));
    }

    private void collect(String text, boolean required, Map<String, ExtractedSkill> skills) {
        for (SkillTaxonomy.SkillDefinition definition : taxonomy.match(text)) {
            ExtractedSkill existing = skills.get(definition.name());
            if (existing == null || (required && !existing.required())) {
                skills.put(definition.name(), new ExtractedSkill(definition.name(), definition.category(), required));
            }
        }
    }
}
