package com.jobmarket.etl.ingest.skills;

import com.jobmarket.etl.ingest.model.ExtractedSkill;
import com.jobmarket.etl.ingest.model.JobHighlight;

import java.util.List;

public record SkillExtraction(
    List<ExtractedSkill> skills,
    List<JobHighlight> highlights,
    List<String> flags
) {
}
