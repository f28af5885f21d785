package com.jobmarket.etl.ingest.model;

public record ExtractedSkill(
    String name,
    SkillCategory category,
    boolean required
) {
}
