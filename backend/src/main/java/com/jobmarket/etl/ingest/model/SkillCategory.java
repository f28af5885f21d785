package com.jobmarket.etl.ingest.model;

public enum SkillCategory {
    LANGUAGE,
    TOOL_PLATFORM,
    DATABASE,
    SOFT_SKILL,
    METHODOLOGY,
    UNCATEGORIZED
}
