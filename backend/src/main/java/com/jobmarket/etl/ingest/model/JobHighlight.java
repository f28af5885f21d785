package com.jobmarket.etl.ingest.model;

public record JobHighlight(
    HighlightType type,
    int lineNumber,
    String text
) {
}
