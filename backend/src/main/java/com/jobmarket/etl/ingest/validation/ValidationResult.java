package com.jobmarket.etl.ingest.validation;

import java.util.List;

public record ValidationResult(
    List<String> rejections,
    List<String> flags
) {

    public ValidationResult {
        rejections = List.copyOf(rejections);
        flags = List.copyOf(flags);
    }

    public boolean isRejected() {
        return !rejections.isEmpty();
    }
}
