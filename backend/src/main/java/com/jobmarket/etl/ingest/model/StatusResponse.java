package com.jobmarket.etl.ingest.model;

import java.util.Map;

public record StatusResponse(
    boolean dbReachable,
    boolean batchRunning,
    Map<String, Long> tableCounts
) {
}
