package com.jobmarket.etl.ingest.api;

import com.jobmarket.etl.ingest.model.RawJobRecord;

import java.util.List;

public record IngestApiRequest(
    List<RawJobRecord> records,
    Boolean replaceExisting
) {
}
