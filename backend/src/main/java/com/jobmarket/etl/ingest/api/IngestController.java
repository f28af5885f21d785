package com.jobmarket.etl.ingest.api;

import com.jobmarket.etl.config.PipelineProperties;
import com.jobmarket.etl.ingest.model.QualityReport;
import com.jobmarket.etl.ingest.model.StatusResponse;
import com.jobmarket.etl.ingest.service.IngestStatusService;
import com.jobmarket.etl.ingest.service.IngestionPipelineService;
import com.jobmarket.etl.ingest.service.InvalidIngestRequestException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class IngestController {
    private final IngestionPipelineService pipelineService;
    private final IngestStatusService statusService;
    private final PipelineProperties properties;

    public IngestController(
        IngestionPipelineService pipelineService,
        IngestStatusService statusService,
        PipelineProperties properties
    ) {
        this.pipelineService = pipelineService;
        this.statusService = statusService;
        this.properties = properties;
    }

    @PostMapping("/ingest")
    public QualityReport ingest(@RequestBody(required = false) IngestApiRequest request) {
        if (request == null || request.records() == null || request.records().isEmpty()) {
            throw new InvalidIngestRequestException("records must be a non-empty array");
        }
        boolean replace = request.replaceExisting() == null
            ? properties.isReplaceExisting()
            : request.replaceExisting();
        return pipelineService.run(request.records(), replace);
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return statusService.getStatus();
    }
}
