package com.jobmarket.etl.ingest.service;

import com.jobmarket.etl.ingest.model.StatusResponse;
import com.jobmarket.etl.ingest.persistence.JobMarketJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;

@Service
public class IngestStatusService {
    private static final Logger log = LoggerFactory.getLogger(IngestStatusService.class);

    private final JobMarketJdbcRepository repository;
    private final IngestionPipelineService pipelineService;

    public IngestStatusService(JobMarketJdbcRepository repository, IngestionPipelineService pipelineService) {
        this.repository = repository;
        this.pipelineService = pipelineService;
    }

    public StatusResponse getStatus() {
        boolean dbReachable;
        try {
            dbReachable = repository.isDbReachable();
        } catch (DataAccessException e) {
            log.warn("Database is not reachable", e);
            dbReachable = false;
        }
        if (!dbReachable) {
            return new StatusResponse(false, pipelineService.isRunning(), new LinkedHashMap<>());
        }
        return new StatusResponse(true, pipelineService.isRunning(), repository.tableCounts());
    }
}
