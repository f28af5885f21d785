package com.jobmarket.etl.ingest.model;

public enum SalaryPeriod {
    YEARLY,
    MONTHLY,
    HOURLY
}
