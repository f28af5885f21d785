package com.jobmarket.etl.ingest.util;

public final class ReasonCodes {
  public static final String JOB_ID_NOT_STRING = "job_id not a string";
  public static final String REMOTE_FLAG_NOT_BOOLEAN = "remote flag not boolean";
  public static final String LATITUDE_NOT_NUMERIC = "latitude not numeric";
  public static final String LATITUDE_OUT_OF_RANGE = "latitude out of range";
  public static final String LONGITUDE_NOT_NUMERIC = "longitude not numeric";
  public static final String LONGITUDE_OUT_OF_RANGE = "longitude out of range";
  public static final String COUNTRY_CODE_INVALID = "country code invalid";
  public static final String PROCESSING_ERROR = "processing error";

  public static final String EMPLOYMENT_TYPE_UNMAPPED = "employment type unmapped";
  public static final String SALARY_PERIOD_UNMAPPED = "salary period unmapped";
  public static final String SALARY_NOT_NUMERIC = "salary not numeric";
  public static final String LOCATION_INCOMPLETE = "location incomplete";
  public static final String SALARY_MISSING_PERIOD = "salary missing period";
  public static final String SALARY_RANGE_INVERTED = "salary range inverted";
  public static final String SALARY_OUTLIER = "salary outlier";
  public static final String POSTED_TIMESTAMP_MISMATCH = "posted timestamp mismatch";
  public static final String POSTED_TIMESTAMP_INVALID = "posted timestamp invalid";
  public static final String INSECURE_APPLY_LINK = "insecure apply link";
  public static final String INSECURE_GOOGLE_LINK = "insecure google link";
  public static final String DESCRIPTION_LENGTH_ANOMALY = "description length anomaly";
  public static final String NO_SKILLS_EXTRACTED = "no skills extracted";
  public static final String EXCESSIVE_SKILL_COUNT = "excessive skill count";
  public static final String UNKNOWN_HIGHLIGHT_TYPE = "unknown highlight type";

  private static final String MISSING_PREFIX = "missing ";

  private ReasonCodes() {}

  public static String missing(String field) {
    return MISSING_PREFIX + field;
  }
}
