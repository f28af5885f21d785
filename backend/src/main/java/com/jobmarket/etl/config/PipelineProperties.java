package com.jobmarket.etl.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private static final String DEFAULT_TAXONOMY_LOCATION = "classpath:skills/taxonomy.json";

    private int workerConcurrency = 4;
    private boolean replaceExisting = false;
    private Company company = new Company();
    private Validation validation = new Validation();
    private Vocabulary vocabulary = new Vocabulary();
    private Skills skills = new Skills();
    private Loader loader = new Loader();
    private Cli cli = new Cli();

    public int getWorkerConcurrency() {
        return Math.max(1, workerConcurrency);
    }

    public void setWorkerConcurrency(int workerConcurrency) {
        this.workerConcurrency = Math.max(1, workerConcurrency);
    }

    public boolean isReplaceExisting() {
        return replaceExisting;
    }

    public void setReplaceExisting(boolean replaceExisting) {
        this.replaceExisting = replaceExisting;
    }

    public Company getCompany() {
        return company;
    }

    public void setCompany(Company company) {
        this.company = company;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    public void setVocabulary(Vocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public Skills getSkills() {
        return skills;
    }

    public void setSkills(Skills skills) {
        this.skills = skills;
    }

    public Loader getLoader() {
        return loader;
    }

    public void setLoader(Loader loader) {
        this.loader = loader;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Company {
        private List<String> noisePrefixes = new ArrayList<>(List.of("jobs via "));

        public List<String> getNoisePrefixes() {
            return noisePrefixes == null ? List.of() : noisePrefixes;
        }

        public void setNoisePrefixes(List<String> noisePrefixes) {
            this.noisePrefixes = noisePrefixes;
        }
    }

    public static class Validation {
        private int descriptionMinLength = 100;
        private int descriptionMaxLength = 50_000;
        private int timestampToleranceHours = 24;
        private double salaryOutlierMinYearly = 15_000;
        private double salaryOutlierMaxYearly = 500_000;

        public int getDescriptionMinLength() {
            return Math.max(0, descriptionMinLength);
        }

        public void setDescriptionMinLength(int descriptionMinLength) {
            this.descriptionMinLength = Math.max(0, descriptionMinLength);
        }

        public int getDescriptionMaxLength() {
            return Math.max(getDescriptionMinLength(), descriptionMaxLength);
        }

        public void setDescriptionMaxLength(int descriptionMaxLength) {
            this.descriptionMaxLength = descriptionMaxLength;
        }

        public int getTimestampToleranceHours() {
            return Math.max(1, timestampToleranceHours);
        }

        public void setTimestampToleranceHours(int timestampToleranceHours) {
            this.timestampToleranceHours = Math.max(1, timestampToleranceHours);
        }

        public double getSalaryOutlierMinYearly() {
            return salaryOutlierMinYearly;
        }

        public void setSalaryOutlierMinYearly(double salaryOutlierMinYearly) {
            this.salaryOutlierMinYearly = salaryOutlierMinYearly;
        }

        public double getSalaryOutlierMaxYearly() {
            return salaryOutlierMaxYearly;
        }

        public void setSalaryOutlierMaxYearly(double salaryOutlierMaxYearly) {
            this.salaryOutlierMaxYearly = salaryOutlierMaxYearly;
        }
    }

    /**
     * Extra synonym entries layered over the built-in employment type and salary period tables.
     * Keys are matched case-insensitively; values must name an existing canonical value.
     */
    public static class Vocabulary {
        private Map<String, String> employmentTypeSynonyms = new LinkedHashMap<>();
        private Map<String, String> salaryPeriodSynonyms = new LinkedHashMap<>();

        public Map<String, String> getEmploymentTypeSynonyms() {
            return employmentTypeSynonyms == null ? Map.of() : employmentTypeSynonyms;
        }

        public void setEmploymentTypeSynonyms(Map<String, String> employmentTypeSynonyms) {
            this.employmentTypeSynonyms = employmentTypeSynonyms;
        }

        public Map<String, String> getSalaryPeriodSynonyms() {
            return salaryPeriodSynonyms == null ? Map.of() : salaryPeriodSynonyms;
        }

        public void setSalaryPeriodSynonyms(Map<String, String> salaryPeriodSynonyms) {
            this.salaryPeriodSynonyms = salaryPeriodSynonyms;
        }
    }

    public static class Skills {
        private String taxonomyLocation = DEFAULT_TAXONOMY_LOCATION;
        private int maxSkillsPerJob = 20;

        public String getTaxonomyLocation() {
            if (taxonomyLocation == null || taxonomyLocation.isBlank()) {
                return DEFAULT_TAXONOMY_LOCATION;
            }
            return taxonomyLocation.trim();
        }

        public void setTaxonomyLocation(String taxonomyLocation) {
            this.taxonomyLocation = taxonomyLocation;
        }

        public int getMaxSkillsPerJob() {
            return Math.max(1, maxSkillsPerJob);
        }

        public void setMaxSkillsPerJob(int maxSkillsPerJob) {
            this.maxSkillsPerJob = Math.max(1, maxSkillsPerJob);
        }
    }

    public static class Loader {
        private int maxRetries = 1;

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }
    }

    public static class Cli {
        private boolean run;
        private String inputFile = "raw_jobs.json";
        private String reportFile = "quality_report.json";
        private String rejectedCsvFile = "rejected_jobs.csv";
        private boolean replaceExisting;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getInputFile() {
            return inputFile;
        }

        public void setInputFile(String inputFile) {
            this.inputFile = inputFile;
        }

        public String getReportFile() {
            return reportFile;
        }

        public void setReportFile(String reportFile) {
            this.reportFile = reportFile;
        }

        public String getRejectedCsvFile() {
            return rejectedCsvFile;
        }

        public void setRejectedCsvFile(String rejectedCsvFile) {
            this.rejectedCsvFile = rejectedCsvFile;
        }

        public boolean isReplaceExisting() {
            return replaceExisting;
        }

        public void setReplaceExisting(boolean replaceExisting) {
            this.replaceExisting = replaceExisting;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
