package com.jobmarket.etl.ingest.model;

import java.util.List;

public record RecordDecision(
    int recordIndex,
    String externalId,
    DecisionOutcome outcome,
    List<String> reasons
) {

    public static RecordDecision rejected(int recordIndex, String externalId, List<String> reasons) {
        return new RecordDecision(recordIndex, externalId, DecisionOutcome.REJECTED, List.copyOf(reasons));
    }

    public static RecordDecision loadable(int recordIndex, String externalId, List<String> flags) {
        DecisionOutcome outcome = flags.isEmpty() ? DecisionOutcome.ACCEPTED : DecisionOutcome.FLAGGED;
        return new RecordDecision(recordIndex, externalId, outcome, List.copyOf(flags));
    }

    public boolean isRejected() {
        return outcome == DecisionOutcome.REJECTED;
    }
}
