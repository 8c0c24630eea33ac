package aptvantage.researchflow.model;

public enum ExecutionOutcome {
    SUCCESS, FAILURE, RETRYING
}
