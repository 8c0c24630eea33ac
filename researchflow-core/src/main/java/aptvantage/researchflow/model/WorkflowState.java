package aptvantage.researchflow.model;

public enum WorkflowState {
    REQUIREMENTS_GATHERING(Kind.WORK, "Gathering requirements from researcher"),
    REQUIREMENTS_REVIEW(Kind.GATE, "Waiting for informatician to review requirements"),
    FEASIBILITY_VALIDATION(Kind.WORK, "Checking data availability and feasibility"),
    PHENOTYPE_REVIEW(Kind.GATE, "Waiting for informatician to approve the phenotype query"),
    SCHEDULE_KICKOFF(Kind.WORK, "Scheduling kickoff meeting"),
    EXTRACTION_APPROVAL(Kind.GATE, "Waiting for authorization to extract data"),
    DATA_EXTRACTION(Kind.WORK, "Extracting data from sources"),
    QA_VALIDATION(Kind.WORK, "Running quality assurance checks"),
    QA_REVIEW(Kind.GATE, "Waiting for informatician to approve QA results"),
    DATA_DELIVERY(Kind.WORK, "Packaging and delivering data"),
    SCOPE_CHANGE_REVIEW(Kind.GATE, "Scope change requested, waiting for review"),
    HUMAN_REVIEW(Kind.GATE, "Escalated to human review"),
    COMPLETED(Kind.TERMINAL, "Request complete"),
    REJECTED(Kind.TERMINAL, "Request rejected"),
    FAILED(Kind.TERMINAL, "Request failed"),
    CANCELLED(Kind.TERMINAL, "Request cancelled");

    public enum Kind {
        WORK, GATE, TERMINAL
    }

    private final Kind kind;
    private final String description;

    WorkflowState(Kind kind, String description) {
        this.kind = kind;
        this.description = description;
    }

    public Kind kind() {
        return kind;
    }

    public String description() {
        return description;
    }

    public boolean isTerminal() {
        return kind == Kind.TERMINAL;
    }

    public boolean isWork() {
        return kind == Kind.WORK;
    }

    public boolean isGate() {
        return kind == Kind.GATE;
    }
}
