package aptvantage.researchflow.model;

public enum ApprovalKind {
    REQUIREMENTS_REVIEW,
    CRITICAL_QUERY_REVIEW,
    ACCESS_AUTHORIZATION,
    QUALITY_REVIEW,
    SCOPE_CHANGE
}
