package aptvantage.researchflow.model;

public enum Severity {
    LOW, MEDIUM, HIGH, CRITICAL
}
