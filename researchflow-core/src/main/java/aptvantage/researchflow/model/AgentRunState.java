package aptvantage.researchflow.model;

public enum AgentRunState {
    IDLE, WORKING, FAILED, WAITING_FOR_HUMAN
}
