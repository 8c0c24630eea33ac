package aptvantage.researchflow.model;

import java.io.Serializable;

public record AgentTask(
        String agentId,
        String task
) implements Serializable {

    public static final AgentTask GATHER_REQUIREMENTS = new AgentTask("requirements_agent", "gather_requirements");
    public static final AgentTask VALIDATE_FEASIBILITY = new AgentTask("phenotype_agent", "validate_feasibility");
    public static final AgentTask SCHEDULE_KICKOFF_MEETING = new AgentTask("calendar_agent", "schedule_kickoff_meeting");
    public static final AgentTask EXTRACT_DATA = new AgentTask("extraction_agent", "extract_data");
    public static final AgentTask VALIDATE_EXTRACTED_DATA = new AgentTask("qa_agent", "validate_extracted_data");
    public static final AgentTask DELIVER_DATA = new AgentTask("delivery_agent", "deliver_data");

    @Override
    public String toString() {
        return "%s.%s".formatted(agentId, task);
    }
}
