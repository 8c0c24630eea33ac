package aptvantage.researchflow.engine;

import aptvantage.researchflow.api.Agent;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class AgentRegistry {

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();

    public AgentRegistry register(Agent agent) {
        Agent existing = agents.putIfAbsent(agent.id(), agent);
        if (existing != null && existing != agent) {
            throw new IllegalArgumentException("An agent with id [%s] is already registered".formatted(agent.id()));
        }
        return this;
    }

    public AgentRegistry registerAll(Collection<? extends Agent> agents) {
        agents.forEach(this::register);
        return this;
    }

    public Optional<Agent> find(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }
}
