package aptvantage.researchflow.support;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class TestCounterService {

    private final Map<String, Integer> counts = new ConcurrentHashMap<>();

    public int incrementAndGet(String key) {
        return counts.merge(key, 1, Integer::sum);
    }

    public int get(String key) {
        return counts.getOrDefault(key, 0);
    }
}
