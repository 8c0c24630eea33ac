package aptvantage.researchflow.engine;

import aptvantage.researchflow.model.WorkflowInstance;
import com.google.common.util.concurrent.Striped;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * The in-memory view of every request that has not reached a terminal state, plus the per-request locks that
 * serialize its progression.
 */
public class LiveInstances {

    private final ConcurrentMap<String, WorkflowInstance> instances = new ConcurrentHashMap<>();
    private final Set<String> working = ConcurrentHashMap.newKeySet();
    private final Striped<Lock> locks = Striped.lazyWeakLock(256);

    public void withLock(String requestId, Runnable action) {
        callWithLock(requestId, () -> {
            action.run();
            return null;
        });
    }

    public <T> T callWithLock(String requestId, Supplier<T> action) {
        Lock lock = locks.get(requestId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public Optional<WorkflowInstance> get(String requestId) {
        return Optional.ofNullable(instances.get(requestId));
    }

    public boolean contains(String requestId) {
        return instances.containsKey(requestId);
    }

    void put(WorkflowInstance instance) {
        instances.put(instance.requestId(), instance);
    }

    void remove(String requestId) {
        instances.remove(requestId);
        working.remove(requestId);
    }

    public Collection<WorkflowInstance> all() {
        return List.copyOf(instances.values());
    }

    boolean tryStartWork(String requestId) {
        return working.add(requestId);
    }

    void finishWork(String requestId) {
        working.remove(requestId);
    }

    public boolean isWorking(String requestId) {
        return working.contains(requestId);
    }

    public int size() {
        return instances.size();
    }
}
