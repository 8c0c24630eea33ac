package aptvantage.researchflow.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.PriorityBlockingQueue;

/**
 * Agent work waiting to run, ordered by the instant it becomes ready.
 */
public class DispatchQueue {

    private final PriorityBlockingQueue<Dispatch> queue =
            new PriorityBlockingQueue<>(64, Comparator.comparing(Dispatch::readyAt));

    public void add(Dispatch dispatch) {
        queue.add(dispatch);
    }

    public synchronized List<Dispatch> drainReady(Instant now) {
        List<Dispatch> ready = new ArrayList<>();
        Dispatch next = queue.peek();
        while (next != null && !next.readyAt().isAfter(now)) {
            ready.add(queue.poll());
            next = queue.peek();
        }
        return ready;
    }

    public Optional<Instant> nextReadyAt() {
        return Optional.ofNullable(queue.peek()).map(Dispatch::readyAt);
    }

    public List<Dispatch> pending(String requestId) {
        return queue.stream()
                .filter(dispatch -> dispatch.requestId().equals(requestId))
                .toList();
    }

    public int size() {
        return queue.size();
    }
}
