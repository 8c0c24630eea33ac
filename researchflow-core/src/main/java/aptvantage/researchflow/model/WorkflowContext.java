package aptvantage.researchflow.model;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serial;
import java.io.Serializable;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable bag of values accumulated by a request as it moves through the workflow. Agents read their inputs
 * from it and their outputs are merged into it. Insertion order is preserved so that two contexts built from the
 * same sequence of merges serialize to identical bytes.
 */
public final class WorkflowContext implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final WorkflowContext EMPTY = new WorkflowContext(new LinkedHashMap<>());

    private final LinkedHashMap<String, Serializable> values;

    private WorkflowContext(LinkedHashMap<String, Serializable> values) {
        this.values = values;
    }

    public static WorkflowContext empty() {
        return EMPTY;
    }

    public static WorkflowContext of(Map<String, ? extends Serializable> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new WorkflowContext(copyOf(values));
    }

    public WorkflowContext merge(Map<String, ? extends Serializable> delta) {
        if (delta == null || delta.isEmpty()) {
            return this;
        }
        LinkedHashMap<String, Serializable> merged = new LinkedHashMap<>(values);
        merged.putAll(copyOf(delta));
        return new WorkflowContext(merged);
    }

    /**
     * Entries of this context that are absent from, or differ in, {@code base}.
     */
    public Map<String, Serializable> diff(WorkflowContext base) {
        LinkedHashMap<String, Serializable> changed = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (!Objects.equals(base.values.get(key), value)) {
                changed.put(key, value);
            }
        });
        return Collections.unmodifiableMap(changed);
    }

    public Optional<Serializable> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Serializable> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public byte[] toBytes() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(this);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to serialize workflow context", e);
        }
        return bytes.toByteArray();
    }

    public static WorkflowContext fromBytes(byte[] bytes) {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
            return (WorkflowContext) in.readObject();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to deserialize workflow context", e);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("Unable to deserialize workflow context", e);
        }
    }

    private static LinkedHashMap<String, Serializable> copyOf(Map<String, ? extends Serializable> values) {
        LinkedHashMap<String, Serializable> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> copy.put(Objects.requireNonNull(key, "context key"), value));
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowContext that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "WorkflowContext" + values;
    }
}
