package aptvantage.researchflow.engine.persistence;

import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.io.UncheckedIOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads blobs written with Java serialization. Maps are stored as {@link LinkedHashMap} so their iteration order
 * survives a round trip.
 */
class SerializableColumnMapper implements ColumnMapper<Serializable> {

    @Override
    public Serializable map(ResultSet rs, int columnNumber, StatementContext ctx) throws SQLException {
        byte[] bytes = rs.getBytes(columnNumber);
        if (bytes == null) {
            return null;
        }
        try (ObjectInputStream objectIn = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
            return (Serializable) objectIn.readObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException(e);
        }
    }

    @SuppressWarnings("unchecked")
    Map<String, Serializable> mapOf(ResultSet rs, String column, StatementContext ctx) throws SQLException {
        Serializable value = map(rs, column, ctx);
        return value == null ? Map.of() : (Map<String, Serializable>) value;
    }

    static byte[] serialize(Serializable value) {
        if (value == null) {
            return null;
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to serialize [%s]".formatted(value.getClass().getName()), e);
        }
        return bytes.toByteArray();
    }

    static byte[] serializeMap(Map<String, Serializable> values) {
        LinkedHashMap<String, Serializable> copy = new LinkedHashMap<>(values);
        return serialize(copy);
    }
}
