package aptvantage.researchflow.engine.persistence;

import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

class EnumColumnMapper<E extends Enum<E>> implements ColumnMapper<E> {

    private final Class<E> type;

    EnumColumnMapper(Class<E> type) {
        this.type = type;
    }

    @Override
    public E map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        String stringValue = r.getString(columnNumber);
        if (stringValue == null) {
            return null;
        }
        return Enum.valueOf(type, stringValue);
    }

    static String name(Enum<?> value) {
        return value == null ? null : value.name();
    }
}
