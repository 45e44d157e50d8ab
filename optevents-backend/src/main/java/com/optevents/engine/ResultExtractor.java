package com.optevents.engine;

import com.optevents.client.ComplexData;
import com.optevents.client.DataSet;
import com.optevents.model.EventRow;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts an events table into {@link EventRow}s.
 *
 * <p>Each row is {@code [attributes, timestamp, ...]}: column 0 an attribute bag, column 1 the
 * event time. Later duplicates of a key within one bag overwrite earlier ones.
 */
@Component
public class ResultExtractor {

    /**
     * Extracts all rows of a table in order.
     *
     * @param table events table, may be {@code null}
     * @param position where the table came from, e.g. {@code page 2}, used in error messages
     * @return rows, empty if the table has none
     */
    public List<EventRow> extract(DataSet table, String position) {
        if (table == null || table.getData() == null) {
            return List.of();
        }

        List<EventRow> results = new ArrayList<>(table.getData().size());
        int index = 0;
        for (List<Object> row : table.getData()) {
            results.add(extractRow(row, position, table.getName(), index));
            index++;
        }
        return results;
    }

    private EventRow extractRow(List<Object> row, String position, String tableName, int index) {
        if (row == null || row.size() < 2) {
            throw new DataShapeException(String.format("%s dataset %s row %d has %d columns, expected at least 2",
                    position, tableName, index, row == null ? 0 : row.size()));
        }

        Object attributes = row.get(0);
        if (!(attributes instanceof ComplexData bag)) {
            throw new DataShapeException(String.format(
                    "%s dataset %s row %d column 0 (type %s) could not be converted to attribute data",
                    position, tableName, index, typeName(attributes)));
        }

        Instant timestamp = toInstant(row.get(1));
        if (timestamp == null) {
            throw new DataShapeException(String.format(
                    "%s dataset %s row %d column 1 (type %s) could not be converted to a timestamp",
                    position, tableName, index, typeName(row.get(1))));
        }

        return new EventRow(timestamp, toAttributeMap(bag, position, tableName, index));
    }

    private Map<String, Object> toAttributeMap(ComplexData bag, String position, String tableName, int rowIndex) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (bag.getData() == null) {
            return out;
        }
        int pairIndex = 0;
        for (List<Object> pair : bag.getData()) {
            if (pair == null || pair.size() < 2 || !(pair.get(0) instanceof String key)) {
                throw new DataShapeException(String.format(
                        "%s dataset %s row %d attribute %d is not a [name, value] pair",
                        position, tableName, rowIndex, pairIndex));
            }
            out.put(key, pair.get(1));
            pairIndex++;
        }
        return out;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        return null;
    }

    static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
