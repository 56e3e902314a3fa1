package de.t14d3.bobbin.query;

import de.t14d3.bobbin.mapping.TypeMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Post-processes the results of executed queries before they reach the caller.
 */
public class Processor {

    /**
     * Normalize the raw JDBC values of selected rows.
     */
    public List<Map<String, Object>> processSelect(QueryBuilder query, List<Map<String, Object>> rows) {
        List<Map<String, Object>> processed = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : row.entrySet()) {
                copy.put(entry.getKey(), TypeMapper.normalize(entry.getValue()));
            }
            processed.add(copy);
        }
        return processed;
    }

    /**
     * Run an insert statement and return the identifier generated for the new row.
     * Integral identifiers are returned as {@code Long}.
     */
    public Object processInsertGetId(QueryBuilder query, String sql, List<Object> bindings) {
        Object id = query.getConnection().insertGetId(sql, bindings);
        if (id instanceof Number number && !(id instanceof Double) && !(id instanceof Float)) {
            return number.longValue();
        }
        return id;
    }
}
