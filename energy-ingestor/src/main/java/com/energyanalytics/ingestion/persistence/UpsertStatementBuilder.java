package com.energyanalytics.ingestion.persistence;

import com.energyanalytics.ingestion.model.NormalizedRecord;
import com.energyanalytics.ingestion.model.SourceType;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds a multi-row PostgreSQL upsert for one chunk.
 *
 *   INSERT INTO weather.observations (timestamp, location_id, ..., ingestion_timestamp)
 *   VALUES (?, ?, ..., NOW()), (...)
 *   ON CONFLICT (timestamp, location_id) DO UPDATE SET col = EXCLUDED.col, ..., ingestion_timestamp = NOW()
 *   RETURNING (xmax = 0) AS inserted
 *
 * {@code xmax = 0} is true for freshly inserted rows and false for rows the conflict
 * clause updated, which is how inserted and updated counts are told apart.
 */
public final class UpsertStatementBuilder {

    static final String INGESTION_TIMESTAMP = "ingestion_timestamp";

    /** PostgreSQL's wire protocol carries the parameter count as a 16-bit integer */
    static final int MAX_BIND_PARAMETERS = 65535;

    private UpsertStatementBuilder() {
    }

    public record UpsertStatement(String sql, Object[] args) {
    }

    /** Largest chunk whose statement stays within the bind parameter limit. */
    public static int maxRowsPerStatement(int columnCount) {
        return MAX_BIND_PARAMETERS / Math.max(1, columnCount);
    }

    public static UpsertStatement build(SourceType type, List<NormalizedRecord> chunk) {
        if (chunk.isEmpty()) {
            throw new IllegalArgumentException("Cannot build an upsert for an empty chunk");
        }
        List<String> columns = new ArrayList<>(chunk.get(0).columnValues().keySet());
        if (chunk.size() > maxRowsPerStatement(columns.size())) {
            throw new IllegalArgumentException(String.format(
                    "Chunk of %d %s rows needs %d bind parameters, limit is %d",
                    chunk.size(), type, (long) chunk.size() * columns.size(), MAX_BIND_PARAMETERS));
        }
        List<String> keys = type.getConflictColumns();

        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", ", "(", ", NOW())"));
        String values = String.join(",\n", Collections.nCopies(chunk.size(), placeholders));

        String updates = columns.stream()
                .filter(c -> !keys.contains(c))
                .map(c -> quote(c) + " = EXCLUDED." + quote(c))
                .collect(Collectors.joining(", "));

        String sql = "INSERT INTO " + type.getTableName()
                + " (" + columns.stream().map(UpsertStatementBuilder::quote).collect(Collectors.joining(", "))
                + ", " + INGESTION_TIMESTAMP + ")\nVALUES\n" + values
                + "\nON CONFLICT (" + keys.stream().map(UpsertStatementBuilder::quote).collect(Collectors.joining(", "))
                + ") DO UPDATE SET " + updates + ", " + INGESTION_TIMESTAMP + " = NOW()"
                + "\nRETURNING (xmax = 0) AS inserted";

        Object[] args = new Object[columns.size() * chunk.size()];
        int i = 0;
        for (NormalizedRecord record : chunk) {
            Map<String, Object> row = record.columnValues();
            for (String column : columns) {
                args[i++] = toJdbc(row.get(column));
            }
        }
        return new UpsertStatement(sql, args);
    }

    // "timestamp" is a reserved word in PostgreSQL
    private static String quote(String column) {
        return "timestamp".equals(column) ? "\"timestamp\"" : column;
    }

    private static Object toJdbc(Object value) {
        if (value instanceof Instant instant) {
            return Timestamp.from(instant);
        }
        return value;
    }
}
