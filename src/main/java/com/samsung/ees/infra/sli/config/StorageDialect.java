package com.samsung.ees.infra.sli.config;

/**
 * Database specific upsert statements. Each statement is a single conflict-resolving write, so the
 * engine serializes concurrent writers to the same key and no appended segment is lost.
 * <p>
 * Named parameters: {@code :timebucket}, {@code :segment}, {@code :indicatorId} for the compact append,
 * {@code :timestamp}, {@code :value}, {@code :indicatorId} for the raw upsert.
 */
public enum StorageDialect {

    POSTGRES("""
            INSERT INTO indicatorvaluecompact AS t (timebucket, "values", indicator_id)
            VALUES (:timebucket, :segment, :indicatorId)
            ON CONFLICT ON CONSTRAINT indicatorvaluecompact_timebucket_indicator_id_pkey
            DO UPDATE SET "values" = t."values" || EXCLUDED."values"
            """, """
            INSERT INTO indicatorvalue ("timestamp", "value", indicator_id)
            VALUES (:timestamp, :value, :indicatorId)
            ON CONFLICT ON CONSTRAINT indicatorvalue_timestamp_indicator_id_pkey
            DO UPDATE SET "value" = EXCLUDED."value"
            """),

    ORACLE("""
            MERGE INTO indicatorvaluecompact t
            USING (SELECT :timebucket AS timebucket, :segment AS segment, :indicatorId AS indicator_id FROM dual) s
               ON (t.timebucket = s.timebucket AND t.indicator_id = s.indicator_id)
             WHEN MATCHED THEN UPDATE SET t."values" = t."values" || s.segment
             WHEN NOT MATCHED THEN INSERT (timebucket, "values", indicator_id)
                  VALUES (s.timebucket, s.segment, s.indicator_id)
            """, """
            MERGE INTO indicatorvalue t
            USING (SELECT :timestamp AS ts, :value AS val, :indicatorId AS indicator_id FROM dual) s
               ON (t."timestamp" = s.ts AND t.indicator_id = s.indicator_id)
             WHEN MATCHED THEN UPDATE SET t."value" = s.val
             WHEN NOT MATCHED THEN INSERT ("timestamp", "value", indicator_id)
                  VALUES (s.ts, s.val, s.indicator_id)
            """),

    H2("""
            MERGE INTO indicatorvaluecompact t
            USING (SELECT CAST(:timebucket AS TIMESTAMP) AS timebucket,
                          CAST(:segment AS VARCHAR) AS segment,
                          CAST(:indicatorId AS INTEGER) AS indicator_id) s
               ON t.timebucket = s.timebucket AND t.indicator_id = s.indicator_id
             WHEN MATCHED THEN UPDATE SET "values" = t."values" || s.segment
             WHEN NOT MATCHED THEN INSERT (timebucket, "values", indicator_id)
                  VALUES (s.timebucket, s.segment, s.indicator_id)
            """, """
            MERGE INTO indicatorvalue ("timestamp", "value", indicator_id)
            KEY ("timestamp", indicator_id)
            VALUES (:timestamp, :value, :indicatorId)
            """);

    private final String compactAppendSql;
    private final String rawUpsertSql;

    StorageDialect(String compactAppendSql, String rawUpsertSql) {
        this.compactAppendSql = compactAppendSql;
        this.rawUpsertSql = rawUpsertSql;
    }

    /**
     * Inserts the (timebucket, indicator) row with the segment, or appends the segment to the stored values.
     */
    public String compactAppendSql() {
        return compactAppendSql;
    }

    /**
     * Inserts the (timestamp, indicator) row, or replaces its value.
     */
    public String rawUpsertSql() {
        return rawUpsertSql;
    }

    public String schemaLocation() {
        return "/schema/" + name().toLowerCase() + ".sql";
    }
}
