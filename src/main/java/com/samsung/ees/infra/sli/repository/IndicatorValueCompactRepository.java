package com.samsung.ees.infra.sli.repository;

import com.samsung.ees.infra.sli.config.StorageDialect;
import com.samsung.ees.infra.sli.model.IndicatorValueCompact;
import com.samsung.ees.infra.sli.util.BucketKeys;
import com.samsung.ees.infra.sli.util.StorageRetry;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Repository for day-compacted indicator values using R2DBC.
 * The stored values are only ever created or appended to by the database itself.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class IndicatorValueCompactRepository {
    private final DatabaseClient databaseClient;
    private final StorageDialect dialect;
    private final StorageRetry storageRetry;

    public static final BiFunction<Row, RowMetadata, IndicatorValueCompact> MAPPING_FUNCTION = (row, rowMetaData) -> new IndicatorValueCompact(
            row.get("timebucket", LocalDateTime.class),
            row.get("compact_values", String.class),
            row.get("indicator_id", Number.class).intValue()
    );

    private static final String SELECT_COLUMNS = """
            SELECT timebucket,
                   "values" AS compact_values,
                   indicator_id
              FROM indicatorvaluecompact
            """;

    /**
     * Creates the bucket with {@code segment} or appends {@code segment} to its stored values,
     * as one statement executed by the database.
     *
     * @return number of rows affected.
     */
    public Mono<Long> append(LocalDateTime timebucket, Integer indicatorId, String segment) {
        log.debug("Appending {} chars to bucket {} of indicator {}", segment.length(), timebucket, indicatorId);
        Mono<Long> statement = databaseClient.sql(dialect.compactAppendSql())
                .bind("timebucket", timebucket)
                .bind("segment", segment)
                .bind("indicatorId", indicatorId)
                .fetch()
                .rowsUpdated();
        return storageRetry.apply(statement, "compact append " + timebucket.toLocalDate() + "/" + indicatorId);
    }

    public Mono<IndicatorValueCompact> findByKey(LocalDateTime timebucket, Integer indicatorId) {
        String sql = SELECT_COLUMNS + " WHERE timebucket = :timebucket AND indicator_id = :indicatorId";
        return databaseClient.sql(sql)
                .bind("timebucket", timebucket)
                .bind("indicatorId", indicatorId)
                .map(MAPPING_FUNCTION)
                .one();
    }

    /**
     * Buckets of the given indicators whose day overlaps {@code [startTime, endTime]}.
     */
    public Flux<IndicatorValueCompact> findByIdsAndTimeRange(List<Integer> ids, LocalDateTime startTime, LocalDateTime endTime) {
        if (ids == null || ids.isEmpty()) {
            return Flux.empty();
        }
        String inClause = IntStream.range(0, ids.size())
                .mapToObj(i -> ":id_" + i)
                .collect(Collectors.joining(", "));
        String sql = SELECT_COLUMNS + String.format("""
                 WHERE indicator_id IN (%s)
                   AND timebucket >= :startDay
                   AND timebucket <= :endTime
                 ORDER BY indicator_id, timebucket ASC
                """, inClause);
        log.debug("Executing SQL query with bindings: {}", sql);

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(sql);
        for (int i = 0; i < ids.size(); i++) {
            spec = spec.bind("id_" + i, ids.get(i));
        }
        spec = spec.bind("startDay", BucketKeys.day(startTime));
        spec = spec.bind("endTime", endTime);

        return spec.map(MAPPING_FUNCTION).all();
    }
}
