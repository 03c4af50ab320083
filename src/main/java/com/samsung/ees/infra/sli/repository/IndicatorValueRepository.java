package com.samsung.ees.infra.sli.repository;

import com.samsung.ees.infra.sli.config.StorageDialect;
import com.samsung.ees.infra.sli.exception.InvalidSampleException;
import com.samsung.ees.infra.sli.model.IndicatorValue;
import com.samsung.ees.infra.sli.util.StorageRetry;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Repository for raw indicator values, one row per (timestamp, indicator), using R2DBC.
 * Values are stored exactly as given; no floor or rounding is applied.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class IndicatorValueRepository {
    private final DatabaseClient databaseClient;
    private final StorageDialect dialect;
    private final StorageRetry storageRetry;

    public static final BiFunction<Row, RowMetadata, IndicatorValue> MAPPING_FUNCTION = (row, rowMetaData) -> new IndicatorValue(
            row.get("ts", LocalDateTime.class),
            row.get("val", BigDecimal.class),
            row.get("indicator_id", Number.class).intValue()
    );

    /**
     * Inserts the value or replaces the value already stored for its (timestamp, indicator).
     *
     * @return number of rows affected.
     */
    public Mono<Long> upsert(IndicatorValue indicatorValue) {
        if (indicatorValue == null || indicatorValue.getTimestamp() == null
                || indicatorValue.getValue() == null || indicatorValue.getIndicatorId() == null) {
            return Mono.error(new InvalidSampleException("Indicator value requires timestamp, value and indicatorId: " + indicatorValue));
        }
        Mono<Long> statement = databaseClient.sql(dialect.rawUpsertSql())
                .bind("timestamp", indicatorValue.getTimestamp())
                .bind("value", indicatorValue.getValue())
                .bind("indicatorId", indicatorValue.getIndicatorId())
                .fetch()
                .rowsUpdated();
        return storageRetry.apply(statement, "raw upsert " + indicatorValue.getTimestamp() + "/" + indicatorValue.getIndicatorId());
    }

    public Mono<IndicatorValue> findByKey(LocalDateTime timestamp, Integer indicatorId) {
        return databaseClient.sql("""
                        SELECT "timestamp" AS ts, "value" AS val, indicator_id
                          FROM indicatorvalue
                         WHERE "timestamp" = :timestamp AND indicator_id = :indicatorId
                        """)
                .bind("timestamp", timestamp)
                .bind("indicatorId", indicatorId)
                .map(MAPPING_FUNCTION)
                .one();
    }

    public Flux<IndicatorValue> findByIdsAndTimeRange(List<Integer> ids, LocalDateTime startTime, LocalDateTime endTime) {
        if (ids == null || ids.isEmpty()) {
            return Flux.empty();
        }
        String inClause = IntStream.range(0, ids.size())
                .mapToObj(i -> ":id_" + i)
                .collect(Collectors.joining(", "));
        String sql = String.format("""
                SELECT "timestamp" AS ts, "value" AS val, indicator_id
                  FROM indicatorvalue
                 WHERE indicator_id IN (%s)
                   AND "timestamp" >= :startTime
                   AND "timestamp" <= :endTime
                 ORDER BY indicator_id, "timestamp" ASC
                """, inClause);
        log.debug("Executing SQL query with bindings: {}", sql);

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(sql);
        for (int i = 0; i < ids.size(); i++) {
            spec = spec.bind("id_" + i, ids.get(i));
        }
        spec = spec.bind("startTime", startTime);
        spec = spec.bind("endTime", endTime);

        return spec.map(MAPPING_FUNCTION).all();
    }
}
