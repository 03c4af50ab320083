package com.samsung.ees.infra.sli.service;

import com.samsung.ees.infra.sli.codec.ValueCodec;
import com.samsung.ees.infra.sli.exception.InvalidSampleException;
import com.samsung.ees.infra.sli.model.IndicatorValue;
import com.samsung.ees.infra.sli.model.IndicatorValueCompact;
import com.samsung.ees.infra.sli.model.ValueUnit;
import com.samsung.ees.infra.sli.repository.IndicatorValueCompactRepository;
import com.samsung.ees.infra.sli.util.BucketKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service that stores batches of indicator samples as day buckets and reads them back as raw values.
 * <p>
 * A batch is split by calendar day and each day becomes one append of an encoded segment. Appending the
 * same samples twice stores them twice; duplicates are resolved when decoding, where the entry stored
 * last wins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndicatorValueCompactService {
    private final IndicatorValueCompactRepository compactRepository;
    private final ValueCodec valueCodec;

    /**
     * Groups samples by day, keeping the iteration order of {@code results} within each day.
     * Values are floored and rounded on the way.
     *
     * @throws InvalidSampleException for a null timestamp or a null or non-finite value.
     */
    public Map<LocalDateTime, List<ValueUnit>> toBuckets(Map<LocalDateTime, Double> results) {
        if (results == null) {
            throw new InvalidSampleException("Sample batch cannot be null.");
        }
        Map<LocalDateTime, List<ValueUnit>> buckets = new LinkedHashMap<>();
        for (Map.Entry<LocalDateTime, Double> entry : results.entrySet()) {
            LocalDateTime timestamp = entry.getKey();
            if (timestamp == null) {
                throw new InvalidSampleException("Sample timestamp cannot be null.");
            }
            BigDecimal value = valueCodec.clampAndRound(ValueCodec.toDecimal(entry.getValue()));
            buckets.computeIfAbsent(BucketKeys.day(timestamp), day -> new ArrayList<>())
                    .add(new ValueUnit(BucketKeys.offset(timestamp), value));
        }
        return buckets;
    }

    /**
     * Appends the samples of one indicator to its day buckets, one statement per day.
     * The whole batch is validated before the first statement is issued.
     *
     * @return number of day buckets written.
     */
    public Mono<Long> update(Integer indicatorId, Map<LocalDateTime, Double> results) {
        return Mono.fromCallable(() -> {
                    if (indicatorId == null) {
                        throw new InvalidSampleException("indicatorId cannot be null.");
                    }
                    return toBuckets(results);
                })
                .flatMapMany(buckets -> Flux.fromIterable(buckets.entrySet()))
                .concatMap(bucket -> compactRepository.append(bucket.getKey(), indicatorId, valueCodec.encode(bucket.getValue())))
                .count()
                .doOnSuccess(count -> log.debug("Stored {} samples of indicator {} in {} day buckets",
                        results.size(), indicatorId, count))
                .doOnError(e -> log.warn("Failed to store samples of indicator {}: {}", indicatorId, e.getMessage()));
    }

    /**
     * Expands a bucket into one raw value per distinct minute. Order is unspecified.
     */
    public List<IndicatorValue> decode(IndicatorValueCompact bucket) {
        Map<LocalDateTime, BigDecimal> values = valueCodec.decode(bucket.getTimebucket(), bucket.getValues());
        List<IndicatorValue> indicatorValues = new ArrayList<>(values.size());
        values.forEach((timestamp, value) -> indicatorValues.add(new IndicatorValue(timestamp, value, bucket.getIndicatorId())));
        return indicatorValues;
    }

    /**
     * Decoded values of one indicator within {@code [startTime, endTime]}, sorted by timestamp.
     */
    public Flux<IndicatorValue> findValues(Integer indicatorId, LocalDateTime startTime, LocalDateTime endTime) {
        if (startTime.isAfter(endTime)) {
            return Flux.error(new IllegalArgumentException("Invalid date range: startTime cannot be after endTime."));
        }
        return compactRepository.findByIdsAndTimeRange(List.of(indicatorId), startTime, endTime)
                .concatMapIterable(this::decode)
                .filter(value -> !value.getTimestamp().isBefore(startTime) && !value.getTimestamp().isAfter(endTime))
                .sort(Comparator.comparing(IndicatorValue::getTimestamp));
    }
}
