package com.samsung.ees.infra.sli.repository;

import com.samsung.ees.infra.sli.config.StorageDialect;
import com.samsung.ees.infra.sli.exception.InvalidSampleException;
import com.samsung.ees.infra.sli.model.IndicatorValue;
import com.samsung.ees.infra.sli.util.TestDatabase;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IndicatorValueRepositoryTest {

    private static final LocalDateTime TS = LocalDateTime.of(2024, 1, 1, 10, 15);

    private static DatabaseClient databaseClient;

    private IndicatorValueRepository valueRepository;

    @BeforeAll
    static void createDatabase() {
        databaseClient = TestDatabase.h2("raw-values");
    }

    @BeforeEach
    void setUp() {
        TestDatabase.clear(databaseClient);
        valueRepository = new IndicatorValueRepository(databaseClient, StorageDialect.H2, TestDatabase.fastRetry());
    }

    @Test
    void upsert_onSameKey_shouldReplaceValue() {
        StepVerifier.create(valueRepository.upsert(new IndicatorValue(TS, new BigDecimal("1.5"), 7)))
                .expectNext(1L)
                .verifyComplete();
        StepVerifier.create(valueRepository.upsert(new IndicatorValue(TS, new BigDecimal("8.25"), 7)))
                .expectNext(1L)
                .verifyComplete();

        IndicatorValue stored = valueRepository.findByKey(TS, 7).block();
        assertNotNull(stored);
        assertEquals(0, new BigDecimal("8.25").compareTo(stored.getValue()));
        assertEquals(1, valueRepository.findByIdsAndTimeRange(List.of(7), TS, TS).collectList().block().size());
    }

    @Test
    void upsert_shouldStoreValueWithoutFloorOrRounding() {
        valueRepository.upsert(new IndicatorValue(TS, new BigDecimal("0.00012345"), 7)).block();

        IndicatorValue stored = valueRepository.findByKey(TS, 7).block();
        assertNotNull(stored);
        assertEquals(0, new BigDecimal("0.00012345").compareTo(stored.getValue()));
    }

    @Test
    void upsert_withMissingFields_shouldRejectBeforeStorage() {
        StepVerifier.create(valueRepository.upsert(new IndicatorValue(null, BigDecimal.ONE, 7)))
                .expectError(InvalidSampleException.class)
                .verify();
        StepVerifier.create(valueRepository.upsert(new IndicatorValue(TS, null, 7)))
                .expectError(InvalidSampleException.class)
                .verify();
        StepVerifier.create(valueRepository.upsert(new IndicatorValue(TS, BigDecimal.ONE, null)))
                .expectError(InvalidSampleException.class)
                .verify();
    }

    @Test
    void findByIdsAndTimeRange_shouldOrderByIndicatorThenTimestamp() {
        valueRepository.upsert(new IndicatorValue(TS.plusMinutes(1), new BigDecimal("2"), 2)).block();
        valueRepository.upsert(new IndicatorValue(TS, new BigDecimal("1"), 2)).block();
        valueRepository.upsert(new IndicatorValue(TS, new BigDecimal("3"), 1)).block();
        valueRepository.upsert(new IndicatorValue(TS.plusHours(2), new BigDecimal("4"), 1)).block();

        List<IndicatorValue> values = valueRepository.findByIdsAndTimeRange(List.of(1, 2), TS, TS.plusHours(1))
                .collectList()
                .block();

        assertNotNull(values);
        assertEquals(3, values.size());
        assertEquals(1, values.get(0).getIndicatorId());
        assertEquals(TS, values.get(1).getTimestamp());
        assertEquals(2, values.get(1).getIndicatorId());
        assertEquals(TS.plusMinutes(1), values.get(2).getTimestamp());
    }
}
