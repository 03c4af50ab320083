package com.samsung.ees.infra.sli.util;

import com.samsung.ees.infra.sli.exception.TransientStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff around a single storage statement.
 * <p>
 * Transient data access failures, connection failures and key conflicts raised while two writers race on
 * the same row are retried. Once the retries are used up the failure surfaces as {@link TransientStorageException}.
 * Every other error is propagated on the first occurrence.
 */
@Slf4j
public class StorageRetry {

    private final long maxRetries;
    private final Duration minBackoff;
    private final Duration maxBackoff;

    public StorageRetry(long maxRetries, Duration minBackoff, Duration maxBackoff) {
        this.maxRetries = maxRetries;
        this.minBackoff = minBackoff;
        this.maxBackoff = maxBackoff;
    }

    /**
     * @param statement   a lazy statement; each subscription must execute it again.
     * @param description short text naming the statement in log and error messages.
     */
    public <T> Mono<T> apply(Mono<T> statement, String description) {
        return statement.retryWhen(Retry.backoff(maxRetries, minBackoff)
                .maxBackoff(maxBackoff)
                .filter(StorageRetry::isRetryable)
                .doBeforeRetry(signal -> log.warn("Retrying {} (attempt {}/{}) after: {}",
                        description, signal.totalRetries() + 1, maxRetries, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> {
                    log.error("Giving up on {} after {} retries", description, signal.totalRetries());
                    return new TransientStorageException("Storage retries exhausted for " + description, signal.failure());
                }));
    }

    public static boolean isRetryable(Throwable error) {
        return error instanceof TransientDataAccessException
                || error instanceof DataAccessResourceFailureException
                || error instanceof DuplicateKeyException;
    }
}
