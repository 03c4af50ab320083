package com.samsung.ees.infra.sli.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Creates the value tables from {@code schema/<dialect>.sql} when {@code sli.storage.initialize-schema} is set.
 * The H2 and PostgreSQL scripts are re-runnable; the Oracle script expects an empty schema.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "sli.storage", name = "initialize-schema", havingValue = "true")
public class SchemaInitializer implements CommandLineRunner {

    private final DatabaseClient databaseClient;
    private final StorageDialect dialect;

    public SchemaInitializer(DatabaseClient databaseClient, StorageDialect dialect) {
        this.databaseClient = databaseClient;
        this.dialect = dialect;
    }

    @Override
    public void run(String... args) {
        // Writers must not start before the tables exist, so block here.
        initialize().block();
    }

    public Mono<Void> initialize() {
        List<String> statements = loadStatements(dialect.schemaLocation());
        return Flux.fromIterable(statements)
                .concatMap(sql -> {
                    log.debug("Executing schema statement: {}", sql);
                    return databaseClient.sql(sql).then();
                })
                .then()
                .doOnSubscribe(s -> log.info("Applying {} schema from {}", dialect, dialect.schemaLocation()))
                .doOnSuccess(v -> log.info("Schema initialization completed successfully."))
                .doOnError(e -> log.error("Error during schema initialization", e));
    }

    static List<String> loadStatements(String location) {
        try (InputStream schemaStream = SchemaInitializer.class.getResourceAsStream(location)) {
            if (schemaStream == null) {
                throw new IOException("Cannot find schema file: " + location);
            }
            String script = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
            return Arrays.stream(script.split(";"))
                    .map(String::trim)
                    .filter(sql -> !sql.isEmpty())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load schema " + location, e);
        }
    }
}
