package com.samsung.ees.infra.sli.config;

import com.samsung.ees.infra.sli.codec.ValueCodec;
import com.samsung.ees.infra.sli.util.StorageRetry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(IndicatorValueProperties.class)
public class ValueStoreConfig {

    @Bean
    public ValueCodec valueCodec(IndicatorValueProperties properties) {
        log.info("Compacted values use min-value {}", properties.getValues().getMinValue());
        return new ValueCodec(properties.getValues().getMinValue());
    }

    @Bean
    public StorageDialect storageDialect(IndicatorValueProperties properties) {
        log.info("Using {} storage dialect", properties.getStorage().getDialect());
        return properties.getStorage().getDialect();
    }

    @Bean
    public StorageRetry storageRetry(IndicatorValueProperties properties) {
        IndicatorValueProperties.RetrySettings retry = properties.getStorage().getRetry();
        return new StorageRetry(retry.getMaxRetries(), retry.getMinBackoff(), retry.getMaxBackoff());
    }
}
