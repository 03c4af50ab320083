package com.samsung.ees.infra.sli;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the indicator value store.
 */
@SpringBootApplication
public class IndicatorValueStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(IndicatorValueStoreApplication.class, args);
    }

}
