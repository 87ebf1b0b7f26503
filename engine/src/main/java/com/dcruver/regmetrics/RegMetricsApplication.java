package com.dcruver.regmetrics;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Converts bulk regulatory markup into an indexed section store and computes
 * historical text metrics per document.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class RegMetricsApplication {

    public static void main(String[] args) {
        log.info("Starting RegMetrics...");
        SpringApplication.run(RegMetricsApplication.class, args);
    }
}
