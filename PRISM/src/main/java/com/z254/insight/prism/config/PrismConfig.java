package com.z254.insight.prism.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Compiles the bound {@code prism.*} properties once at startup. A malformed configuration
 * fails the context before any record is read.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PrismProperties.class)
public class PrismConfig {

    @Bean
    public PipelineConfiguration pipelineConfiguration(PrismProperties properties) {
        PipelineConfiguration configuration = PipelineConfiguration.from(properties);
        log.info("PRISM configuration loaded: {} app patterns, {} customer rules, {} root-cause rules, "
                        + "{} holiday ranges, {} tables, max-records={}",
                configuration.getAppRules().size(),
                configuration.getCustomerRules().size(),
                configuration.getRootCauseRules().size(),
                configuration.getHolidayCalendar().getRanges().size(),
                configuration.getTables().size(),
                configuration.getMaxRecords());
        return configuration;
    }
}
