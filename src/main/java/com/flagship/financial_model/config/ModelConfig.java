package com.flagship.financial_model.config;

import com.flagship.financial_model.validation.ValidationTolerance;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Beans shared by validation and model generation.
 */
@Configuration
public class ModelConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ValidationTolerance validationTolerance(
            @Value("${financial-model.tolerance.absolute:0.01}") BigDecimal absolute,
            @Value("${financial-model.tolerance.relative:0.0001}") BigDecimal relative) {
        return new ValidationTolerance(absolute, relative);
    }
}
