package com.koni.vitals.infrastructure.config;

import com.koni.vitals.domain.model.AlertSeverity;
import com.koni.vitals.domain.service.AlertPolicy;
import com.koni.vitals.domain.service.ReadingValidator;
import com.koni.vitals.domain.service.RuleClassifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Registers the framework-free domain services as beans.
 */
@Configuration
public class DomainServiceConfiguration {

    @Bean
    public ReadingValidator readingValidator() {
        return new ReadingValidator();
    }

    @Bean
    public RuleClassifier ruleClassifier() {
        return new RuleClassifier();
    }

    @Bean
    public AlertPolicy alertPolicy(@Value("${vitals.alerts.minimum-severity:WARNING}") AlertSeverity minimumSeverity) {
        return new AlertPolicy(minimumSeverity);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
