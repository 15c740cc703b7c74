package com.example.intake.observability.config;

import com.example.intake.config.IntakeProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.config.MeterFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ObservabilityConfig {

    /**
     * Registry source names come from configuration, so their tag is capped.
     */
    static final int MAX_SOURCE_TAG_VALUES = 10;

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> intakeCommonTags(
            @Value("${spring.application.name:intake}") String applicationName,
            IntakeProperties properties) {
        return registry -> registry.config()
                .commonTags(Tags.of("application", applicationName, "store", properties.getStorage().getStore()));
    }

    @Bean
    public MeterFilter registrySourceTagLimit() {
        return MeterFilter.maximumAllowableTags("intake.registry", "source", MAX_SOURCE_TAG_VALUES, MeterFilter.deny());
    }
}
