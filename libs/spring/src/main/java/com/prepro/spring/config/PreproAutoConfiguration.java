package com.prepro.spring.config;

import com.prepro.observability.MediationMetrics;
import com.prepro.presentation.DateTimeFormats;
import com.prepro.presentation.DefaultViewContext;
import com.prepro.spring.web.MediationExceptionHandler;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Registers the beans an application needs to build mediators: a view context rendering in
 * the configured zone, mediation metrics bound to the application's {@link MeterRegistry},
 * and the problem-detail mapping of mediation errors.
 */
@AutoConfiguration(after = {MetricsAutoConfiguration.class, CompositeMeterRegistryAutoConfiguration.class})
@EnableConfigurationProperties(PreproProperties.class)
public class PreproAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PreproAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock preproClock(PreproProperties properties) {
        return Clock.system(properties.zoneId());
    }

    @Bean
    @ConditionalOnMissingBean
    public DefaultViewContext preproViewContext(Clock preproClock, PreproProperties properties) {
        DateTimeFormats formats = DateTimeFormats.defaults().withAll(properties.formats());
        log.info("Rendering presented records in {} with formats {}", preproClock.getZone(), formats.names());
        return new DefaultViewContext(preproClock, formats);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    public MediationMetrics mediationMetrics(MeterRegistry registry, PreproProperties properties) {
        return new MediationMetrics(registry, properties.serviceName());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    public MediationExceptionHandler mediationExceptionHandler() {
        return new MediationExceptionHandler();
    }
}
