package com.prepro.spring.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.prepro.observability.MediationMetrics;
import com.prepro.presentation.DefaultViewContext;
import com.prepro.spring.web.MediationExceptionHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;

@DisplayName("PreproAutoConfiguration")
class PreproAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PreproAutoConfiguration.class));

    @Test
    @DisplayName("renders in the configured zone with the configured formats")
    void viewContext() {
        runner.withPropertyValues("prepro.time-zone=Asia/Tokyo", "prepro.formats.month=MMMM yyyy")
                .run(context -> {
                    DefaultViewContext view = context.getBean(DefaultViewContext.class);

                    assertThat(view.clock().getZone()).isEqualTo(ZoneId.of("Asia/Tokyo"));
                    assertThat(view.format(Instant.parse("2024-06-30T20:00:00Z"), "month")).isEqualTo("July 2024");
                    assertThat(view.formats().names()).contains("db", "full_date_and_time");
                });
    }

    @Test
    @DisplayName("binds metrics to the registry with the service name")
    void metrics() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues("prepro.service-name=blog")
                .run(context -> {
                    MediationMetrics metrics = context.getBean(MediationMetrics.class);

                    assertThat(metrics.serviceName()).isEqualTo("blog");
                    assertThat(metrics.registry()).isSameAs(context.getBean(MeterRegistry.class));
                });
    }

    @Test
    @DisplayName("registers no metrics without a registry")
    void noRegistry() {
        runner.run(context -> assertThat(context).doesNotHaveBean(MediationMetrics.class));
    }

    @Test
    @DisplayName("registers the exception handler in servlet applications only")
    void exceptionHandler() {
        runner.run(context -> assertThat(context).doesNotHaveBean(MediationExceptionHandler.class));
        new WebApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(PreproAutoConfiguration.class))
                .run(context -> assertThat(context).hasSingleBean(MediationExceptionHandler.class));
    }

    @Test
    @DisplayName("defaults a blank service name")
    void defaultsServiceName() {
        runner.withPropertyValues("prepro.service-name=").run(context ->
                assertThat(context.getBean(PreproProperties.class).serviceName()).isEqualTo("prepro"));
    }
}
