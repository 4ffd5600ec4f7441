package com.flamingo.ai.chainsearch.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  @Value("${spring.application.name:chain-search}")
  private String applicationName;

  /** Enables the @Timed annotation on pipeline and search methods. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every meter with the application name. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> commonTags() {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
