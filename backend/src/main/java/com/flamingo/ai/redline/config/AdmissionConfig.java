package com.flamingo.ai.redline.config;

import com.flamingo.ai.redline.service.admission.AdmissionController;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedBulkheadMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the document-session admission gate and exposes its gauges. */
@Configuration
@Slf4j
public class AdmissionConfig {

  static final String BULKHEAD_NAME = "documentSessions";

  @Bean
  public BulkheadRegistry bulkheadRegistry(RedlineConfig config, MeterRegistry meterRegistry) {
    RedlineConfig.Admission admission = config.getAdmission();
    if (admission.getMaxConcurrentSessions() < 1) {
      throw new IllegalStateException("redline.admission.max-concurrent-sessions must be >= 1");
    }

    BulkheadRegistry registry =
        BulkheadRegistry.of(
            BulkheadConfig.custom()
                .maxConcurrentCalls(admission.getMaxConcurrentSessions())
                .maxWaitDuration(admission.getAcquireTimeout())
                .fairCallHandlingStrategyEnabled(true)
                .build());
    TaggedBulkheadMetrics.ofBulkheadRegistry(registry).bindTo(meterRegistry);
    return registry;
  }

  @Bean
  public AdmissionController admissionController(BulkheadRegistry bulkheadRegistry) {
    AdmissionController controller =
        new AdmissionController(bulkheadRegistry.bulkhead(BULKHEAD_NAME));
    log.info("Document concurrency limiter initialized (maxConcurrency={})", controller.capacity());
    return controller;
  }
}
