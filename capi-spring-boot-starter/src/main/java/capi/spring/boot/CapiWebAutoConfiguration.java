package capi.spring.boot;

import capi.diagnostics.EventDiagnostics;
import capi.failed.FailedEventManager;
import capi.health.HealthTracker;
import capi.processor.OutboxProcessor;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.bind.annotation.RestController;

/**
 * Registers {@link CapiOutboxController} in servlet web applications.
 *
 * <p>Disabled with {@code capi.trigger.enabled=false}.
 */
@AutoConfiguration(after = CapiAutoConfiguration.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass(RestController.class)
@ConditionalOnBean(OutboxProcessor.class)
@ConditionalOnProperty(prefix = "capi.trigger", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(CapiProperties.class)
public class CapiWebAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public TriggerAuthorizer triggerAuthorizer(CapiProperties props) {
    return TriggerAuthorizer.from(props.getTrigger());
  }

  @Bean
  @ConditionalOnMissingBean
  public CapiOutboxController capiOutboxController(OutboxProcessor processor, HealthTracker healthTracker,
      EventDiagnostics diagnostics, FailedEventManager failedEvents, TriggerAuthorizer authorizer) {
    return new CapiOutboxController(processor, healthTracker, diagnostics, failedEvents, authorizer);
  }
}
