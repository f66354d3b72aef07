package capi.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapiPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(CapiProperties.class);
            assertEquals("capi_conversion_event", props.getTableName());
            assertEquals(50, props.getOutbox().getBatchSize());
            assertEquals(5, props.getOutbox().getMaxAttempts());
            assertEquals(Duration.ofMinutes(10), props.getOutbox().getLeaseTimeout());
            assertEquals(4, props.getOutbox().getTenantParallelism());
            assertEquals(2, props.getOutbox().getPerTenantConcurrency());
            assertEquals(Duration.ofMinutes(5), props.getRetry().getBaseDelay());
            assertEquals(Duration.ofMinutes(60), props.getRetry().getMaxDelay());
            assertEquals("https://graph.facebook.com", props.getEndpoint().getBaseUrl());
            assertEquals("v22.0", props.getEndpoint().getApiVersion());
            assertEquals("meta_capi", props.getCredentials().getPlatform());
            assertEquals("", props.getCredentials().getFallbackToken());
            assertEquals(List.of("em", "ph", "zp", "country", "external_id", "fbp", "fbc"),
                    props.getPrivacy().getConservative());
            assertTrue(props.getPrivacy().getStandard().containsAll(List.of("fn", "ln", "ct", "st")));
            assertTrue(props.getPrivacy().getBlocked().contains("employer"));
            assertTrue(props.getTrigger().isEnabled());
            assertEquals("", props.getTrigger().getAdminToken());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("capi", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "capi.table-name=tenant_conversions",
                "capi.outbox.batch-size=20",
                "capi.outbox.max-attempts=3",
                "capi.outbox.lease-timeout=PT2M",
                "capi.outbox.instance-id=worker-1",
                "capi.retry.base-delay=PT1M",
                "capi.retry.max-delay=PT30M",
                "capi.endpoint.base-url=http://localhost:9999",
                "capi.endpoint.read-timeout=PT10S",
                "capi.credentials.fallback-token=global",
                "capi.privacy.conservative=em,ph",
                "capi.privacy.default-country=ca",
                "capi.trigger.scheduler-token=cron",
                "capi.trigger.admin-token=admin",
                "capi.metrics.enabled=false",
                "capi.metrics.name-prefix=donations.capi"
        ).run(ctx -> {
            var props = ctx.getBean(CapiProperties.class);
            assertEquals("tenant_conversions", props.getTableName());
            assertEquals(20, props.getOutbox().getBatchSize());
            assertEquals(3, props.getOutbox().getMaxAttempts());
            assertEquals(Duration.ofMinutes(2), props.getOutbox().getLeaseTimeout());
            assertEquals("worker-1", props.getOutbox().getInstanceId());
            assertEquals(Duration.ofMinutes(1), props.getRetry().getBaseDelay());
            assertEquals(Duration.ofMinutes(30), props.getRetry().getMaxDelay());
            assertEquals("http://localhost:9999", props.getEndpoint().getBaseUrl());
            assertEquals(Duration.ofSeconds(10), props.getEndpoint().getReadTimeout());
            assertEquals("global", props.getCredentials().getFallbackToken());
            assertEquals(List.of("em", "ph"), props.getPrivacy().getConservative());
            assertEquals("ca", props.getPrivacy().getDefaultCountry());
            assertEquals("cron", props.getTrigger().getSchedulerToken());
            assertEquals("admin", props.getTrigger().getAdminToken());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("donations.capi", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(CapiProperties.class)
    static class PropsConfig {
    }
}
