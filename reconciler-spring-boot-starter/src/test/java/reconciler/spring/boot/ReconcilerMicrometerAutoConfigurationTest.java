package reconciler.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reconciler.Reconciler;
import reconciler.micrometer.MicrometerMetricsExporter;
import reconciler.spi.MetricsExporter;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconcilerMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(ReconcilerMicrometerAutoConfiguration.class))
      .withUserConfiguration(MeterRegistryConfig.class);

  @Test
  void createsMicrometerExporterByDefault() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("micrometerMetricsExporter"));
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
    });
  }

  @Test
  void respectsCustomNamePrefix() {
    runner.withPropertyValues("reconciler.metrics.name-prefix=lab.reconciler").run(ctx -> {
      var registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("lab.reconciler.execute.deleted").counter());
    });
  }

  @Test
  void disabledWhenPropertyFalse() {
    runner.withPropertyValues("reconciler.metrics.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("micrometerMetricsExporter"));
    });
  }

  @Test
  void backsOffWhenCustomMetricsExporterPresent() {
    runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
      var exporter = ctx.getBean(MetricsExporter.class);
      assertFalse(exporter instanceof MicrometerMetricsExporter);
    });
  }

  @Test
  void enabledMetricsWithoutMeterRegistry_failStartup() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ReconcilerMicrometerAutoConfiguration.class))
        .run(ctx -> assertNotNull(ctx.getStartupFailure()));
  }

  @Test
  void disabledMetricsNeedNoMeterRegistry() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ReconcilerMicrometerAutoConfiguration.class))
        .withPropertyValues("reconciler.metrics.enabled=false")
        .run(ctx -> {
          assertNull(ctx.getStartupFailure());
          assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
  }

  @Test
  void reconcilerRecordsIntoRegistryAndRemovesMetersOnClose() {
    MeterRegistry[] registry = new MeterRegistry[1];
    runner.withConfiguration(AutoConfigurations.of(ReconcilerAutoConfiguration.class))
        .withUserConfiguration(CollaboratorConfig.class)
        .withPropertyValues("reconciler.loop.check-interval=PT1H")
        .run(ctx -> {
          registry[0] = ctx.getBean(MeterRegistry.class);
          ctx.getBean(Reconciler.class).loop().runOnce();
          assertNotNull(registry[0].find("reconciler.intents.open").gauge());
        });

    assertNull(registry[0].find("reconciler.intents.open").gauge());
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class CustomExporterConfig {
    @Bean
    MetricsExporter customMetricsExporter() {
      return MetricsExporter.NOOP;
    }
  }
}
