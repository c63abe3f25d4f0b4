package reconciler.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import reconciler.micrometer.MicrometerMetricsExporter;
import reconciler.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code reconciler.metrics.enabled} is true (default). Needs a {@link MeterRegistry}
 * bean; set the property to false in applications without one.
 *
 * <p>Runs before {@link ReconcilerAutoConfiguration} so the exporter is picked up by
 * the reconciler.
 */
@AutoConfiguration(before = ReconcilerAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "reconciler.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(ReconcilerProperties.class)
public class ReconcilerMicrometerAutoConfiguration {

  // Reconciler.close() closes the exporter and removes its meters.
  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, ReconcilerProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
