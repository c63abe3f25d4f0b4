package reconciler.spring.boot;

import reconciler.ConfigurationException;
import reconciler.Reconciler;
import reconciler.command.CommandHandler;
import reconciler.spi.EventStore;
import reconciler.spi.MetricsExporter;
import reconciler.spi.Notifier;
import reconciler.spi.ResourceControl;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the deletion reconciler.
 *
 * <p>Builds a {@link Reconciler} from the application's {@link EventStore},
 * {@link ResourceControl} and {@link Notifier} beans and {@link ReconcilerProperties},
 * starts it with the context and closes it on shutdown. A missing collaborator bean
 * fails startup with a {@link ConfigurationException}.
 *
 * @see ReconcilerProperties
 * @see ReconcilerMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Reconciler.class)
@ConditionalOnProperty(prefix = "reconciler", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(ReconcilerProperties.class)
public class ReconcilerAutoConfiguration {

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  public Reconciler reconciler(ReconcilerProperties props,
      ObjectProvider<EventStore> eventStoreProvider,
      ObjectProvider<ResourceControl> resourceControlProvider,
      ObjectProvider<Notifier> notifierProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var loop = props.getLoop();
    var builder = Reconciler.builder()
        .eventStore(require(eventStoreProvider, EventStore.class))
        .resourceControl(require(resourceControlProvider, ResourceControl.class))
        .notifier(require(notifierProvider, Notifier.class))
        .checkInterval(loop.getCheckInterval())
        .retryDelay(loop.getRetryDelay())
        .gracePeriod(loop.getGracePeriod())
        .callTimeout(loop.getCallTimeout())
        .failureNotifyThreshold(loop.getFailureNotifyThreshold())
        .reminderWindow(props.getIntent().getReminderWindow())
        .deletionDelay(props.getIntent().getDeletionDelay())
        .broadcastChannel(props.getNotify().getBroadcastChannel())
        .confirmationMaxAge(props.getConfirmation().getMaxAge())
        .cleanupInterval(props.getConfirmation().getCleanupInterval());

    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public CommandHandler reconcilerCommandHandler(Reconciler reconciler) {
    return reconciler.commands();
  }

  private static <T> T require(ObjectProvider<T> provider, Class<T> type) {
    T bean = provider.getIfUnique();
    if (bean == null) {
      throw new ConfigurationException("Exactly one " + type.getSimpleName()
          + " bean is required by the reconciler");
    }
    return bean;
  }
}
