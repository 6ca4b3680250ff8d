package org.waabox.chorus.spring;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.chorus.Chorus;
import org.waabox.chorus.feed.ChangeFeed;
import org.waabox.chorus.health.HealthProbe;
import org.waabox.chorus.metrics.ChorusMetrics;
import org.waabox.chorus.schedule.TaskScheduler;

/**
 * Spring Boot auto-configuration for the Chorus synchronization layer.
 *
 * <p>Creates a singleton {@link Chorus} from {@link ChorusProperties},
 * wiring the optional {@link ChangeFeed}, {@link HealthProbe},
 * {@link ChorusMetrics} and {@link TaskScheduler} beans. Without a
 * change-feed bean, local writes still fan out but no backend change is
 * observed.
 *
 * <p>The start/shutdown lifecycle runs through a {@link SmartLifecycle}
 * that starts late and stops early.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(ChorusProperties.class)
public class ChorusAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ChorusAutoConfiguration.class);

  /**
   * Creates the singleton {@link Chorus} bean.
   *
   * @param properties          the configuration properties, never null
   * @param changeFeedProvider  provider for an optional ChangeFeed bean
   * @param healthProbeProvider provider for an optional HealthProbe bean
   * @param metricsProvider     provider for an optional ChorusMetrics bean
   * @param schedulerProvider   provider for an optional TaskScheduler bean
   * @param registrars          the resource registrars, may be empty
   *
   * @return the configured instance, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public Chorus chorus(
      final ChorusProperties properties,
      final ObjectProvider<ChangeFeed> changeFeedProvider,
      final ObjectProvider<HealthProbe> healthProbeProvider,
      final ObjectProvider<ChorusMetrics> metricsProvider,
      final ObjectProvider<TaskScheduler> schedulerProvider,
      final List<ResourceRegistrar> registrars) {

    requireAtMostOne(changeFeedProvider, ChangeFeed.class);
    requireAtMostOne(healthProbeProvider, HealthProbe.class);

    final Chorus.Builder builder = Chorus.builder()
        .resources(properties.getResources())
        .settleDelay(properties.getSettleDelay())
        .healthCheckInterval(properties.getHealthCheckInterval())
        .feedBackoff(properties.getFeedBackoff().toPolicy())
        .refreshBackoff(properties.getRefreshBackoff().toPolicy())
        .actionLogCapacity(properties.getActionLogCapacity());

    changeFeedProvider.ifAvailable(feed -> {
      builder.changeFeed(feed);
      log.info("Chorus using ChangeFeed: {}",
          feed.getClass().getSimpleName());
    });

    healthProbeProvider.ifAvailable(probe -> {
      builder.healthProbe(probe);
      log.info("Chorus monitoring backend health every {}",
          properties.getHealthCheckInterval());
    });

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Chorus using custom ChorusMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    schedulerProvider.ifAvailable(builder::scheduler);

    for (final ResourceRegistrar registrar : registrars) {
      registrar.register(builder);
      log.debug("Invoked ResourceRegistrar: {}",
          registrar.getClass().getSimpleName());
    }

    return builder.build();
  }

  /**
   * Creates the {@link SmartLifecycle} that starts and shuts down the
   * Chorus instance.
   *
   * @param chorus the instance to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle chorusLifecycle(final Chorus chorus) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting Chorus lifecycle...");
        chorus.start();
        running = true;
      }

      @Override
      public void stop() {
        log.info("Stopping Chorus lifecycle...");
        chorus.shutdown();
        running = false;
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }

  /**
   * Validates that at most one bean of the given type is present.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "Chorus requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}
