package org.waabox.chorus.spring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.chorus.Chorus;
import org.waabox.chorus.SubscriptionState;
import org.waabox.chorus.feed.ChangeFeed;
import org.waabox.chorus.feed.ChangeFeedHandle;
import org.waabox.chorus.feed.ChangeFeedListener;

/**
 * Tests for {@link ChorusAutoConfiguration}.
 *
 * <p>Uses {@link ApplicationContextRunner} for fast, isolated testing
 * of the auto-configuration without bootstrapping a full Spring Boot
 * application.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ChorusAutoConfigurationTest {

  /** The application context runner configured with the auto-configuration. */
  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(ChorusAutoConfiguration.class));

  @Test
  void whenContextLoads_givenNoConfiguration_shouldStartChorusWithDefaults() {
    runner.run(context -> {
      final Chorus chorus = context.getBean(Chorus.class);

      assertNotNull(chorus);
      assertTrue(chorus.isRunning());
      assertTrue(chorus.status().isEmpty());
      assertTrue(chorus.healthGate().isHealthy());
    });
  }

  @Test
  void whenContextLoads_givenResourcesProperty_shouldSubscribeInOrder() {
    runner.withPropertyValues("chorus.resources=members,events")
        .run(context -> {
          final Map<String, SubscriptionState> status =
              context.getBean(Chorus.class).status();

          assertEquals(List.of("members", "events"),
              List.copyOf(status.keySet()));
          assertEquals(SubscriptionState.ACTIVE, status.get("members"));
        });
  }

  @Test
  void whenContextLoads_givenResourceRegistrar_shouldAddItsResources() {
    runner.withPropertyValues("chorus.resources=members")
        .withUserConfiguration(TestRegistrarConfig.class)
        .run(context -> {
          final Chorus chorus = context.getBean(Chorus.class);

          assertEquals(List.of("members", "donations"),
              List.copyOf(chorus.status().keySet()));
        });
  }

  @Test
  void whenContextLoads_givenCustomChangeFeed_shouldOpenEveryResource() {
    runner.withPropertyValues("chorus.resources=members,events")
        .withUserConfiguration(TestChangeFeedConfig.class)
        .run(context -> {
          final RecordingChangeFeed feed =
              context.getBean(RecordingChangeFeed.class);

          assertEquals(List.of("members", "events"), feed.opened);
        });
  }

  @Test
  void whenContextLoads_givenTwoChangeFeeds_shouldFail() {
    runner.withUserConfiguration(TestChangeFeedConfig.class,
        SecondChangeFeedConfig.class)
        .run(context -> assertNotNull(context.getStartupFailure()));
  }

  @Test
  void whenContextLoads_givenInvalidBackoff_shouldFail() {
    runner.withPropertyValues("chorus.refresh-backoff.multiplier=0.5")
        .run(context -> assertNotNull(context.getStartupFailure()));
  }

  @Test
  void whenBindingProperties_givenBackoffSettings_shouldBuildPolicy() {
    runner.withPropertyValues(
        "chorus.feed-backoff.base-delay=250ms",
        "chorus.feed-backoff.multiplier=3",
        "chorus.feed-backoff.max-attempts=5",
        "chorus.settle-delay=2s",
        "chorus.action-log-capacity=10")
        .run(context -> {
          final ChorusProperties properties =
              context.getBean(ChorusProperties.class);

          assertEquals(Duration.ofMillis(250),
              properties.getFeedBackoff().getBaseDelay());
          assertEquals(5, properties.getFeedBackoff().toPolicy()
              .maxAttempts());
          assertEquals(Duration.ofSeconds(2),
              properties.getSettleDelay());
          assertEquals(10, properties.getActionLogCapacity());
        });
  }

  @Test
  void whenContextCloses_givenRunningChorus_shouldShutItDown() {
    final AtomicReference<Chorus> chorus = new AtomicReference<>();
    final AtomicReference<RecordingChangeFeed> feed = new AtomicReference<>();

    runner.withUserConfiguration(TestChangeFeedConfig.class)
        .run(context -> {
          chorus.set(context.getBean(Chorus.class));
          feed.set(context.getBean(RecordingChangeFeed.class));
        });

    assertFalse(chorus.get().isRunning());
    assertTrue(feed.get().shutdownCalls > 0);
  }

  @Configuration(proxyBeanMethods = false)
  static class TestRegistrarConfig {

    @Bean
    ResourceRegistrar donationsRegistrar() {
      return builder -> builder.resource("donations");
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class TestChangeFeedConfig {

    @Bean
    RecordingChangeFeed recordingChangeFeed() {
      return new RecordingChangeFeed();
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class SecondChangeFeedConfig {

    @Bean
    ChangeFeed secondChangeFeed() {
      return new RecordingChangeFeed();
    }
  }

  /** A ChangeFeed that records what it was asked to open. */
  static class RecordingChangeFeed implements ChangeFeed {

    private final List<String> opened = new CopyOnWriteArrayList<>();

    private volatile int shutdownCalls;

    @Override
    public ChangeFeedHandle open(final String resource,
        final ChangeFeedListener listener) {
      opened.add(resource);
      return new ChangeFeedHandle() {
        @Override
        public String resource() {
          return resource;
        }

        @Override
        public boolean isOpen() {
          return true;
        }
      };
    }

    @Override
    public void close(final ChangeFeedHandle handle) {
    }

    @Override
    public void shutdown() {
      shutdownCalls++;
    }
  }
}
