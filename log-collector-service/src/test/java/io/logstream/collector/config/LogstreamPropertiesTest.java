package io.logstream.collector.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.ConfigDataApplicationContextInitializer;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class LogstreamPropertiesTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withInitializer(new ConfigDataApplicationContextInitializer())
          .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
          .withUserConfiguration(PropertiesOnly.class);

  @Test
  void bindsDefaultsFromConfigurationFile() {
    contextRunner.run(context -> {
      assertThat(context).hasNotFailed();
      LogstreamProperties properties = context.getBean(LogstreamProperties.class);

      assertThat(properties.index().name()).isEqualTo("logs");
      assertThat(properties.index().initialize()).isTrue();
      assertThat(properties.batch().size()).isEqualTo(200);
      assertThat(properties.batch().flushInterval()).isEqualTo(Duration.ofMillis(250));
      assertThat(properties.batch().intakeCapacity()).isEqualTo(100_000);
      assertThat(properties.batch().maxAttempts()).isEqualTo(1);
      assertThat(properties.subscribers().bufferSize()).isEqualTo(10_000);
      assertThat(properties.amqp().enabled()).isFalse();
    });
  }

  @Test
  void bindsOverrides() {
    contextRunner
        .withPropertyValues(
            "logstream.index.url=http://search:7700",
            "logstream.index.api-key=secret",
            "logstream.batch.size=50",
            "logstream.batch.flush-interval=1s")
        .run(context -> {
          assertThat(context).hasNotFailed();
          LogstreamProperties properties = context.getBean(LogstreamProperties.class);

          assertThat(properties.index().url()).isEqualTo("http://search:7700");
          assertThat(properties.index().apiKey()).isEqualTo("secret");
          assertThat(properties.batch().size()).isEqualTo(50);
          assertThat(properties.batch().flushInterval()).isEqualTo(Duration.ofSeconds(1));
        });
  }

  @Test
  void failsWhenBatchSizeIsZero() {
    contextRunner
        .withPropertyValues("logstream.batch.size=0")
        .run(context -> {
          assertThat(context).hasFailed();
          assertThat(context.getStartupFailure())
              .hasRootCauseInstanceOf(BindValidationException.class);
        });
  }

  @Test
  void failsWhenIndexNameBlank() {
    contextRunner
        .withPropertyValues("logstream.index.name=")
        .run(context -> {
          assertThat(context).hasFailed();
          assertThat(context.getStartupFailure())
              .hasRootCauseInstanceOf(BindValidationException.class);
        });
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(LogstreamProperties.class)
  static class PropertiesOnly {
  }
}
