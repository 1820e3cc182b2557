package io.logstream.collector.infra;

import io.logstream.collector.app.IngestionGateway;
import io.logstream.collector.config.LogstreamProperties;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Optional RabbitMQ transport: binds a durable queue to the logs topic exchange and feeds it into
 * the ingestion gateway.
 */
@Configuration
@ConditionalOnProperty(prefix = "logstream.amqp", name = "enabled", havingValue = "true")
public class AmqpIntakeConfiguration {

  @Bean
  TopicExchange logsExchange(LogstreamProperties properties) {
    return new TopicExchange(properties.amqp().exchange(), true, false);
  }

  @Bean
  Queue logsQueue(LogstreamProperties properties) {
    return QueueBuilder.durable(properties.amqp().queue()).build();
  }

  @Bean
  Binding logsBinding(Queue logsQueue, TopicExchange logsExchange) {
    return BindingBuilder.bind(logsQueue).to(logsExchange).with("#");
  }

  @Bean
  AmqpLogIntake amqpLogIntake(IngestionGateway gateway) {
    return new AmqpLogIntake(gateway);
  }
}
