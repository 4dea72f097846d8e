package com.zengcode.kafka.consumer;

import io.opentelemetry.api.OpenTelemetry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@AutoConfiguration(after = KafkaAutoConfiguration.class)
@EnableConfigurationProperties(KafkaPipelineProperties.class)
@ConditionalOnProperty(prefix = "kafka.pipeline", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReliableConsumerAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(ReliableConsumerAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean(ReadinessWaiter.class)
  TrafficReadinessGate trafficReadinessGate() {
    return new TrafficReadinessGate();
  }

  @Bean
  @ConditionalOnMissingBean
  MessageTracer kafkaMessageTracer(ObjectProvider<OpenTelemetry> openTelemetry) {
    return new MessageTracer(openTelemetry.getIfAvailable(OpenTelemetry::noop));
  }

  @Bean
  ReliableConsumerLifecycle reliableConsumerLifecycle(KafkaPipelineProperties props,
                                                      ConsumerFactory<?, ?> consumerFactory,
                                                      ProducerFactory<?, ?> producerFactory,
                                                      ObjectProvider<ConsumerDefinition<?>> definitions,
                                                      MessageTracer tracer,
                                                      ReadinessWaiter readiness) {
    var settingsByName = props.resolve().stream()
        .collect(Collectors.toMap(ConsumerSettings::name, Function.identity(), (a, b) -> a, LinkedHashMap::new));
    var defined = definitions.orderedStream().toList();

    var needsDlq = defined.stream()
        .map(d -> settingsByName.get(d.getName()))
        .anyMatch(s -> s != null && s.enableDlq());
    var dlqTemplate = needsDlq ? dlqTemplate(producerFactory) : null;

    var consumers = new ArrayList<ReliableKafkaConsumer<?>>();
    for (var definition : defined) {
      var settings = settingsByName.remove(definition.getName());
      if (settings == null) {
        throw new IllegalStateException("no consumer config found for consumer name: " + definition.getName());
      }
      DlqHandler dlq = settings.enableDlq()
          ? new KafkaDlqHandler(dlqTemplate, settings.dlqTopic(), tracer)
          : new NoopDlqHandler();
      consumers.add(create(settings, definition, createClient(consumerFactory, settings), dlq, tracer, readiness));
    }
    settingsByName.keySet().forEach(name ->
        log.warn("kafka.pipeline consumer {} is configured but no ConsumerDefinition bean uses it", name));

    return new ReliableConsumerLifecycle(consumers, dlqTemplate, props.isAutoStartup());
  }

  private static <T> ReliableKafkaConsumer<T> create(ConsumerSettings settings, ConsumerDefinition<T> definition,
                                                    Consumer<byte[], byte[]> client, DlqHandler dlq,
                                                    MessageTracer tracer, ReadinessWaiter readiness) {
    return new ReliableKafkaConsumer<>(settings, client, definition, dlq, tracer, readiness);
  }

  // offsets are committed by the consumer itself, only after a record was handled
  static Consumer<byte[], byte[]> createClient(ConsumerFactory<?, ?> consumerFactory, ConsumerSettings settings) {
    var overrides = new Properties();
    overrides.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
    overrides.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
    overrides.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    overrides.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, settings.autoOffsetReset());

    @SuppressWarnings("unchecked")
    var client = (Consumer<byte[], byte[]>) consumerFactory.createConsumer(settings.groupId(), settings.name(), null,
        overrides);
    return client;
  }

  static KafkaTemplate<byte[], byte[]> dlqTemplate(ProducerFactory<?, ?> producerFactory) {
    @SuppressWarnings("unchecked")
    var factory = (ProducerFactory<byte[], byte[]>) producerFactory;
    return new KafkaTemplate<>(factory, Map.<String, Object>of(
        ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class,
        ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class));
  }
}
