package com.zengcode.samples;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zengcode.kafka.consumer.ConsumerDefinition;
import com.zengcode.kafka.consumer.JsonEventDeserializer;
import java.util.Map;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class OrderConsumerApplication {

  public static void main(String[] args) {
    SpringApplication.run(OrderConsumerApplication.class, args);
  }

  @Bean
  ConsumerDefinition<OrderEvent> ordersConsumer(ObjectMapper mapper, OrderEventHandler handler) {
    var deserializer = JsonEventDeserializer.<OrderEvent>byEventType(mapper, Map.of(
        "OrderCreated", OrderCreated.class,
        "OrderCancelled", OrderCancelled.class));
    return ConsumerDefinition.of("orders", deserializer, handler);
  }
}
