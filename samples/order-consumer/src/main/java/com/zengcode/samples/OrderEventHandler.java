package com.zengcode.samples;

import com.zengcode.kafka.consumer.MessageHandler;
import com.zengcode.kafka.consumer.PermanentProcessingException;
import com.zengcode.kafka.consumer.SkipMessageException;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class OrderEventHandler implements MessageHandler<OrderEvent> {

  private static final Logger log = LoggerFactory.getLogger(OrderEventHandler.class);

  @Override
  public void handle(OrderEvent event) {
    if (event.orderId() == null || event.orderId().isBlank()) {
      throw new SkipMessageException("order event without orderId");
    }
    if (event instanceof OrderCreated created) {
      onCreated(created);
    } else if (event instanceof OrderCancelled cancelled) {
      log.info("Order {} cancelled: {}", cancelled.orderId(), cancelled.reason());
    }
  }

  private void onCreated(OrderCreated order) {
    if (order.amount() == null || order.amount().compareTo(BigDecimal.ZERO) < 0) {
      throw new PermanentProcessingException("invalid amount for order " + order.orderId() + ": " + order.amount());
    }
    if (order.orderId().contains("FAIL")) {
      throw new IllegalStateException("boom for retry/dlq!");
    }
    log.info("Processed order {} for customer {} ({})", order.orderId(), order.customerId(), order.amount());
  }
}
