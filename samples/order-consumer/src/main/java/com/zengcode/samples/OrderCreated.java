package com.zengcode.samples;

import java.math.BigDecimal;

public record OrderCreated(String orderId, String customerId, BigDecimal amount) implements OrderEvent {
}
