package com.zengcode.samples;

public record OrderCancelled(String orderId, String reason) implements OrderEvent {
}
