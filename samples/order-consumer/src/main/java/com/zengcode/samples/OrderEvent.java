package com.zengcode.samples;

/** Events published on the {@code orders} topic, told apart by the {@code event-type} header. */
public interface OrderEvent {

  String orderId();
}
