package com.zengcode.kafka.consumer;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapPropagator;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Headers;

/**
 * Distributed tracing for consumed records: pulls the producer's trace context out of the headers,
 * opens consume and dead-letter spans, and writes the current context back into outgoing headers.
 */
public class MessageTracer {

  static final String INSTRUMENTATION_NAME = "kafka-consumer";
  static final String CONSUME_SPAN = "kafka.consume";
  static final String DLQ_SPAN = "kafka.send_to_dlq";

  private final Tracer tracer;
  private final TextMapPropagator propagator;

  public MessageTracer(OpenTelemetry openTelemetry) {
    this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
    this.propagator = openTelemetry.getPropagators().getTextMapPropagator();
  }

  /** Returns {@code parent} untouched when the record carries no headers. */
  public Context extractContext(Context parent, ConsumerRecord<?, ?> record) {
    var headers = record.headers();
    if (headers == null || !headers.iterator().hasNext()) {
      return parent;
    }
    return propagator.extract(parent, headers, KafkaHeadersCarrier.INSTANCE);
  }

  public Span startConsumerSpan(Context parent, ConsumerRecord<byte[], byte[]> record) {
    var builder = tracer.spanBuilder(CONSUME_SPAN)
        .setParent(parent)
        .setSpanKind(SpanKind.CONSUMER)
        .setAttribute("messaging.system", "kafka")
        .setAttribute("messaging.destination", record.topic())
        .setAttribute("messaging.partition", (long) record.partition())
        .setAttribute("messaging.offset", record.offset());
    if (record.key() != null) {
      builder.setAttribute("messaging.message.key", Records.key(record));
    }
    return builder.startSpan();
  }

  public Span startDlqSpan(Context parent, ConsumerRecord<byte[], byte[]> record, String dlqTopic) {
    var builder = tracer.spanBuilder(DLQ_SPAN)
        .setParent(parent)
        .setSpanKind(SpanKind.PRODUCER)
        .setAttribute("messaging.system", "kafka")
        .setAttribute("messaging.destination", dlqTopic)
        .setAttribute("messaging.source.topic", record.topic())
        .setAttribute("messaging.source.partition", (long) record.partition())
        .setAttribute("messaging.source.offset", record.offset());
    if (record.key() != null) {
      builder.setAttribute("messaging.message.key", Records.key(record));
    }
    return builder.startSpan();
  }

  /** Writes {@code context} into {@code headers}, keeping every header the propagator does not own. */
  public void injectContext(Context context, Headers headers) {
    propagator.inject(context, headers, KafkaHeadersCarrier.INSTANCE);
  }
}
