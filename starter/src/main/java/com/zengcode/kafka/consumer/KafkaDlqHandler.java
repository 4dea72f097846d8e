package com.zengcode.kafka.consumer;

import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Context;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Publishes poisoned records to the dead-letter topic, synchronously, with forensic headers.
 *
 * <p>Delivery is at-most-effort: when the DLQ broker refuses the record the failure is logged and
 * the source offset is still committed, so the message is lost for good.
 */
public class KafkaDlqHandler implements DlqHandler {

  private static final Logger log = LoggerFactory.getLogger(KafkaDlqHandler.class);

  static final Duration DEFAULT_DELIVERY_TIMEOUT = Duration.ofSeconds(30);

  private final KafkaTemplate<byte[], byte[]> template;
  private final String dlqTopic;
  private final MessageTracer tracer;
  private final Clock clock;
  private final Duration deliveryTimeout;

  public KafkaDlqHandler(KafkaTemplate<byte[], byte[]> template, String dlqTopic, MessageTracer tracer) {
    this(template, dlqTopic, tracer, Clock.systemUTC(), DEFAULT_DELIVERY_TIMEOUT);
  }

  KafkaDlqHandler(KafkaTemplate<byte[], byte[]> template, String dlqTopic, MessageTracer tracer,
                  Clock clock, Duration deliveryTimeout) {
    this.template = template;
    this.dlqTopic = dlqTopic;
    this.tracer = tracer;
    this.clock = clock;
    this.deliveryTimeout = deliveryTimeout;
  }

  @Override
  public void sendToDlq(ConsumerRecord<byte[], byte[]> record, Throwable error) {
    var span = tracer.startDlqSpan(Context.current(), record, dlqTopic);
    try (var ignored = span.makeCurrent()) {
      var headers = forensicHeaders(record, error);
      tracer.injectContext(Context.current(), headers);
      var out = new ProducerRecord<>(dlqTopic, null, record.key(), record.value(), headers);

      try {
        template.send(out).get(deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (ExecutionException e) {
        var cause = e.getCause() != null ? e.getCause() : e;
        span.recordException(cause);
        span.setStatus(StatusCode.ERROR, "failed to deliver message to DLQ");
        log.error("failed to deliver message to DLQ: dlqTopic={}, {}", dlqTopic, Records.describe(record), cause);
        return;
      } catch (TimeoutException e) {
        span.recordException(e);
        span.setStatus(StatusCode.ERROR, "timed out delivering message to DLQ");
        log.error("timed out after {}ms delivering message to DLQ: dlqTopic={}, {}",
            deliveryTimeout.toMillis(), dlqTopic, Records.describe(record));
        return;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        span.setStatus(StatusCode.ERROR, "interrupted while delivering message to DLQ");
        log.error("interrupted while delivering message to DLQ: dlqTopic={}, {}", dlqTopic, Records.describe(record));
        return;
      } catch (RuntimeException e) {
        span.recordException(e);
        span.setStatus(StatusCode.ERROR, "failed to send message to DLQ");
        log.error("failed to send message to DLQ: dlqTopic={}, {}", dlqTopic, Records.describe(record), e);
        return;
      }

      span.setStatus(StatusCode.OK, "message sent to DLQ");
      log.info("message sent to DLQ: dlqTopic={}, {}", dlqTopic, Records.describe(record));
    } finally {
      span.end();
    }
  }

  private Headers forensicHeaders(ConsumerRecord<byte[], byte[]> record, Throwable error) {
    var headers = new RecordHeaders();
    record.headers().forEach(headers::add);
    put(headers, DlqHeaders.ORIGINAL_TOPIC, record.topic());
    put(headers, DlqHeaders.ORIGINAL_PARTITION, String.valueOf(record.partition()));
    put(headers, DlqHeaders.ORIGINAL_OFFSET, String.valueOf(record.offset()));
    put(headers, DlqHeaders.ERROR, error.getMessage() != null ? error.getMessage() : error.toString());
    put(headers, DlqHeaders.ERROR_CLASS, error.getClass().getName());
    put(headers, DlqHeaders.TIMESTAMP,
        DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS)));
    return headers;
  }

  // a record replayed from the DLQ may already carry these
  private static void put(Headers headers, String key, String value) {
    headers.remove(key);
    headers.add(key, value.getBytes(StandardCharsets.UTF_8));
  }

  public String getDlqTopic() {
    return dlqTopic;
  }
}
