// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.client.batch.impl;

import static com.rabbitmq.client.batch.Resource.State.FLUSHING;
import static com.rabbitmq.client.batch.Resource.State.RUNNING;
import static com.rabbitmq.client.batch.Resource.State.STOPPED;

import com.rabbitmq.client.batch.Consumer;
import com.rabbitmq.client.batch.DeliveryResult;
import com.rabbitmq.client.batch.Envelope;
import com.rabbitmq.client.batch.FlushDeferredResult;
import com.rabbitmq.client.batch.Queue;
import com.rabbitmq.client.batch.metrics.MetricsCollector;
import com.rabbitmq.client.batch.metrics.MetricsCollector.ConsumeDisposition;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;

/**
 * Consumer loop with batched acknowledgment.
 *
 * <p>Each delivery is dispatched to {@link #onDelivery(Envelope)}, the outcome is then applied by
 * {@link #processResult(Envelope, DeliveryResult)}. Deferred messages are settled together with a
 * single <code>multiple</code> acknowledgment when the batch is full, when the idle timeout
 * elapses, or when the consumer stops.
 *
 * <p>Messages with the control application ID are not dispatched to the handler, they carry
 * in-band commands (see {@link ControlMessages}).
 */
public abstract class AbstractConsumer extends ResourceBase implements Consumer {

  static final Duration MAX_POLL_TIMEOUT = Duration.ofSeconds(1);
  static final Duration SHUTDOWN_HOOK_TIMEOUT = Duration.ofSeconds(10);

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private final long id;
  private final Queue queue;
  private final String consumerTag;
  private final String controlAppId;
  private final Logger logger;
  private final MetricsCollector metricsCollector;
  private final Thread shutdownHook;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicLong unacknowledged = new AtomicLong(0);
  private final DeferredBatch deferred = new DeferredBatch();

  private volatile boolean shutdownRequested = false;
  private volatile CountDownLatch stopped = new CountDownLatch(0);
  private volatile int batchSize;
  private volatile Duration idleTimeout;

  // session state, accessed only by the consuming thread
  private int target;
  private long consumed;
  private long lastDeliveryTag;
  private long lastFlushNanos;
  private boolean keepConsuming;

  protected AbstractConsumer(
      Queue queue,
      String consumerTag,
      String controlAppId,
      int batchSize,
      Duration idleTimeout,
      Logger logger,
      MetricsCollector metricsCollector,
      boolean registerShutdownHook,
      List<StateListener> listeners) {
    super(listeners);
    this.id = ID_SEQUENCE.getAndIncrement();
    this.queue = queue;
    this.consumerTag = consumerTag;
    this.controlAppId = controlAppId;
    this.batchSize = batchSize;
    this.idleTimeout = idleTimeout;
    this.logger = logger;
    this.metricsCollector = metricsCollector;
    if (registerShutdownHook) {
      this.shutdownHook =
          new Thread(this::shutdownAndWait, "rabbitmq-batch-consumer-shutdown-" + this.id);
      Runtime.getRuntime().addShutdownHook(this.shutdownHook);
    } else {
      this.shutdownHook = null;
    }
  }

  /**
   * Handle an application message.
   *
   * @param envelope the message
   * @return the outcome of the processing
   * @throws Exception if the processing fails
   */
  protected abstract DeliveryResult handleDelivery(Envelope envelope) throws Exception;

  /**
   * Decide what to do with the deferred batch.
   *
   * @return the outcome of the batch, acknowledgment by default
   * @throws Exception if the decision fails, the batch is then rejected
   */
  protected FlushDeferredResult flushDeferred() throws Exception {
    return FlushDeferredResult.ACK;
  }

  /**
   * Called when {@link #handleDelivery(Envelope)} or {@link #flushDeferred()} fails.
   *
   * @param exception the failure
   */
  protected void handleException(Exception exception) {}

  /**
   * Dispatch a delivery, to a control command or to {@link #handleDelivery(Envelope)}.
   *
   * @param envelope the message
   * @return the outcome of the processing
   * @throws Exception if the processing fails
   */
  protected DeliveryResult onDelivery(Envelope envelope) throws Exception {
    if (isControlMessage(envelope)) {
      return handleControlMessage(envelope);
    } else {
      return handleDelivery(envelope);
    }
  }

  /**
   * Apply the outcome of a delivery.
   *
   * @param envelope the message
   * @param result the outcome
   */
  protected void processResult(Envelope envelope, DeliveryResult result) {
    long deliveryTag = envelope.deliveryTag();
    switch (result) {
      case ACK:
        this.queue.ack(deliveryTag, false);
        this.settled(ConsumeDisposition.ACKNOWLEDGED);
        this.logger.debug("Acknowledged message {}", deliveryTag);
        break;
      case REJECT:
        this.queue.reject(deliveryTag, false);
        this.settled(ConsumeDisposition.REJECTED);
        this.logger.debug("Rejected message {}", deliveryTag);
        break;
      case REJECT_REQUEUE:
        this.queue.reject(deliveryTag, true);
        this.settled(ConsumeDisposition.REQUEUED);
        this.logger.debug("Rejected and requeued message {}", deliveryTag);
        break;
      case DEFER:
        if (this.deferred.isEmpty()) {
          this.lastFlushNanos = System.nanoTime();
        }
        this.deferred.add(deliveryTag);
        break;
      default:
        throw new IllegalStateException("Unexpected delivery result: " + result);
    }
  }

  /**
   * Acknowledge a single message outside of {@link #processResult(Envelope, DeliveryResult)}.
   *
   * @param envelope the message
   */
  protected final void acknowledge(Envelope envelope) {
    this.queue.ack(envelope.deliveryTag(), false);
    this.settled(ConsumeDisposition.ACKNOWLEDGED);
    this.logger.debug("Acknowledged message {}", envelope.deliveryTag());
  }

  protected final boolean isControlMessage(Envelope envelope) {
    return ControlMessages.isControlMessage(envelope, this.controlAppId);
  }

  /**
   * Execute the command of a control message.
   *
   * <p>Errors are logged and ignored, the control message is always acknowledged.
   *
   * @param envelope the control message
   * @return {@link DeliveryResult#ACK}
   */
  protected final DeliveryResult handleControlMessage(Envelope envelope) {
    String type = envelope.type();
    if (ControlMessages.SHUTDOWN.equals(type)) {
      this.logger.info("Shutdown message received");
      this.shutdownRequested = true;
      this.flush();
    } else if (ControlMessages.RECONFIGURE.equals(type)) {
      this.logger.info("Reconfigure message received");
      try {
        ControlMessages.Reconfiguration reconfiguration =
            ControlMessages.parseReconfiguration(envelope.body());
        this.flush();
        this.queue
            .channel()
            .qos(
                reconfiguration.prefetchSize(),
                reconfiguration.prefetchCount(),
                reconfiguration.global());
        this.idleTimeout = reconfiguration.idleTimeout();
        this.batchSize = reconfiguration.batchSize();
        this.logger.info(
            "Consumer reconfigured with prefetch count {}, idle timeout {}, batch size {}",
            reconfiguration.prefetchCount(),
            reconfiguration.idleTimeout(),
            reconfiguration.batchSize());
      } catch (RuntimeException e) {
        this.logger.error("Invalid reconfigure message: {}", e.getMessage());
      }
    } else {
      this.logger.error("Unsupported control message type: {}", type);
    }
    return DeliveryResult.ACK;
  }

  @Override
  public void consume(int maxMessages) {
    if (maxMessages < 0) {
      throw new IllegalArgumentException("Number of messages must be positive or 0");
    }
    if (this.closed.get()) {
      throw new IllegalStateException("Consumer is closed");
    }
    if (this.isConsuming()) {
      throw new IllegalStateException("Consumer is already consuming");
    }
    this.target = maxMessages;
    this.consumed = 0;
    this.lastDeliveryTag = 0;
    this.unacknowledged.set(0);
    this.deferred.clear();
    this.lastFlushNanos = System.nanoTime();
    this.shutdownRequested = false;
    this.keepConsuming = true;
    this.stopped = new CountDownLatch(1);
    this.state(RUNNING);
    this.metricsCollector.openConsumer();
    this.logger.debug(
        "Starting consumer '{}' on queue '{}' for {} message(s)",
        this.consumerTag,
        this.queue.name(),
        maxMessages);
    Throwable failure = null;
    try {
      Queue.ConsumeCallback callback = new LoopCallback();
      do {
        this.queue.consume(this.consumerTag, this.pollTimeout(), callback);
      } while (this.keepConsuming);
    } catch (RuntimeException e) {
      if (!isInterruption(e)) {
        failure = e;
        throw e;
      }
      this.flushOnInterrupt();
    } finally {
      this.state(STOPPED, failure);
      this.metricsCollector.closeConsumer();
      this.stopped.countDown();
      this.logger.debug(
          "Consumer '{}' stopped after {} message(s)", this.consumerTag, this.consumed);
    }
  }

  @Override
  public void shutdown() {
    this.shutdownRequested = true;
  }

  @Override
  public long unacknowledgedMessageCount() {
    return this.unacknowledged.get();
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      this.shutdown();
      if (this.shutdownHook != null) {
        try {
          Runtime.getRuntime().removeShutdownHook(this.shutdownHook);
        } catch (IllegalStateException e) {
          this.logger.debug("JVM is shutting down, could not remove shutdown hook");
        }
      }
    }
  }

  protected Queue queue() {
    return this.queue;
  }

  protected Logger logger() {
    return this.logger;
  }

  protected MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  protected String consumerTag() {
    return this.consumerTag;
  }

  protected String controlAppId() {
    return this.controlAppId;
  }

  int batchSize() {
    return this.batchSize;
  }

  Duration idleTimeout() {
    return this.idleTimeout;
  }

  long lastDeliveryTag() {
    return this.lastDeliveryTag;
  }

  boolean awaitStop(Duration timeout) throws InterruptedException {
    return this.stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void shutdownAndWait() {
    this.shutdown();
    try {
      if (!this.awaitStop(SHUTDOWN_HOOK_TIMEOUT)) {
        this.logger.warn(
            "Consumer '{}' did not stop in {} second(s)",
            this.consumerTag,
            SHUTDOWN_HOOK_TIMEOUT.getSeconds());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void deliver(Envelope envelope) {
    this.consumed++;
    this.unacknowledged.incrementAndGet();
    this.lastDeliveryTag = envelope.deliveryTag();
    this.metricsCollector.consume();
    this.logger.debug("Handling delivery of message {}", messageInformation(envelope));
    DeliveryResult result;
    try {
      result = this.onDelivery(envelope);
    } catch (Exception e) {
      this.logger.error("Exception during handleDelivery: {}", e.getMessage(), e);
      this.notifyError(e);
      result = DeliveryResult.REJECT_REQUEUE;
    }
    if (result == null) {
      this.logger.warn(
          "No result for message {}, rejecting and requeuing it", envelope.deliveryTag());
      result = DeliveryResult.REJECT_REQUEUE;
    }
    this.processResult(envelope, result);
  }

  private boolean afterDelivery() {
    if (this.deferred.size() >= this.batchSize) {
      this.flush();
    } else {
      this.flushIfIdle();
    }
    if (this.shutdownRequested || (this.target > 0 && this.consumed >= this.target)) {
      return this.stop();
    }
    return true;
  }

  private boolean stop() {
    this.flush();
    this.keepConsuming = false;
    return false;
  }

  private void flushIfIdle() {
    if (!this.deferred.isEmpty()
        && System.nanoTime() - this.lastFlushNanos >= this.idleTimeout.toNanos()) {
      this.flush();
    }
  }

  private void flush() {
    if (this.deferred.isEmpty()) {
      return;
    }
    this.state(FLUSHING);
    try {
      FlushDeferredResult result;
      try {
        result = this.flushDeferred();
      } catch (Exception e) {
        this.logger.error("Exception during flushDeferred: {}", e.getMessage(), e);
        this.notifyError(e);
        result = FlushDeferredResult.REJECT;
      }
      if (result == null) {
        this.logger.warn("No result for deferred messages, rejecting them");
        result = FlushDeferredResult.REJECT;
      }
      int size = this.deferred.size();
      long highestTag = this.deferred.highestTag();
      if (result == FlushDeferredResult.ACK) {
        this.queue.ack(highestTag, true);
        this.metricsCollector.flush(size, ConsumeDisposition.ACKNOWLEDGED);
        this.logger.info("Acknowledged {} messages at {}", size, highestTag);
      } else {
        this.queue.nack(highestTag, true, false);
        this.metricsCollector.flush(size, ConsumeDisposition.REJECTED);
        this.logger.info("Not acknowledged {} messages at {}", size, highestTag);
      }
      this.unacknowledged.addAndGet(-size);
    } finally {
      this.deferred.clear();
      this.lastFlushNanos = System.nanoTime();
      this.state(RUNNING);
    }
  }

  private void flushOnInterrupt() {
    this.logger.info("Consumer '{}' interrupted, flushing deferred messages", this.consumerTag);
    // cleared while settling, restored for the caller
    Thread.interrupted();
    try {
      if (this.queue.channel().isOpen()) {
        this.flush();
      }
    } catch (RuntimeException e) {
      this.logger.warn(
          "Error while flushing deferred messages of interrupted consumer '{}': {}",
          this.consumerTag,
          e.getMessage());
    } finally {
      this.keepConsuming = false;
      Thread.currentThread().interrupt();
    }
  }

  private static boolean isInterruption(Throwable failure) {
    Throwable current = failure;
    while (current != null) {
      if (current instanceof InterruptedException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private void notifyError(Exception exception) {
    try {
      this.handleException(exception);
    } catch (Exception e) {
      this.logger.warn("Error in error handler: {}", e.getMessage());
    }
  }

  private void settled(ConsumeDisposition disposition) {
    this.unacknowledged.decrementAndGet();
    this.metricsCollector.consumeDisposition(disposition);
  }

  private Duration pollTimeout() {
    Duration timeout = this.idleTimeout;
    return timeout.compareTo(MAX_POLL_TIMEOUT) < 0 ? timeout : MAX_POLL_TIMEOUT;
  }

  static Map<String, Object> messageInformation(Envelope envelope) {
    Map<String, Object> information = new LinkedHashMap<>();
    information.put("deliveryTag", envelope.deliveryTag());
    information.put("redelivered", envelope.isRedelivery());
    information.put("exchange", envelope.exchangeName());
    information.put("routingKey", envelope.routingKey());
    information.put("type", envelope.type());
    information.put("appId", envelope.appId());
    information.put("correlationId", envelope.correlationId());
    information.put("replyTo", envelope.replyTo());
    byte[] body = envelope.body();
    information.put("body", body == null ? null : new String(body, StandardCharsets.UTF_8));
    return information;
  }

  @Override
  public String toString() {
    return "Consumer{"
        + "id="
        + id
        + ", consumerTag='"
        + consumerTag
        + '\''
        + ", queue='"
        + queue.name()
        + '\''
        + ", state="
        + state()
        + '}';
  }

  private final class LoopCallback implements Queue.ConsumeCallback {

    @Override
    public boolean onDelivery(Envelope envelope) {
      flushIfIdle();
      deliver(envelope);
      return afterDelivery();
    }

    @Override
    public boolean onIdle() {
      flushIfIdle();
      if (shutdownRequested) {
        return stop();
      }
      return true;
    }
  }
}
