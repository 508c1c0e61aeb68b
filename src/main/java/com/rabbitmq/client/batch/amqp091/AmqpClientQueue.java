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
package com.rabbitmq.client.batch.amqp091;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.batch.AmqpException;
import com.rabbitmq.client.batch.Channel;
import com.rabbitmq.client.batch.Envelope;
import com.rabbitmq.client.batch.Queue;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpClientQueue implements Queue {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpClientQueue.class);

  private final AmqpClientChannel channel;
  private final Map<String, Object> arguments = new LinkedHashMap<>();
  private String name = "";
  private boolean durable = false;
  private boolean exclusive = false;
  private boolean autoDelete = false;
  private boolean passive = false;

  AmqpClientQueue(AmqpClientChannel channel) {
    this.channel = channel;
  }

  @Override
  public String name() {
    return this.name;
  }

  @Override
  public Queue name(String name) {
    this.name = name == null ? "" : name;
    return this;
  }

  @Override
  public Queue durable(boolean durable) {
    this.durable = durable;
    return this;
  }

  @Override
  public Queue exclusive(boolean exclusive) {
    this.exclusive = exclusive;
    return this;
  }

  @Override
  public Queue autoDelete(boolean autoDelete) {
    this.autoDelete = autoDelete;
    return this;
  }

  @Override
  public Queue passive(boolean passive) {
    this.passive = passive;
    return this;
  }

  @Override
  public Queue argument(String key, Object value) {
    this.arguments.put(key, value);
    return this;
  }

  @Override
  public Map<String, Object> arguments() {
    return Collections.unmodifiableMap(this.arguments);
  }

  @Override
  public long declare() {
    try {
      AMQP.Queue.DeclareOk ok;
      if (this.passive) {
        ok = this.delegate().queueDeclarePassive(this.name);
      } else {
        ok =
            this.delegate()
                .queueDeclare(
                    this.name, this.durable, this.exclusive, this.autoDelete, this.arguments);
      }
      this.name = ok.getQueue();
      return ok.getMessageCount();
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertQueueError(e, "Error while declaring queue '%s'", name);
    }
  }

  @Override
  public void bind(String exchange, String routingKey) {
    try {
      this.delegate().queueBind(this.name, exchange, routingKey == null ? "" : routingKey);
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertQueueError(
          e, "Error while binding queue '%s' to exchange '%s'", name, exchange);
    }
  }

  @Override
  public void unbind(String exchange, String routingKey) {
    try {
      this.delegate().queueUnbind(this.name, exchange, routingKey == null ? "" : routingKey);
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertQueueError(
          e, "Error while unbinding queue '%s' from exchange '%s'", name, exchange);
    }
  }

  @Override
  public Envelope get(boolean autoAck) {
    try {
      GetResponse response = this.delegate().basicGet(this.name, autoAck);
      if (response == null) {
        return null;
      } else {
        return new AmqpClientEnvelope(
            response.getEnvelope(), response.getProps(), response.getBody());
      }
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertQueueError(e, "Error while getting message from '%s'", name);
    }
  }

  @Override
  public void consume(String consumerTag, Duration pollTimeout, ConsumeCallback callback) {
    DeliveryBuffer deliveries = new DeliveryBuffer();
    AtomicBoolean cancelled = new AtomicBoolean(false);
    AtomicReference<ShutdownSignalException> shutdownSignal = new AtomicReference<>();
    DefaultConsumer consumer =
        new DefaultConsumer(this.delegate()) {
          @Override
          public void handleDelivery(
              String tag,
              com.rabbitmq.client.Envelope envelope,
              AMQP.BasicProperties properties,
              byte[] body) {
            if (!deliveries.offer(new AmqpClientEnvelope(envelope, properties, body))) {
              requeueLateDelivery(tag, envelope.getDeliveryTag());
            }
          }

          @Override
          public void handleCancel(String tag) {
            LOGGER.info("Consumer {} cancelled by the broker", tag);
            cancelled.set(true);
          }

          @Override
          public void handleShutdownSignal(String tag, ShutdownSignalException sig) {
            shutdownSignal.set(sig);
          }
        };
    String tag;
    try {
      tag = this.delegate().basicConsume(this.name, false, consumerTag, consumer);
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertQueueError(e, "Error while consuming from queue '%s'", name);
    }
    LOGGER.debug("Consumer {} subscribed to queue '{}'", tag, this.name);
    long timeout = pollTimeout.toMillis();
    boolean keepConsuming = true;
    try {
      while (keepConsuming) {
        Envelope envelope = deliveries.poll(timeout);
        if (envelope != null) {
          keepConsuming = callback.onDelivery(envelope);
        } else if (shutdownSignal.get() != null) {
          throw ExceptionUtils.convertQueueError(
              shutdownSignal.get(), "Channel closed while consuming from queue '%s'", name);
        } else if (cancelled.get()) {
          return;
        } else {
          keepConsuming = callback.onIdle();
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AmqpException(e);
    } finally {
      this.stopConsuming(tag, cancelled.get() || shutdownSignal.get() != null, deliveries);
    }
  }

  private void stopConsuming(String tag, boolean cancelled, DeliveryBuffer deliveries) {
    if (!cancelled && this.delegate().isOpen()) {
      try {
        this.delegate().basicCancel(tag);
      } catch (IOException | AlreadyClosedException e) {
        LOGGER.warn("Error while cancelling consumer {}: {}", tag, e.getMessage());
      }
    }
    // deliveries dispatched after this point are requeued by the consumer itself
    List<Envelope> unhandled = deliveries.close();
    if (!unhandled.isEmpty() && this.delegate().isOpen()) {
      LOGGER.debug("Requeuing {} prefetched message(s)", unhandled.size());
      for (Envelope envelope : unhandled) {
        this.reject(envelope.deliveryTag(), true);
      }
    }
  }

  private void requeueLateDelivery(String tag, long deliveryTag) {
    if (!this.delegate().isOpen()) {
      return;
    }
    LOGGER.debug("Consumer {} stopped, requeuing message {}", tag, deliveryTag);
    try {
      this.delegate().basicReject(deliveryTag, true);
    } catch (IOException | AlreadyClosedException e) {
      LOGGER.warn("Error while requeuing message {}: {}", deliveryTag, e.getMessage());
    }
  }

  @Override
  public void ack(long deliveryTag, boolean multiple) {
    try {
      this.delegate().basicAck(deliveryTag, multiple);
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertQueueError(e, "Error while acknowledging %d", deliveryTag);
    }
  }

  @Override
  public void nack(long deliveryTag, boolean multiple, boolean requeue) {
    try {
      this.delegate().basicNack(deliveryTag, multiple, requeue);
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertQueueError(
          e, "Error while negatively acknowledging %d", deliveryTag);
    }
  }

  @Override
  public void reject(long deliveryTag, boolean requeue) {
    try {
      this.delegate().basicReject(deliveryTag, requeue);
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertQueueError(e, "Error while rejecting %d", deliveryTag);
    }
  }

  @Override
  public void purge() {
    try {
      this.delegate().queuePurge(this.name);
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertQueueError(e, "Error while purging queue '%s'", name);
    }
  }

  @Override
  public void cancel(String consumerTag) {
    try {
      this.delegate().basicCancel(consumerTag);
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertQueueError(e, "Error while cancelling consumer %s", consumerTag);
    }
  }

  @Override
  public void delete() {
    try {
      this.delegate().queueDelete(this.name);
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertQueueError(e, "Error while deleting queue '%s'", name);
    }
  }

  @Override
  public Channel channel() {
    return this.channel;
  }

  private com.rabbitmq.client.Channel delegate() {
    return this.channel.delegate();
  }

  /** Hand-off between the client dispatch thread and the consuming thread. */
  private static final class DeliveryBuffer {

    private final BlockingQueue<Envelope> deliveries = new LinkedBlockingQueue<>();
    private boolean closed = false;

    synchronized boolean offer(Envelope envelope) {
      if (this.closed) {
        return false;
      }
      return this.deliveries.add(envelope);
    }

    Envelope poll(long timeoutMs) throws InterruptedException {
      return this.deliveries.poll(timeoutMs, TimeUnit.MILLISECONDS);
    }

    synchronized List<Envelope> close() {
      this.closed = true;
      List<Envelope> remaining = new ArrayList<>();
      this.deliveries.drainTo(remaining);
      return remaining;
    }
  }
}
