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
package com.rabbitmq.client.batch;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * Broker-less {@link Queue}.
 *
 * <p>Requeued messages go back to the head of the queue with the redelivery flag set.
 */
public final class InMemoryQueue implements Queue {

  private final InMemoryChannel channel;
  private final Map<String, Object> arguments = new LinkedHashMap<>();
  private final BlockingDeque<TestMessage> ready = new LinkedBlockingDeque<>();
  private final List<TestMessage> acknowledged = new CopyOnWriteArrayList<>();
  private final List<TestMessage> dropped = new CopyOnWriteArrayList<>();
  private final List<String> cancelledConsumers = new CopyOnWriteArrayList<>();
  private String name = "";

  InMemoryQueue(InMemoryChannel channel) {
    this.channel = channel;
  }

  public InMemoryQueue enqueue(String body) {
    return this.enqueue(body, Attributes.empty());
  }

  public InMemoryQueue enqueue(String body, Attributes attributes) {
    return this.enqueue(body.getBytes(StandardCharsets.UTF_8), attributes);
  }

  public InMemoryQueue enqueue(byte[] body, Attributes attributes) {
    this.ready.addLast(new TestMessage(body, "", this.name, attributes, false));
    return this;
  }

  void route(TestMessage message) {
    this.ready.addLast(message);
  }

  void acknowledged(TestMessage message) {
    this.acknowledged.add(message);
  }

  void dropped(TestMessage message) {
    this.dropped.add(message);
  }

  void requeue(TestMessage message) {
    this.ready.addFirst(message.redelivered());
  }

  public int readyCount() {
    return this.ready.size();
  }

  public List<TestMessage> acknowledged() {
    return new ArrayList<>(this.acknowledged);
  }

  public List<TestMessage> dropped() {
    return new ArrayList<>(this.dropped);
  }

  public List<String> cancelledConsumers() {
    return new ArrayList<>(this.cancelledConsumers);
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
    return this;
  }

  @Override
  public Queue exclusive(boolean exclusive) {
    return this;
  }

  @Override
  public Queue autoDelete(boolean autoDelete) {
    return this;
  }

  @Override
  public Queue passive(boolean passive) {
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
    if (this.name.isEmpty()) {
      this.name = "amq.gen-" + System.nanoTime();
    }
    this.channel.register(this);
    return this.ready.size();
  }

  @Override
  public void bind(String exchange, String routingKey) {}

  @Override
  public void unbind(String exchange, String routingKey) {}

  @Override
  public Envelope get(boolean autoAck) {
    TestMessage message = this.ready.pollFirst();
    if (message == null) {
      return null;
    }
    long tag = this.channel.deliver(this, message, autoAck);
    if (autoAck) {
      this.acknowledged.add(message);
    }
    return message.envelope(tag);
  }

  @Override
  public void consume(String consumerTag, Duration pollTimeout, ConsumeCallback callback) {
    boolean keepConsuming = true;
    try {
      while (keepConsuming) {
        TestMessage message = this.ready.pollFirst(pollTimeout.toMillis(), TimeUnit.MILLISECONDS);
        if (message == null) {
          keepConsuming = callback.onIdle();
        } else {
          long tag = this.channel.deliver(this, message, false);
          keepConsuming = callback.onDelivery(message.envelope(tag));
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AmqpException(e);
    } finally {
      this.cancelledConsumers.add(consumerTag);
    }
  }

  @Override
  public void ack(long deliveryTag, boolean multiple) {
    this.channel.ack(deliveryTag, multiple);
  }

  @Override
  public void nack(long deliveryTag, boolean multiple, boolean requeue) {
    this.channel.nack(deliveryTag, multiple, requeue);
  }

  @Override
  public void reject(long deliveryTag, boolean requeue) {
    this.channel.reject(deliveryTag, requeue);
  }

  @Override
  public void purge() {
    this.ready.clear();
  }

  @Override
  public void cancel(String consumerTag) {
    this.cancelledConsumers.add(consumerTag);
  }

  @Override
  public void delete() {
    this.channel.unregister(this);
    this.ready.clear();
  }

  @Override
  public InMemoryChannel channel() {
    return this.channel;
  }
}
