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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Broker-less {@link Channel}.
 *
 * <p>Delivery tags are assigned per channel. Settlements are checked against the unacknowledged
 * deliveries: settling an unknown tag fails the same way a broker closes the channel.
 */
public final class InMemoryChannel implements Channel {

  private final Connection connection;
  private final AtomicLong deliveryTagSequence = new AtomicLong(0);
  private final Map<Long, Unacked> unacked = new ConcurrentHashMap<>();
  private final Map<String, InMemoryQueue> queues = new ConcurrentHashMap<>();
  private final List<Settlement> settlements = new CopyOnWriteArrayList<>();
  private final List<int[]> qos = new CopyOnWriteArrayList<>();
  private final AtomicBoolean open = new AtomicBoolean(true);

  public InMemoryChannel() {
    this(new InMemoryConnection());
  }

  InMemoryChannel(Connection connection) {
    this.connection = connection;
  }

  @Override
  public InMemoryExchange newExchange() {
    return new InMemoryExchange(this);
  }

  @Override
  public InMemoryQueue newQueue() {
    return new InMemoryQueue(this);
  }

  /**
   * Create and declare a queue.
   *
   * @param name queue name
   * @return the queue
   */
  public InMemoryQueue queue(String name) {
    InMemoryQueue queue = newQueue();
    queue.name(name);
    queue.declare();
    return queue;
  }

  @Override
  public void qos(int prefetchSize, int prefetchCount, boolean global) {
    this.qos.add(new int[] {prefetchSize, prefetchCount, global ? 1 : 0});
  }

  /**
   * The qos calls, as <code>[prefetchSize, prefetchCount, global]</code>.
   *
   * @return qos calls
   */
  public List<int[]> qos() {
    return Collections.unmodifiableList(this.qos);
  }

  public List<Settlement> settlements() {
    return new ArrayList<>(this.settlements);
  }

  public int unackedCount() {
    return this.unacked.size();
  }

  @Override
  public Connection connection() {
    return this.connection;
  }

  @Override
  public boolean isOpen() {
    return this.open.get();
  }

  @Override
  public void close() {
    this.open.set(false);
  }

  void register(InMemoryQueue queue) {
    this.queues.put(queue.name(), queue);
  }

  InMemoryQueue lookup(String name) {
    return this.queues.get(name);
  }

  void unregister(InMemoryQueue queue) {
    this.queues.remove(queue.name());
  }

  long deliver(InMemoryQueue queue, TestMessage message, boolean autoAck) {
    long tag = this.deliveryTagSequence.incrementAndGet();
    if (!autoAck) {
      this.unacked.put(tag, new Unacked(queue, message));
    }
    return tag;
  }

  void ack(long deliveryTag, boolean multiple) {
    this.settlements.add(new Settlement(Settlement.Type.ACK, deliveryTag, multiple, false));
    for (Unacked u : this.remove(deliveryTag, multiple)) {
      u.queue.acknowledged(u.message);
    }
  }

  void nack(long deliveryTag, boolean multiple, boolean requeue) {
    this.settlements.add(new Settlement(Settlement.Type.NACK, deliveryTag, multiple, requeue));
    this.discard(this.remove(deliveryTag, multiple), requeue);
  }

  void reject(long deliveryTag, boolean requeue) {
    this.settlements.add(new Settlement(Settlement.Type.REJECT, deliveryTag, false, requeue));
    this.discard(this.remove(deliveryTag, false), requeue);
  }

  private void discard(List<Unacked> removed, boolean requeue) {
    for (Unacked u : removed) {
      if (requeue) {
        u.queue.requeue(u.message);
      } else {
        u.queue.dropped(u.message);
      }
    }
  }

  private List<Unacked> remove(long deliveryTag, boolean multiple) {
    List<Unacked> removed = new ArrayList<>();
    if (multiple) {
      List<Long> tags = new ArrayList<>(this.unacked.keySet());
      Collections.sort(tags);
      for (Long tag : tags) {
        if (tag <= deliveryTag) {
          removed.add(this.unacked.remove(tag));
        }
      }
    } else {
      Unacked u = this.unacked.remove(deliveryTag);
      if (u != null) {
        removed.add(u);
      }
    }
    if (removed.isEmpty()) {
      this.open.set(false);
      throw new AmqpException.AmqpChannelException(
          "PRECONDITION_FAILED - unknown delivery tag " + deliveryTag, null);
    }
    return removed;
  }

  private static final class Unacked {

    private final InMemoryQueue queue;
    private final TestMessage message;

    private Unacked(InMemoryQueue queue, TestMessage message) {
      this.queue = queue;
      this.message = message;
    }
  }
}
