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

import java.time.Duration;
import java.util.Map;

/**
 * Broker queue, created with {@link Channel#newQueue()}.
 *
 * <p>The configuration methods only change the local definition, {@link #declare()} sends it to
 * the broker.
 */
public interface Queue {

  String name();

  Queue name(String name);

  Queue durable(boolean durable);

  Queue exclusive(boolean exclusive);

  Queue autoDelete(boolean autoDelete);

  Queue passive(boolean passive);

  Queue argument(String key, Object value);

  Map<String, Object> arguments();

  /**
   * Declare the queue on the broker.
   *
   * <p>A queue without a name gets a server-generated name, available with {@link #name()} after
   * the call.
   *
   * @return the number of messages in the queue
   */
  long declare();

  void bind(String exchange, String routingKey);

  default void bind(String exchange) {
    bind(exchange, "");
  }

  void unbind(String exchange, String routingKey);

  /**
   * Retrieve a single message if one is available.
   *
   * @param autoAck whether the broker considers the message acknowledged on delivery
   * @return the message, null if the queue is empty
   */
  Envelope get(boolean autoAck);

  /**
   * Subscribe to the queue and dispatch deliveries to the callback.
   *
   * <p>The call blocks the calling thread until the callback returns <code>false</code>, the
   * subscription is then cancelled. The callback is also notified when no message has arrived
   * within the poll timeout.
   *
   * @param consumerTag consumer tag
   * @param pollTimeout maximum time to wait for a delivery before notifying the callback
   * @param callback the delivery callback
   */
  void consume(String consumerTag, Duration pollTimeout, ConsumeCallback callback);

  /**
   * Acknowledge a delivery.
   *
   * @param deliveryTag delivery tag
   * @param multiple true to acknowledge all the deliveries up to and including the tag
   */
  void ack(long deliveryTag, boolean multiple);

  /**
   * Negatively acknowledge one or several deliveries.
   *
   * @param deliveryTag delivery tag
   * @param multiple true to reject all the deliveries up to and including the tag
   * @param requeue whether the broker should requeue the messages
   */
  void nack(long deliveryTag, boolean multiple, boolean requeue);

  /**
   * Reject a single delivery.
   *
   * @param deliveryTag delivery tag
   * @param requeue whether the broker should requeue the message
   */
  void reject(long deliveryTag, boolean requeue);

  void purge();

  void cancel(String consumerTag);

  void delete();

  Channel channel();

  /** Callback for {@link #consume(String, Duration, ConsumeCallback)}. */
  interface ConsumeCallback {

    /**
     * Handle a delivery.
     *
     * @param envelope the message
     * @return false to stop consuming
     */
    boolean onDelivery(Envelope envelope);

    /**
     * Called when no message arrived within the poll timeout.
     *
     * @return false to stop consuming
     */
    default boolean onIdle() {
      return true;
    }
  }
}
