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

import com.rabbitmq.client.batch.metrics.MetricsCollector;
import java.time.Duration;
import org.slf4j.Logger;

/**
 * API to configure and create a {@link Consumer}.
 *
 * @see com.rabbitmq.client.batch.impl.CallbackConsumerBuilder
 */
public interface ConsumerBuilder {

  /**
   * The queue to consume from.
   *
   * @param queue queue
   * @return this builder instance
   */
  ConsumerBuilder queue(Queue queue);

  /**
   * The callback for inbound messages.
   *
   * @param handler callback
   * @return this builder instance
   */
  ConsumerBuilder deliveryHandler(Consumer.DeliveryHandler handler);

  /**
   * The callback to decide on the outcome of a batch of deferred messages.
   *
   * <p>Default is to acknowledge the batch.
   *
   * @param handler callback
   * @return this builder instance
   */
  ConsumerBuilder flushDeferredHandler(Consumer.FlushDeferredHandler handler);

  /**
   * The callback for failures of the delivery and flush handlers.
   *
   * @param handler callback
   * @return this builder instance
   */
  ConsumerBuilder errorHandler(Consumer.ErrorHandler handler);

  /**
   * The number of deferred messages that triggers a flush.
   *
   * <p>Default is 50.
   *
   * @param batchSize batch size
   * @return this builder instance
   */
  ConsumerBuilder batchSize(int batchSize);

  /**
   * Time after which deferred messages are flushed even if the batch is not full.
   *
   * <p>Default is 5 seconds.
   *
   * @param idleTimeout idle timeout
   * @return this builder instance
   */
  ConsumerBuilder idleTimeout(Duration idleTimeout);

  /**
   * The consumer tag to use for the subscription.
   *
   * <p>Default is a random value.
   *
   * @param consumerTag consumer tag
   * @return this builder instance
   */
  ConsumerBuilder consumerTag(String consumerTag);

  /**
   * The application ID that identifies control messages (shutdown, reconfigure).
   *
   * @param controlAppId control application ID
   * @return this builder instance
   */
  ConsumerBuilder controlAppId(String controlAppId);

  /**
   * The logger the consumer reports its activity to.
   *
   * @param logger logger
   * @return this builder instance
   */
  ConsumerBuilder logger(Logger logger);

  ConsumerBuilder metricsCollector(MetricsCollector metricsCollector);

  /**
   * Whether to register a JVM shutdown hook that stops the consumer gracefully.
   *
   * <p>Default is false.
   *
   * @param registerShutdownHook true to register the hook
   * @return this builder instance
   */
  ConsumerBuilder registerShutdownHook(boolean registerShutdownHook);

  /**
   * Add {@link com.rabbitmq.client.batch.Resource.StateListener}s to the consumer.
   *
   * @param listeners listeners
   * @return this builder instance
   */
  ConsumerBuilder listeners(Resource.StateListener... listeners);

  /**
   * Build the consumer.
   *
   * @return the configured consumer instance
   */
  Consumer build();
}
