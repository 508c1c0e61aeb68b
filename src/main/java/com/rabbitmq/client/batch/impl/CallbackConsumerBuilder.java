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

import com.rabbitmq.client.batch.Consumer;
import com.rabbitmq.client.batch.ConsumerBuilder;
import com.rabbitmq.client.batch.Queue;
import com.rabbitmq.client.batch.Resource;
import com.rabbitmq.client.batch.metrics.MetricsCollector;
import com.rabbitmq.client.batch.metrics.NoOpMetricsCollector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link ConsumerBuilder} for consumers that delegate to callbacks. */
public class CallbackConsumerBuilder implements ConsumerBuilder {

  static final int DEFAULT_BATCH_SIZE = 50;
  static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(5);

  private Queue queue;
  private Consumer.DeliveryHandler deliveryHandler;
  private Consumer.FlushDeferredHandler flushDeferredHandler;
  private Consumer.ErrorHandler errorHandler;
  private int batchSize = DEFAULT_BATCH_SIZE;
  private Duration idleTimeout = DEFAULT_IDLE_TIMEOUT;
  private String consumerTag;
  private String controlAppId = ControlMessages.DEFAULT_APP_ID;
  private Logger logger = LoggerFactory.getLogger(CallbackConsumer.class);
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private boolean registerShutdownHook = false;
  private final List<Resource.StateListener> listeners = new ArrayList<>();

  @Override
  public CallbackConsumerBuilder queue(Queue queue) {
    this.queue = queue;
    return this;
  }

  @Override
  public CallbackConsumerBuilder deliveryHandler(Consumer.DeliveryHandler handler) {
    this.deliveryHandler = handler;
    return this;
  }

  @Override
  public CallbackConsumerBuilder flushDeferredHandler(Consumer.FlushDeferredHandler handler) {
    this.flushDeferredHandler = handler;
    return this;
  }

  @Override
  public CallbackConsumerBuilder errorHandler(Consumer.ErrorHandler handler) {
    this.errorHandler = handler;
    return this;
  }

  @Override
  public CallbackConsumerBuilder batchSize(int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("Batch size must be greater than 0");
    }
    this.batchSize = batchSize;
    return this;
  }

  @Override
  public CallbackConsumerBuilder idleTimeout(Duration idleTimeout) {
    if (idleTimeout == null || idleTimeout.isNegative() || idleTimeout.isZero()) {
      throw new IllegalArgumentException("Idle timeout must be greater than 0");
    }
    this.idleTimeout = idleTimeout;
    return this;
  }

  @Override
  public CallbackConsumerBuilder consumerTag(String consumerTag) {
    this.consumerTag = consumerTag;
    return this;
  }

  @Override
  public CallbackConsumerBuilder controlAppId(String controlAppId) {
    if (controlAppId == null || controlAppId.isEmpty()) {
      throw new IllegalArgumentException("Control application ID cannot be null or empty");
    }
    this.controlAppId = controlAppId;
    return this;
  }

  @Override
  public CallbackConsumerBuilder logger(Logger logger) {
    if (logger == null) {
      throw new IllegalArgumentException("Logger cannot be null");
    }
    this.logger = logger;
    return this;
  }

  @Override
  public CallbackConsumerBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    return this;
  }

  @Override
  public CallbackConsumerBuilder registerShutdownHook(boolean registerShutdownHook) {
    this.registerShutdownHook = registerShutdownHook;
    return this;
  }

  @Override
  public CallbackConsumerBuilder listeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(Arrays.asList(listeners));
    }
    return this;
  }

  @Override
  public Consumer build() {
    if (this.queue == null) {
      throw new IllegalArgumentException("A queue must be set");
    }
    if (this.deliveryHandler == null) {
      throw new IllegalArgumentException("A delivery handler must be set");
    }
    if (this.consumerTag == null) {
      this.consumerTag = "batch-consumer-" + UUID.randomUUID();
    }
    return new CallbackConsumer(this);
  }

  Queue queue() {
    return this.queue;
  }

  Consumer.DeliveryHandler deliveryHandler() {
    return this.deliveryHandler;
  }

  Consumer.FlushDeferredHandler flushDeferredHandler() {
    return this.flushDeferredHandler;
  }

  Consumer.ErrorHandler errorHandler() {
    return this.errorHandler;
  }

  int batchSize() {
    return this.batchSize;
  }

  Duration idleTimeout() {
    return this.idleTimeout;
  }

  String consumerTag() {
    return this.consumerTag;
  }

  String controlAppId() {
    return this.controlAppId;
  }

  Logger logger() {
    return this.logger;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  boolean registerShutdownHook() {
    return this.registerShutdownHook;
  }

  List<Resource.StateListener> listeners() {
    return this.listeners;
  }
}
