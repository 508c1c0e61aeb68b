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
package com.rabbitmq.client.batch.jsonrpc;

import com.rabbitmq.client.batch.Queue;
import com.rabbitmq.client.batch.Resource;
import com.rabbitmq.client.batch.impl.ControlMessages;
import com.rabbitmq.client.batch.metrics.MetricsCollector;
import com.rabbitmq.client.batch.metrics.NoOpMetricsCollector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builder for {@link JsonRpcServer}. */
public class JsonRpcServerBuilder {

  private Queue queue;
  private JsonRpcServer.Handler handler;
  private Duration idleTimeout = Duration.ofSeconds(5);
  private String consumerTag;
  private String appId = "";
  private String controlAppId = ControlMessages.DEFAULT_APP_ID;
  private String replyExchange = "";
  private Logger logger = LoggerFactory.getLogger(JsonRpcServer.class);
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private boolean registerShutdownHook = false;
  private final List<Resource.StateListener> listeners = new ArrayList<>();

  /**
   * The queue requests arrive on.
   *
   * @param queue request queue
   * @return this builder instance
   */
  public JsonRpcServerBuilder queue(Queue queue) {
    this.queue = queue;
    return this;
  }

  /**
   * The application handler.
   *
   * @param handler handler
   * @return this builder instance
   */
  public JsonRpcServerBuilder handler(JsonRpcServer.Handler handler) {
    this.handler = handler;
    return this;
  }

  public JsonRpcServerBuilder idleTimeout(Duration idleTimeout) {
    if (idleTimeout == null || idleTimeout.isNegative() || idleTimeout.isZero()) {
      throw new IllegalArgumentException("Idle timeout must be greater than 0");
    }
    this.idleTimeout = idleTimeout;
    return this;
  }

  public JsonRpcServerBuilder consumerTag(String consumerTag) {
    this.consumerTag = consumerTag;
    return this;
  }

  /**
   * The application ID of the replies.
   *
   * @param appId application ID
   * @return this builder instance
   */
  public JsonRpcServerBuilder appId(String appId) {
    this.appId = appId;
    return this;
  }

  public JsonRpcServerBuilder controlAppId(String controlAppId) {
    if (controlAppId == null || controlAppId.isEmpty()) {
      throw new IllegalArgumentException("Control application ID cannot be null or empty");
    }
    this.controlAppId = controlAppId;
    return this;
  }

  /**
   * The exchange replies are published to.
   *
   * <p>Default is the default exchange, which routes replies directly to the reply-to queue.
   *
   * @param replyExchange exchange name
   * @return this builder instance
   */
  public JsonRpcServerBuilder replyExchange(String replyExchange) {
    this.replyExchange = replyExchange == null ? "" : replyExchange;
    return this;
  }

  public JsonRpcServerBuilder logger(Logger logger) {
    if (logger == null) {
      throw new IllegalArgumentException("Logger cannot be null");
    }
    this.logger = logger;
    return this;
  }

  public JsonRpcServerBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    return this;
  }

  public JsonRpcServerBuilder registerShutdownHook(boolean registerShutdownHook) {
    this.registerShutdownHook = registerShutdownHook;
    return this;
  }

  public JsonRpcServerBuilder listeners(Resource.StateListener... listeners) {
    this.listeners.addAll(Arrays.asList(listeners));
    return this;
  }

  public JsonRpcServer build() {
    if (this.queue == null) {
      throw new IllegalArgumentException("A queue must be set");
    }
    if (this.handler == null) {
      throw new IllegalArgumentException("A handler must be set");
    }
    if (this.consumerTag == null) {
      this.consumerTag = "json-rpc-server-" + UUID.randomUUID();
    }
    return new JsonRpcServer(this);
  }

  Queue queue() {
    return this.queue;
  }

  JsonRpcServer.Handler handler() {
    return this.handler;
  }

  Duration idleTimeout() {
    return this.idleTimeout;
  }

  String consumerTag() {
    return this.consumerTag;
  }

  String appId() {
    return this.appId;
  }

  String controlAppId() {
    return this.controlAppId;
  }

  String replyExchange() {
    return this.replyExchange;
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
