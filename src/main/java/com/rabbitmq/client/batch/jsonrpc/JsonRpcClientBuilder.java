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

import com.rabbitmq.client.batch.Exchange;
import com.rabbitmq.client.batch.Queue;
import com.rabbitmq.client.batch.metrics.MetricsCollector;
import com.rabbitmq.client.batch.metrics.NoOpMetricsCollector;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/** Builder for {@link JsonRpcClient}. */
public class JsonRpcClientBuilder {

  private Queue replyQueue;
  private final Map<String, Exchange> exchanges = new LinkedHashMap<>();
  private String appId = "";
  private Duration waitInterval = Duration.ofMillis(100);
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;

  /**
   * The queue responses arrive on.
   *
   * <p>It is usually an exclusive, server-named queue.
   *
   * @param replyQueue reply queue
   * @return this builder instance
   */
  public JsonRpcClientBuilder replyQueue(Queue replyQueue) {
    this.replyQueue = replyQueue;
    return this;
  }

  /**
   * Register a server.
   *
   * @param server server name, used as routing key of the requests
   * @param exchange exchange to publish the requests of the server to
   * @return this builder instance
   */
  public JsonRpcClientBuilder server(String server, Exchange exchange) {
    if (server == null || exchange == null) {
      throw new IllegalArgumentException("Server name and exchange cannot be null");
    }
    this.exchanges.put(server, exchange);
    return this;
  }

  public JsonRpcClientBuilder appId(String appId) {
    this.appId = appId;
    return this;
  }

  /**
   * Time to wait between 2 polls of the reply queue when it is empty.
   *
   * @param waitInterval wait interval
   * @return this builder instance
   */
  public JsonRpcClientBuilder waitInterval(Duration waitInterval) {
    if (waitInterval == null || waitInterval.isNegative()) {
      throw new IllegalArgumentException("Wait interval must be positive");
    }
    this.waitInterval = waitInterval;
    return this;
  }

  public JsonRpcClientBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    return this;
  }

  public JsonRpcClient build() {
    if (this.replyQueue == null) {
      throw new IllegalArgumentException("A reply queue must be set");
    }
    if (this.exchanges.isEmpty()) {
      throw new IllegalArgumentException("At least one server must be registered");
    }
    return new JsonRpcClient(this);
  }

  Queue replyQueue() {
    return this.replyQueue;
  }

  Map<String, Exchange> exchanges() {
    return new LinkedHashMap<>(this.exchanges);
  }

  String appId() {
    return this.appId;
  }

  Duration waitInterval() {
    return this.waitInterval;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }
}
