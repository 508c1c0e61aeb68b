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

import com.rabbitmq.client.batch.Attributes;
import com.rabbitmq.client.batch.Envelope;
import com.rabbitmq.client.batch.Exchange;
import com.rabbitmq.client.batch.Queue;
import com.rabbitmq.client.batch.metrics.MetricsCollector;
import java.time.Duration;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-RPC client over a queue.
 *
 * <p>Requests are sent with {@link #addRequest(JsonRpcRequest)}, responses are collected afterwards
 * with {@link #getResponseCollection(Duration)}. The client is not thread-safe.
 *
 * @see JsonRpcClientBuilder
 */
public class JsonRpcClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonRpcClient.class);

  private final Queue replyQueue;
  private final Map<String, Exchange> exchanges;
  private final String appId;
  private final Duration waitInterval;
  private final MetricsCollector metricsCollector;
  private final Set<String> pendingRequests = new LinkedHashSet<>();

  JsonRpcClient(JsonRpcClientBuilder builder) {
    this.replyQueue = builder.replyQueue();
    this.exchanges = builder.exchanges();
    this.appId = builder.appId();
    this.waitInterval = builder.waitInterval();
    this.metricsCollector = builder.metricsCollector();
  }

  /**
   * Send a request.
   *
   * @param request the request, its server must be known by the client
   * @throws IllegalArgumentException if the server is unknown or if a pending request has the same
   *     ID
   */
  public void addRequest(JsonRpcRequest request) {
    Exchange exchange = this.exchanges.get(request.server());
    if (exchange == null) {
      throw new IllegalArgumentException("Unknown server: " + request.server());
    }
    if (request.id() != null && this.pendingRequests.contains(request.id())) {
      throw new IllegalArgumentException("Duplicate request ID: " + request.id());
    }
    Attributes attributes =
        Attributes.builder()
            .contentType(JsonRpcCodec.CONTENT_TYPE)
            .contentEncoding(JsonRpcCodec.CONTENT_ENCODING)
            .deliveryMode(Attributes.DELIVERY_MODE_NON_PERSISTENT)
            .correlationId(request.id())
            .type(request.method())
            .replyTo(this.replyQueue.name())
            .appId(this.appId)
            .timestamp(new Date())
            .expiration(request.expiration())
            .header(JsonRpcCodec.VERSION_HEADER, JsonRpcCodec.VERSION)
            .build();
    exchange.publish(JsonRpcCodec.encode(request.params()), request.server(), attributes);
    this.metricsCollector.publish();
    if (request.id() != null) {
      this.pendingRequests.add(request.id());
    }
    LOGGER.debug("Sent request {}", request);
  }

  /**
   * Wait for the responses of the pending requests.
   *
   * <p>Pending requests are forgotten when the method returns, late responses are dropped.
   *
   * @param timeout maximum time to wait
   * @return the received responses
   */
  public ResponseCollection getResponseCollection(Duration timeout) {
    ResponseCollection responses = new ResponseCollection();
    long deadline = System.nanoTime() + timeout.toNanos();
    try {
      while (responses.size() < this.pendingRequests.size()) {
        Envelope envelope = this.replyQueue.get(true);
        if (envelope != null) {
          this.handleReply(envelope, responses);
        } else if (System.nanoTime() < deadline) {
          Thread.sleep(this.waitInterval.toMillis());
        }
        if (System.nanoTime() >= deadline) {
          break;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      if (responses.size() < this.pendingRequests.size()) {
        LOGGER.debug(
            "Received {} response(s) for {} request(s)",
            responses.size(),
            this.pendingRequests.size());
      }
      this.pendingRequests.clear();
    }
    return responses;
  }

  int pendingRequestCount() {
    return this.pendingRequests.size();
  }

  private void handleReply(Envelope envelope, ResponseCollection responses) {
    String id = envelope.correlationId();
    if (id == null || !this.pendingRequests.contains(id) || responses.hasResponse(id)) {
      LOGGER.warn("Dropping reply with unexpected correlation ID {}", id);
      return;
    }
    JsonRpcResponse response;
    try {
      response = JsonRpcCodec.decodeResponse(id, envelope.body());
    } catch (RuntimeException e) {
      LOGGER.warn("Invalid reply for request {}: {}", id, e.getMessage());
      response = JsonRpcResponse.withError(id, new JsonRpcError(JsonRpcError.PARSE_ERROR));
    }
    responses.add(response);
  }
}
