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

import java.util.Date;

/**
 * JSON-RPC request.
 *
 * <p>On the server side, requests are created from the incoming messages. On the client side, use
 * {@link #request(String, String, Object, String)} or {@link #notification(String, String,
 * Object)}.
 */
public final class JsonRpcRequest {

  private final String exchange;
  private final String method;
  private final Object params;
  private final String id;
  private final String routingKey;
  private final String expiration;
  private final Date timestamp;

  public JsonRpcRequest(
      String exchange,
      String method,
      Object params,
      String id,
      String routingKey,
      String expiration,
      Date timestamp) {
    this.exchange = exchange;
    this.method = method;
    this.params = params;
    this.id = id;
    this.routingKey = routingKey;
    this.expiration = expiration;
    this.timestamp = timestamp;
  }

  /**
   * Create a request that expects a response.
   *
   * @param server the server name, used as routing key
   * @param method the method
   * @param params the parameters, serialized to JSON
   * @param id the request ID
   * @return the request
   */
  public static JsonRpcRequest request(String server, String method, Object params, String id) {
    if (id == null) {
      throw new IllegalArgumentException("Request ID cannot be null, use a notification instead");
    }
    return new JsonRpcRequest(null, method, params, id, server, null, null);
  }

  /**
   * Create a request that does not expect any response.
   *
   * @param server the server name, used as routing key
   * @param method the method
   * @param params the parameters, serialized to JSON
   * @return the request
   */
  public static JsonRpcRequest notification(String server, String method, Object params) {
    return new JsonRpcRequest(null, method, params, null, server, null, null);
  }

  /**
   * Copy of this request with a message expiration.
   *
   * @param expiration expiration in milliseconds, as expected by the broker
   * @return the new request
   */
  public JsonRpcRequest expiration(String expiration) {
    return new JsonRpcRequest(
        this.exchange,
        this.method,
        this.params,
        this.id,
        this.routingKey,
        expiration,
        this.timestamp);
  }

  public String exchange() {
    return this.exchange;
  }

  public String method() {
    return this.method;
  }

  public Object params() {
    return this.params;
  }

  public String id() {
    return this.id;
  }

  public boolean isNotification() {
    return this.id == null;
  }

  public String routingKey() {
    return this.routingKey;
  }

  /**
   * The server the request is for, that is the routing key.
   *
   * @return the server name
   */
  public String server() {
    return this.routingKey;
  }

  public String expiration() {
    return this.expiration;
  }

  public Date timestamp() {
    return this.timestamp;
  }

  @Override
  public String toString() {
    return "JsonRpcRequest{"
        + "method='"
        + method
        + '\''
        + ", id='"
        + id
        + '\''
        + ", routingKey='"
        + routingKey
        + '\''
        + '}';
  }
}
