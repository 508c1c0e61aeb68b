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

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.rabbitmq.client.batch.Attributes;
import com.rabbitmq.client.batch.Envelope;
import com.rabbitmq.client.batch.Exchange;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * In-band commands for consumers.
 *
 * <p>A control message carries the control application ID (default {@link #DEFAULT_APP_ID}) and
 * its command in the message type. The <code>reconfigure</code> body is a JSON array of integers:
 * <code>[prefetchCount, idleTimeoutSeconds, batchSize, prefetchSize, global]</code>, the last two
 * values are optional.
 */
public final class ControlMessages {

  public static final String DEFAULT_APP_ID = "rabbitmq-batch-consumer";
  public static final String SHUTDOWN = "shutdown";
  public static final String RECONFIGURE = "reconfigure";

  private static final Gson GSON = new Gson();

  private ControlMessages() {}

  static boolean isControlMessage(Envelope envelope, String controlAppId) {
    return controlAppId.equals(envelope.appId());
  }

  /**
   * Attributes of a shutdown message.
   *
   * @return shutdown message attributes
   */
  public static Attributes shutdownMessage() {
    return shutdownMessage(DEFAULT_APP_ID);
  }

  public static Attributes shutdownMessage(String controlAppId) {
    return Attributes.builder().appId(controlAppId).type(SHUTDOWN).build();
  }

  /**
   * Attributes of a reconfigure message.
   *
   * <p>To use with {@link #reconfigureBody(int, Duration, int)}.
   *
   * @return reconfigure message attributes
   */
  public static Attributes reconfigureMessage() {
    return reconfigureMessage(DEFAULT_APP_ID);
  }

  public static Attributes reconfigureMessage(String controlAppId) {
    return Attributes.builder()
        .appId(controlAppId)
        .type(RECONFIGURE)
        .contentType("application/json")
        .contentEncoding("UTF-8")
        .build();
  }

  public static byte[] reconfigureBody(int prefetchCount, Duration idleTimeout, int batchSize) {
    return reconfigureBody(prefetchCount, idleTimeout, batchSize, 0, false);
  }

  public static byte[] reconfigureBody(
      int prefetchCount, Duration idleTimeout, int batchSize, int prefetchSize, boolean global) {
    int[] values =
        new int[] {
          prefetchCount, (int) idleTimeout.getSeconds(), batchSize, prefetchSize, global ? 1 : 0
        };
    return GSON.toJson(values).getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Publish a shutdown message to an exchange.
   *
   * @param exchange the exchange the consumer queue is bound to
   * @param routingKey routing key
   */
  public static void publishShutdown(Exchange exchange, String routingKey) {
    exchange.publish(new byte[0], routingKey, shutdownMessage());
  }

  public static void publishReconfigure(
      Exchange exchange, String routingKey, int prefetchCount, Duration idleTimeout, int batchSize) {
    exchange.publish(
        reconfigureBody(prefetchCount, idleTimeout, batchSize), routingKey, reconfigureMessage());
  }

  static Reconfiguration parseReconfiguration(byte[] body) {
    if (body == null || body.length == 0) {
      throw new IllegalArgumentException("Empty reconfigure message");
    }
    JsonElement element;
    try {
      JsonReader reader = new JsonReader(new StringReader(new String(body, StandardCharsets.UTF_8)));
      reader.setLenient(false);
      element = GSON.getAdapter(JsonElement.class).read(reader);
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        throw new IllegalArgumentException("Trailing content in reconfigure message");
      }
    } catch (IOException | JsonParseException e) {
      throw new IllegalArgumentException("Reconfigure message is not valid JSON", e);
    }
    if (!element.isJsonArray()) {
      throw new IllegalArgumentException("Reconfigure message must be a JSON array");
    }
    JsonArray array = element.getAsJsonArray();
    if (array.size() < 3) {
      throw new IllegalArgumentException(
          "Reconfigure message must contain at least 3 values, got " + array.size());
    }
    int prefetchCount = intAt(array, 0);
    int idleTimeoutSeconds = intAt(array, 1);
    int batchSize = intAt(array, 2);
    int prefetchSize = array.size() > 3 ? intAt(array, 3) : 0;
    boolean global = array.size() > 4 && intAt(array, 4) != 0;
    if (prefetchCount < 0 || prefetchSize < 0) {
      throw new IllegalArgumentException("Prefetch values must be positive or 0");
    }
    if (idleTimeoutSeconds <= 0) {
      throw new IllegalArgumentException("Idle timeout must be greater than 0");
    }
    if (batchSize <= 0) {
      throw new IllegalArgumentException("Batch size must be greater than 0");
    }
    return new Reconfiguration(
        prefetchCount, Duration.ofSeconds(idleTimeoutSeconds), batchSize, prefetchSize, global);
  }

  private static int intAt(JsonArray array, int index) {
    JsonElement element = array.get(index);
    if (!element.isJsonPrimitive() || !((JsonPrimitive) element).isNumber()) {
      throw new IllegalArgumentException("Value at index " + index + " is not a number");
    }
    double value = element.getAsDouble();
    if (value != Math.rint(value) || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
      throw new IllegalArgumentException("Value at index " + index + " is not an integer");
    }
    return (int) value;
  }

  static final class Reconfiguration {

    private final int prefetchCount;
    private final Duration idleTimeout;
    private final int batchSize;
    private final int prefetchSize;
    private final boolean global;

    Reconfiguration(
        int prefetchCount, Duration idleTimeout, int batchSize, int prefetchSize, boolean global) {
      this.prefetchCount = prefetchCount;
      this.idleTimeout = idleTimeout;
      this.batchSize = batchSize;
      this.prefetchSize = prefetchSize;
      this.global = global;
    }

    int prefetchCount() {
      return this.prefetchCount;
    }

    Duration idleTimeout() {
      return this.idleTimeout;
    }

    int batchSize() {
      return this.batchSize;
    }

    int prefetchSize() {
      return this.prefetchSize;
    }

    boolean global() {
      return this.global;
    }
  }
}
