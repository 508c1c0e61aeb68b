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

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Broker exchange, created with {@link Channel#newExchange()}.
 *
 * <p>The configuration methods only change the local definition, {@link #declare()} sends it to
 * the broker. The default exchange has an empty name and must not be declared.
 */
public interface Exchange {

  String name();

  Exchange name(String name);

  Type type();

  Exchange type(Type type);

  Exchange durable(boolean durable);

  Exchange autoDelete(boolean autoDelete);

  Exchange internal(boolean internal);

  Exchange passive(boolean passive);

  Exchange argument(String key, Object value);

  Map<String, Object> arguments();

  /** Declare the exchange on the broker. */
  void declare();

  /** Delete the exchange on the broker. */
  void delete();

  /**
   * Bind this exchange (destination) to another exchange (source).
   *
   * @param source source exchange
   * @param routingKey binding key
   */
  void bind(String source, String routingKey);

  void unbind(String source, String routingKey);

  /**
   * Publish a message.
   *
   * @param body message body
   * @param routingKey routing key, null is the same as an empty string
   * @param flags publishing flags
   * @param attributes message properties
   */
  void publish(byte[] body, String routingKey, Set<PublishFlag> flags, Attributes attributes);

  default void publish(byte[] body, String routingKey, Attributes attributes) {
    publish(body, routingKey, Collections.emptySet(), attributes);
  }

  default void publish(byte[] body, String routingKey) {
    publish(body, routingKey, Collections.emptySet(), Attributes.empty());
  }

  Channel channel();

  /** Exchange type. */
  enum Type {
    DIRECT,
    FANOUT,
    TOPIC,
    HEADERS;

    /**
     * Name of the type as expected by the broker.
     *
     * @return the broker type name
     */
    public String brokerName() {
      return this.name().toLowerCase(java.util.Locale.ENGLISH);
    }
  }

  /** Publishing flags. */
  enum PublishFlag {
    /** Ask the broker to return the message if it cannot be routed. */
    MANDATORY
  }
}
