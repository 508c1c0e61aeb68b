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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Broker-less {@link Exchange}.
 *
 * <p>Published messages are recorded. Messages published to the default exchange are routed to
 * the declared queue named after the routing key.
 */
public final class InMemoryExchange implements Exchange {

  private final InMemoryChannel channel;
  private final Map<String, Object> arguments = new LinkedHashMap<>();
  private final List<TestMessage> published = new CopyOnWriteArrayList<>();
  private String name = "";
  private Type type = Type.DIRECT;
  private RuntimeException publishFailure;

  InMemoryExchange(InMemoryChannel channel) {
    this.channel = channel;
  }

  public List<TestMessage> published() {
    return new ArrayList<>(this.published);
  }

  /**
   * Make the next publications fail.
   *
   * @param failure the exception to throw, null to stop failing
   */
  public void failPublishing(RuntimeException failure) {
    this.publishFailure = failure;
  }

  @Override
  public String name() {
    return this.name;
  }

  @Override
  public Exchange name(String name) {
    this.name = name == null ? "" : name;
    return this;
  }

  @Override
  public Type type() {
    return this.type;
  }

  @Override
  public Exchange type(Type type) {
    this.type = type;
    return this;
  }

  @Override
  public Exchange durable(boolean durable) {
    return this;
  }

  @Override
  public Exchange autoDelete(boolean autoDelete) {
    return this;
  }

  @Override
  public Exchange internal(boolean internal) {
    return this;
  }

  @Override
  public Exchange passive(boolean passive) {
    return this;
  }

  @Override
  public Exchange argument(String key, Object value) {
    this.arguments.put(key, value);
    return this;
  }

  @Override
  public Map<String, Object> arguments() {
    return Collections.unmodifiableMap(this.arguments);
  }

  @Override
  public void declare() {}

  @Override
  public void delete() {}

  @Override
  public void bind(String source, String routingKey) {}

  @Override
  public void unbind(String source, String routingKey) {}

  @Override
  public void publish(
      byte[] body, String routingKey, Set<PublishFlag> flags, Attributes attributes) {
    if (this.publishFailure != null) {
      throw this.publishFailure;
    }
    TestMessage message = new TestMessage(body, this.name, routingKey, attributes, false);
    this.published.add(message);
    if (this.name.isEmpty() && routingKey != null) {
      InMemoryQueue queue = this.channel.lookup(routingKey);
      if (queue != null) {
        queue.route(message);
      }
    }
  }

  @Override
  public InMemoryChannel channel() {
    return this.channel;
  }
}
