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
package com.rabbitmq.client.batch.amqp091;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.batch.Attributes;
import com.rabbitmq.client.batch.Channel;
import com.rabbitmq.client.batch.Exchange;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

final class AmqpClientExchange implements Exchange {

  private final AmqpClientChannel channel;
  private final Map<String, Object> arguments = new LinkedHashMap<>();
  private String name = "";
  private Type type = Type.DIRECT;
  private boolean durable = false;
  private boolean autoDelete = false;
  private boolean internal = false;
  private boolean passive = false;

  AmqpClientExchange(AmqpClientChannel channel) {
    this.channel = channel;
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
    this.durable = durable;
    return this;
  }

  @Override
  public Exchange autoDelete(boolean autoDelete) {
    this.autoDelete = autoDelete;
    return this;
  }

  @Override
  public Exchange internal(boolean internal) {
    this.internal = internal;
    return this;
  }

  @Override
  public Exchange passive(boolean passive) {
    this.passive = passive;
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
  public void declare() {
    if (this.name.isEmpty()) {
      throw new IllegalStateException("The default exchange cannot be declared");
    }
    try {
      if (this.passive) {
        this.delegate().exchangeDeclarePassive(this.name);
      } else {
        this.delegate()
            .exchangeDeclare(
                this.name,
                this.type.brokerName(),
                this.durable,
                this.autoDelete,
                this.internal,
                this.arguments);
      }
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertExchangeError(e, "Error while declaring exchange '%s'", name);
    }
  }

  @Override
  public void delete() {
    try {
      this.delegate().exchangeDelete(this.name);
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertExchangeError(e, "Error while deleting exchange '%s'", name);
    }
  }

  @Override
  public void bind(String source, String routingKey) {
    try {
      this.delegate().exchangeBind(this.name, source, routingKey(routingKey));
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertExchangeError(
          e, "Error while binding exchange '%s' to '%s'", name, source);
    }
  }

  @Override
  public void unbind(String source, String routingKey) {
    try {
      this.delegate().exchangeUnbind(this.name, source, routingKey(routingKey));
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertExchangeError(
          e, "Error while unbinding exchange '%s' from '%s'", name, source);
    }
  }

  @Override
  public void publish(
      byte[] body, String routingKey, Set<PublishFlag> flags, Attributes attributes) {
    boolean mandatory = flags != null && flags.contains(PublishFlag.MANDATORY);
    try {
      this.delegate()
          .basicPublish(
              this.name, routingKey(routingKey), mandatory, properties(attributes), body);
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convertExchangeError(
          e, "Error while publishing to exchange '%s'", name);
    }
  }

  @Override
  public Channel channel() {
    return this.channel;
  }

  static AMQP.BasicProperties properties(Attributes attributes) {
    if (attributes == null) {
      return new AMQP.BasicProperties();
    }
    return new AMQP.BasicProperties.Builder()
        .contentType(attributes.contentType())
        .contentEncoding(attributes.contentEncoding())
        .deliveryMode(attributes.deliveryMode())
        .priority(attributes.priority())
        .correlationId(attributes.correlationId())
        .replyTo(attributes.replyTo())
        .expiration(attributes.expiration())
        .messageId(attributes.messageId())
        .timestamp(attributes.timestamp())
        .type(attributes.type())
        .userId(attributes.userId())
        .appId(attributes.appId())
        .headers(attributes.headers().isEmpty() ? null : attributes.headers())
        .build();
  }

  private static String routingKey(String routingKey) {
    return routingKey == null ? "" : routingKey;
  }

  private com.rabbitmq.client.Channel delegate() {
    return this.channel.delegate();
  }
}
