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
import com.rabbitmq.client.LongString;
import com.rabbitmq.client.batch.Envelope;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

final class AmqpClientEnvelope implements Envelope {

  private final com.rabbitmq.client.Envelope envelope;
  private final AMQP.BasicProperties properties;
  private final byte[] body;
  private final Map<String, Object> headers;

  AmqpClientEnvelope(
      com.rabbitmq.client.Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
    this.envelope = envelope;
    this.properties = properties == null ? new AMQP.BasicProperties() : properties;
    this.body = body == null ? new byte[0] : body;
    this.headers = headers(this.properties.getHeaders());
  }

  @Override
  public byte[] body() {
    return this.body;
  }

  @Override
  public long deliveryTag() {
    return this.envelope.getDeliveryTag();
  }

  @Override
  public boolean isRedelivery() {
    return this.envelope.isRedeliver();
  }

  @Override
  public String routingKey() {
    return this.envelope.getRoutingKey();
  }

  @Override
  public String exchangeName() {
    return this.envelope.getExchange();
  }

  @Override
  public String contentType() {
    return this.properties.getContentType();
  }

  @Override
  public String contentEncoding() {
    return this.properties.getContentEncoding();
  }

  @Override
  public String correlationId() {
    return this.properties.getCorrelationId();
  }

  @Override
  public String replyTo() {
    return this.properties.getReplyTo();
  }

  @Override
  public String expiration() {
    return this.properties.getExpiration();
  }

  @Override
  public String messageId() {
    return this.properties.getMessageId();
  }

  @Override
  public Date timestamp() {
    return this.properties.getTimestamp();
  }

  @Override
  public String type() {
    return this.properties.getType();
  }

  @Override
  public String userId() {
    return this.properties.getUserId();
  }

  @Override
  public String appId() {
    return this.properties.getAppId();
  }

  @Override
  public Integer priority() {
    return this.properties.getPriority();
  }

  @Override
  public Integer deliveryMode() {
    return this.properties.getDeliveryMode();
  }

  @Override
  public Map<String, Object> headers() {
    return this.headers;
  }

  private static Map<String, Object> headers(Map<String, Object> headers) {
    if (headers == null || headers.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, Object> result = new LinkedHashMap<>(headers.size());
    headers.forEach((k, v) -> result.put(k, value(v)));
    return Collections.unmodifiableMap(result);
  }

  @SuppressWarnings("unchecked")
  private static Object value(Object value) {
    if (value instanceof LongString) {
      return value.toString();
    } else if (value instanceof List) {
      return ((List<Object>) value)
          .stream().map(AmqpClientEnvelope::value).collect(Collectors.toList());
    } else if (value instanceof Map) {
      return headers((Map<String, Object>) value);
    } else {
      return value;
    }
  }

  @Override
  public String toString() {
    return "AmqpClientEnvelope{"
        + "deliveryTag="
        + deliveryTag()
        + ", exchange='"
        + exchangeName()
        + '\''
        + ", routingKey='"
        + routingKey()
        + '\''
        + '}';
  }
}
