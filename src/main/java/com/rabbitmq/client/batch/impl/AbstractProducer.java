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

import com.rabbitmq.client.batch.Attributes;
import com.rabbitmq.client.batch.Exchange;
import com.rabbitmq.client.batch.Producer;
import com.rabbitmq.client.batch.metrics.MetricsCollector;
import com.rabbitmq.client.batch.metrics.NoOpMetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class AbstractProducer implements Producer {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractProducer.class);

  private final Exchange exchange;
  private final Attributes defaultAttributes;
  private final MetricsCollector metricsCollector;

  AbstractProducer(
      Exchange exchange, Attributes defaultAttributes, MetricsCollector metricsCollector) {
    if (exchange == null) {
      throw new IllegalArgumentException("Exchange cannot be null");
    }
    this.exchange = exchange;
    this.defaultAttributes = defaultAttributes;
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
  }

  /**
   * Convert the message to bytes.
   *
   * @param message the message
   * @return the message body
   */
  protected abstract byte[] encode(Object message);

  @Override
  public void publish(Object message, String routingKey) {
    this.publish(message, routingKey, Attributes.empty());
  }

  @Override
  public void publish(Object message, String routingKey, Attributes attributes) {
    Attributes effective =
        attributes == null ? this.defaultAttributes : this.defaultAttributes.merge(attributes);
    byte[] body = this.encode(message);
    this.exchange.publish(body, routingKey, effective);
    this.metricsCollector.publish();
    LOGGER.debug(
        "Published message of {} byte(s) to exchange '{}' with routing key '{}'",
        body.length,
        this.exchange.name(),
        routingKey);
  }

  @Override
  public Exchange exchange() {
    return this.exchange;
  }

  Attributes defaultAttributes() {
    return this.defaultAttributes;
  }
}
