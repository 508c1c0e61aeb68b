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
import com.rabbitmq.client.batch.metrics.MetricsCollector;
import java.nio.charset.StandardCharsets;

/**
 * {@link com.rabbitmq.client.batch.Producer} for text messages.
 *
 * <p>Byte arrays are sent as is, other messages as their {@link Object#toString()} value.
 */
public class PlainProducer extends AbstractProducer {

  public static final String CONTENT_TYPE = "text/plain";

  public PlainProducer(Exchange exchange) {
    this(exchange, Attributes.empty(), null);
  }

  public PlainProducer(
      Exchange exchange, Attributes defaultAttributes, MetricsCollector metricsCollector) {
    super(
        exchange,
        Attributes.builder()
            .contentType(CONTENT_TYPE)
            .contentEncoding("UTF-8")
            .build()
            .merge(defaultAttributes),
        metricsCollector);
  }

  @Override
  protected byte[] encode(Object message) {
    if (message == null) {
      return new byte[0];
    } else if (message instanceof byte[]) {
      return (byte[]) message;
    } else {
      return message.toString().getBytes(StandardCharsets.UTF_8);
    }
  }
}
