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

import java.util.Date;
import java.util.Map;

/**
 * A message received from a {@link Queue}, with its broker-assigned metadata.
 *
 * <p>Instances are created by the broker adapter and are read-only.
 */
public interface Envelope {

  /**
   * The message body.
   *
   * @return body, never null
   */
  byte[] body();

  /**
   * Broker handle of this delivery, used to acknowledge or reject it.
   *
   * @return delivery tag
   */
  long deliveryTag();

  /**
   * Whether the message has been delivered before (e.g. requeued).
   *
   * @return true for a redelivery
   */
  boolean isRedelivery();

  String routingKey();

  String exchangeName();

  String contentType();

  String contentEncoding();

  String correlationId();

  String replyTo();

  String expiration();

  String messageId();

  Date timestamp();

  String type();

  String userId();

  String appId();

  Integer priority();

  Integer deliveryMode();

  /**
   * Message headers.
   *
   * @return headers, empty if the message has none
   */
  Map<String, Object> headers();

  /**
   * Value of a header.
   *
   * @param name header name
   * @return the value, null if the header is not set
   */
  default Object header(String name) {
    return headers().get(name);
  }

  /**
   * Whether the header is set.
   *
   * @param name header name
   * @return true if the message has the header
   */
  default boolean hasHeader(String name) {
    return headers().containsKey(name);
  }
}
