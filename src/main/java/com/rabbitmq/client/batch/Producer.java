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

/**
 * API to publish application messages to an {@link Exchange}.
 *
 * <p>Each producer has default {@link Attributes} (content type, encoding...) combined with the
 * attributes provided on each call.
 *
 * @see com.rabbitmq.client.batch.impl.JsonProducer
 * @see com.rabbitmq.client.batch.impl.PlainProducer
 */
public interface Producer {

  /**
   * Publish a message.
   *
   * @param message the message, converted to bytes by the producer
   * @param routingKey routing key
   */
  void publish(Object message, String routingKey);

  /**
   * Publish a message with specific attributes.
   *
   * @param message the message, converted to bytes by the producer
   * @param routingKey routing key
   * @param attributes attributes, they take precedence over the default attributes
   */
  void publish(Object message, String routingKey, Attributes attributes);

  /**
   * The exchange messages are published to.
   *
   * @return the exchange
   */
  Exchange exchange();
}
