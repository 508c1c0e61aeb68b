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
package com.rabbitmq.client.batch.metrics;

/** Interface to collect execution data of consumers and producers. */
public interface MetricsCollector {

  /** Called when a {@link com.rabbitmq.client.batch.Consumer} starts consuming. */
  void openConsumer();

  /** Called when a {@link com.rabbitmq.client.batch.Consumer} stops consuming. */
  void closeConsumer();

  /** Called when a message is dispatched to a {@link com.rabbitmq.client.batch.Consumer}. */
  void consume();

  /**
   * Called when a single message is settled by a {@link com.rabbitmq.client.batch.Consumer}.
   *
   * @param disposition disposition (outcome)
   */
  void consumeDisposition(ConsumeDisposition disposition);

  /**
   * Called when a batch of deferred messages is settled.
   *
   * @param batchSize number of messages in the batch
   * @param disposition outcome of the batch, {@link ConsumeDisposition#ACKNOWLEDGED} or {@link
   *     ConsumeDisposition#REJECTED}
   */
  void flush(int batchSize, ConsumeDisposition disposition);

  /** Called when a message (e.g. an RPC reply) is published. */
  void publish();

  /** The client-to-broker dispositions. */
  enum ConsumeDisposition {
    /** see {@link com.rabbitmq.client.batch.DeliveryResult#ACK} */
    ACKNOWLEDGED,
    /** see {@link com.rabbitmq.client.batch.DeliveryResult#REJECT} */
    REJECTED,
    /** see {@link com.rabbitmq.client.batch.DeliveryResult#REJECT_REQUEUE} */
    REQUEUED
  }
}
