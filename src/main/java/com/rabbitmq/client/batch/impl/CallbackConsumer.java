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

import com.rabbitmq.client.batch.DeliveryResult;
import com.rabbitmq.client.batch.Envelope;
import com.rabbitmq.client.batch.FlushDeferredResult;

final class CallbackConsumer extends AbstractConsumer {

  private final DeliveryHandler deliveryHandler;
  private final FlushDeferredHandler flushDeferredHandler;
  private final ErrorHandler errorHandler;

  CallbackConsumer(CallbackConsumerBuilder builder) {
    super(
        builder.queue(),
        builder.consumerTag(),
        builder.controlAppId(),
        builder.batchSize(),
        builder.idleTimeout(),
        builder.logger(),
        builder.metricsCollector(),
        builder.registerShutdownHook(),
        builder.listeners());
    this.deliveryHandler = builder.deliveryHandler();
    this.flushDeferredHandler = builder.flushDeferredHandler();
    this.errorHandler = builder.errorHandler();
  }

  @Override
  protected DeliveryResult handleDelivery(Envelope envelope) throws Exception {
    return this.deliveryHandler.handle(envelope, this.queue());
  }

  @Override
  protected FlushDeferredResult flushDeferred() throws Exception {
    if (this.flushDeferredHandler == null) {
      return super.flushDeferred();
    } else {
      return this.flushDeferredHandler.flush();
    }
  }

  @Override
  protected void handleException(Exception exception) {
    if (this.errorHandler != null) {
      this.errorHandler.handle(exception);
    }
  }
}
