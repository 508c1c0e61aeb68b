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

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.batch.Channel;
import com.rabbitmq.client.batch.Connection;
import com.rabbitmq.client.batch.Exchange;
import com.rabbitmq.client.batch.Queue;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpClientChannel implements Channel {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpClientChannel.class);

  private final Connection connection;
  private final com.rabbitmq.client.Channel delegate;

  AmqpClientChannel(Connection connection, com.rabbitmq.client.Channel delegate) {
    this.connection = connection;
    this.delegate = delegate;
  }

  @Override
  public Exchange newExchange() {
    return new AmqpClientExchange(this);
  }

  @Override
  public Queue newQueue() {
    return new AmqpClientQueue(this);
  }

  @Override
  public void qos(int prefetchSize, int prefetchCount, boolean global) {
    try {
      this.delegate.basicQos(prefetchSize, prefetchCount, global);
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convert(
          e, "Error while setting prefetch count to %d on channel", prefetchCount);
    }
  }

  @Override
  public Connection connection() {
    return this.connection;
  }

  @Override
  public boolean isOpen() {
    return this.delegate.isOpen();
  }

  @Override
  public void close() {
    if (this.delegate.isOpen()) {
      try {
        this.delegate.close();
      } catch (AlreadyClosedException e) {
        LOGGER.debug("Channel {} already closed", this.delegate.getChannelNumber());
      } catch (IOException | TimeoutException e) {
        throw ExceptionUtils.convert(e, "Error while closing channel");
      }
    }
  }

  com.rabbitmq.client.Channel delegate() {
    return this.delegate;
  }
}
