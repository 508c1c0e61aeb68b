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
import com.rabbitmq.client.batch.AmqpException;
import com.rabbitmq.client.batch.Channel;
import com.rabbitmq.client.batch.Connection;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpClientConnection implements Connection {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpClientConnection.class);

  private final com.rabbitmq.client.Connection delegate;

  AmqpClientConnection(com.rabbitmq.client.Connection delegate) {
    this.delegate = delegate;
  }

  @Override
  public Channel newChannel() {
    com.rabbitmq.client.Channel channel;
    try {
      channel = this.delegate.createChannel();
    } catch (IOException | AlreadyClosedException e) {
      throw ExceptionUtils.convert(e, "Error while creating channel");
    }
    if (channel == null) {
      throw new AmqpException.AmqpConnectionException("No channel available on connection", null);
    }
    return new AmqpClientChannel(this, channel);
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
        LOGGER.debug("Connection already closed");
      } catch (IOException e) {
        throw ExceptionUtils.convert(e, "Error while closing connection");
      }
    }
  }

  com.rabbitmq.client.Connection delegate() {
    return this.delegate;
  }
}
