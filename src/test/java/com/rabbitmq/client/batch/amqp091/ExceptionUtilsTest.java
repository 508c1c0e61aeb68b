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

import static com.rabbitmq.client.batch.amqp091.ExceptionUtils.convert;
import static com.rabbitmq.client.batch.amqp091.ExceptionUtils.convertExchangeError;
import static com.rabbitmq.client.batch.amqp091.ExceptionUtils.convertQueueError;
import static org.assertj.core.api.Assertions.assertThat;

import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.batch.AmqpException;
import com.rabbitmq.client.batch.AmqpException.AmqpChannelException;
import com.rabbitmq.client.batch.AmqpException.AmqpConnectionException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

public class ExceptionUtilsTest {

  @Test
  void convertTest() {
    assertThat(convert(hardError())).isInstanceOf(AmqpConnectionException.class);
    assertThat(convert(softError())).isInstanceOf(AmqpChannelException.class);
    assertThat(convert(new IOException("", softError())))
        .isInstanceOf(AmqpChannelException.class)
        .hasCauseInstanceOf(IOException.class);
    assertThat(convert(new IOException("", hardError())))
        .isInstanceOf(AmqpConnectionException.class);
    assertThat(convert(new TimeoutException())).isInstanceOf(AmqpConnectionException.class);
    assertThat(convert(new IOException("connection reset")))
        .isExactlyInstanceOf(AmqpException.class)
        .hasMessage("connection reset")
        .hasCauseInstanceOf(IOException.class);

    AmqpException alreadyConverted = new AmqpException("already converted");
    assertThat(convert(alreadyConverted)).isSameAs(alreadyConverted);
  }

  @Test
  void messageShouldBeFormatted() {
    assertThat(convert(new IOException(), "Error while closing channel %d", 3))
        .hasMessage("Error while closing channel 3");
  }

  @Test
  void resourceErrorsShouldBeNarrowed() {
    assertThat(convertQueueError(new IOException(), "Error on queue '%s'", "orders"))
        .isInstanceOf(AmqpException.AmqpQueueException.class)
        .hasMessage("Error on queue 'orders'");
    assertThat(convertExchangeError(new IOException(), "Error on exchange '%s'", "logs"))
        .isInstanceOf(AmqpException.AmqpExchangeException.class);
    assertThat(convertQueueError(new IOException("", hardError()), "Error"))
        .isInstanceOf(AmqpConnectionException.class);
  }

  private static ShutdownSignalException hardError() {
    return new ShutdownSignalException(true, false, null, null);
  }

  private static ShutdownSignalException softError() {
    return new ShutdownSignalException(false, false, null, null);
  }
}
