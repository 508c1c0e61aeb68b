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
 * Root of the exceptions raised by the broker adapter.
 *
 * <p>Errors raised by application handlers never surface as this type, the consumer loop turns
 * them into a settlement decision.
 */
public class AmqpException extends RuntimeException {

  public AmqpException(Throwable cause) {
    super(cause);
  }

  public AmqpException(String format, Object... args) {
    super(String.format(format, args));
  }

  public AmqpException(String message, Throwable cause) {
    super(message, cause);
  }

  /** The connection failed or was closed by the broker. */
  public static class AmqpConnectionException extends AmqpException {

    public AmqpConnectionException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The channel failed or was closed by the broker (e.g. unknown delivery tag). */
  public static class AmqpChannelException extends AmqpException {

    public AmqpChannelException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** A queue operation failed (declare, bind, consume, settle...). */
  public static class AmqpQueueException extends AmqpException {

    public AmqpQueueException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** An exchange operation failed (declare, bind, publish...). */
  public static class AmqpExchangeException extends AmqpException {

    public AmqpExchangeException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
