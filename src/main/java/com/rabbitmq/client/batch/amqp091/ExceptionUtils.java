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

import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.batch.AmqpException;
import java.util.concurrent.TimeoutException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  static AmqpException convert(Exception e) {
    return convert(e, null);
  }

  static AmqpException convert(Exception e, String format, Object... args) {
    if (e instanceof AmqpException) {
      return (AmqpException) e;
    }
    String message = format == null ? e.getMessage() : String.format(format, args);
    ShutdownSignalException shutdownSignal = shutdownSignal(e);
    if (shutdownSignal != null) {
      if (shutdownSignal.isHardError()) {
        return new AmqpException.AmqpConnectionException(message, e);
      } else {
        return new AmqpException.AmqpChannelException(message, e);
      }
    } else if (e instanceof TimeoutException) {
      return new AmqpException.AmqpConnectionException(message, e);
    } else {
      return new AmqpException(message, e);
    }
  }

  static AmqpException convertQueueError(Exception e, String format, Object... args) {
    AmqpException result = convert(e, format, args);
    if (isGeneric(result)) {
      result = new AmqpException.AmqpQueueException(result.getMessage(), e);
    }
    return result;
  }

  static AmqpException convertExchangeError(Exception e, String format, Object... args) {
    AmqpException result = convert(e, format, args);
    if (isGeneric(result)) {
      result = new AmqpException.AmqpExchangeException(result.getMessage(), e);
    }
    return result;
  }

  private static boolean isGeneric(AmqpException e) {
    return AmqpException.class.equals(e.getClass());
  }

  private static ShutdownSignalException shutdownSignal(Throwable e) {
    Throwable current = e;
    // the client wraps shutdown signals in IOExceptions for synchronous calls
    while (current != null) {
      if (current instanceof ShutdownSignalException) {
        return (ShutdownSignalException) current;
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return null;
  }
}
