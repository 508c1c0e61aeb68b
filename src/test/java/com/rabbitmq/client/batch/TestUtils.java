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

import static org.assertj.core.api.Assertions.fail;

import java.time.Duration;
import java.util.function.Supplier;

public abstract class TestUtils {

  static final Duration DEFAULT_CONDITION_TIMEOUT = Duration.ofSeconds(10);
  static final Duration DEFAULT_WAIT_TIME = Duration.ofMillis(50);

  private TestUtils() {}

  public static Thread submitTask(Runnable task) {
    Thread thread = new Thread(task, "test-consumer");
    thread.setDaemon(true);
    thread.start();
    return thread;
  }

  @FunctionalInterface
  public interface CallableBooleanSupplier {
    boolean getAsBoolean() throws Exception;
  }

  public static Duration waitAtMost(CallableBooleanSupplier condition) {
    return waitAtMost(DEFAULT_CONDITION_TIMEOUT, condition, null);
  }

  public static Duration waitAtMost(Duration timeout, CallableBooleanSupplier condition) {
    return waitAtMost(timeout, condition, null);
  }

  public static Duration waitAtMost(
      Duration timeout, CallableBooleanSupplier condition, Supplier<String> message) {
    long start = System.nanoTime();
    try {
      while (System.nanoTime() - start <= timeout.toNanos()) {
        if (condition.getAsBoolean()) {
          return Duration.ofNanos(System.nanoTime() - start);
        }
        Thread.sleep(DEFAULT_WAIT_TIME.toMillis());
      }
      String msg;
      if (message == null) {
        msg = "Waited " + timeout.getSeconds() + " second(s), condition never got true";
      } else {
        msg = "Waited " + timeout.getSeconds() + " second(s), " + message.get();
      }
      fail(msg);
      return timeout;
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }
}
