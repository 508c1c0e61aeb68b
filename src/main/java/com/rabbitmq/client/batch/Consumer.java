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
 * API to consume messages from a queue and settle them, one by one or in batches.
 *
 * <p>Instances are configured and created with a {@link ConsumerBuilder}. A consumer is not
 * thread-safe, except for {@link #shutdown()} which can be called from any thread.
 *
 * @see ConsumerBuilder
 */
public interface Consumer extends AutoCloseable, Resource {

  /**
   * Consume messages until <code>maxMessages</code> have been handled or the consumer is shut
   * down.
   *
   * <p>The call blocks the calling thread. Deferred messages are always settled before it returns.
   *
   * @param maxMessages the number of messages to handle, 0 to consume until shut down
   */
  void consume(int maxMessages);

  /**
   * Request the consumer to stop.
   *
   * <p>The consumer finishes the current message, settles the deferred batch and returns from
   * {@link #consume(int)}.
   */
  void shutdown();

  /**
   * Return the number of messages received and not settled yet.
   *
   * @return unacknowledged message count
   */
  long unacknowledgedMessageCount();

  /** Release the resources of the consumer (e.g. the JVM shutdown hook). */
  @Override
  void close();

  /** Contract to process a message. */
  @FunctionalInterface
  interface DeliveryHandler {

    /**
     * Process a message.
     *
     * @param envelope the message
     * @param queue the queue the message comes from
     * @return the outcome of the processing
     * @throws Exception if the processing fails, the message is then rejected and requeued
     */
    DeliveryResult handle(Envelope envelope, Queue queue) throws Exception;
  }

  /** Contract to decide on the outcome of a batch of deferred messages. */
  @FunctionalInterface
  interface FlushDeferredHandler {

    /**
     * Decide what to do with the deferred messages.
     *
     * @return the outcome for the whole batch
     * @throws Exception if the decision fails, the batch is then rejected
     */
    FlushDeferredResult flush() throws Exception;
  }

  /** Contract to be notified of handler failures. */
  @FunctionalInterface
  interface ErrorHandler {

    /**
     * Handle a failure of the delivery handler or of the flush handler.
     *
     * @param exception the failure
     */
    void handle(Exception exception);
  }
}
