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
 * Channel on a {@link Connection}.
 *
 * <p>A channel is not meant to be used concurrently by several consumers.
 */
public interface Channel extends AutoCloseable {

  Exchange newExchange();

  Queue newQueue();

  /**
   * Set the prefetch settings of the channel.
   *
   * @param prefetchSize maximum amount of content (in bytes), 0 for unlimited
   * @param prefetchCount maximum number of unacknowledged messages, 0 for unlimited
   * @param global whether the settings apply to the whole channel or to each consumer
   */
  void qos(int prefetchSize, int prefetchCount, boolean global);

  Connection connection();

  boolean isOpen();

  @Override
  void close();
}
