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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Delivery tags waiting for a batched settlement.
 *
 * <p>Tags are kept in arrival order, which is also the increasing order of tags on a channel.
 */
final class DeferredBatch {

  private final List<Long> tags = new ArrayList<>();
  private long highestTag = 0;

  void add(long deliveryTag) {
    this.tags.add(deliveryTag);
    this.highestTag = Math.max(this.highestTag, deliveryTag);
  }

  int size() {
    return this.tags.size();
  }

  boolean isEmpty() {
    return this.tags.isEmpty();
  }

  /**
   * The tag to use for a <code>multiple</code> settlement of the whole batch.
   *
   * @return highest tag of the batch, 0 if the batch is empty
   */
  long highestTag() {
    return this.highestTag;
  }

  List<Long> tags() {
    return Collections.unmodifiableList(new ArrayList<>(this.tags));
  }

  void clear() {
    this.tags.clear();
    this.highestTag = 0;
  }

  @Override
  public String toString() {
    return "DeferredBatch{" + "size=" + tags.size() + ", highestTag=" + highestTag + '}';
  }
}
