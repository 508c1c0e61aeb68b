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

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

public class DeferredBatchTest {

  @Test
  void highestTagShouldBeLastTagAdded() {
    DeferredBatch batch = new DeferredBatch();
    assertThat(batch.isEmpty()).isTrue();
    assertThat(batch.highestTag()).isZero();

    batch.add(3);
    batch.add(5);
    batch.add(8);

    assertThat(batch.size()).isEqualTo(3);
    assertThat(batch.highestTag()).isEqualTo(8);
    assertThat(batch.tags()).containsExactly(3L, 5L, 8L);
  }

  @Test
  void clearShouldResetBatch() {
    DeferredBatch batch = new DeferredBatch();
    batch.add(1);
    batch.add(2);

    batch.clear();

    assertThat(batch.isEmpty()).isTrue();
    assertThat(batch.highestTag()).isZero();
    assertThat(batch.tags()).isEmpty();
  }
}
